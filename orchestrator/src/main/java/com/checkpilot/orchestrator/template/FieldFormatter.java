package com.checkpilot.orchestrator.template;

import java.util.Map;

/**
 * Substitutes <code>{name}</code> placeholders in a template field.
 * Doubled braces stand for literal ones.
 */
final class FieldFormatter {

    private FieldFormatter() {}

    static String format(String templateId, String field, String pattern, Map<String, String> params) {
        StringBuilder out = new StringBuilder(pattern.length() + 16);
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '{') {
                if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = pattern.indexOf('}', i + 1);
                if (close < 0) {
                    throw new TemplateException(templateId,
                            "field '" + field + "': single '{' encountered in pattern");
                }
                String name = pattern.substring(i + 1, close).strip();
                if (name.isEmpty() || name.indexOf('{') >= 0) {
                    throw new TemplateException(templateId,
                            "field '" + field + "': malformed placeholder '" + pattern.substring(i, close + 1) + "'");
                }
                String value = params.get(name);
                if (value == null) {
                    throw new TemplateException(templateId,
                            "field '" + field + "': record has no attribute '" + name + "'");
                }
                out.append(value);
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new TemplateException(templateId,
                        "field '" + field + "': single '}' encountered in pattern");
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
