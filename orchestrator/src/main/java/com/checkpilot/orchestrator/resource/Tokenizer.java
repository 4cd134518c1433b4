package com.checkpilot.orchestrator.resource;

import java.util.ArrayList;
import java.util.List;

import static com.checkpilot.orchestrator.resource.ResourceProgramException.Kind.SYNTAX;

/**
 * Splits one requirement expression into tokens. String literals are
 * returned with quotes removed and escapes resolved.
 */
final class Tokenizer {

    private static final List<String> OPERATORS = List.of(
            "==", "!=", "<=", ">=", "//",
            "<", ">", "+", "-", "*", "/", "%", "(", ")", "[", "]", ",", ".");

    private final String text;
    private int pos = 0;

    private Tokenizer(String text) {
        this.text = text;
    }

    static List<Token> tokenize(String text) {
        return new Tokenizer(text).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            char c = text.charAt(pos);
            if (Character.isLetter(c) || c == '_') {
                tokens.add(name());
            } else if (Character.isDigit(c)
                    || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                tokens.add(number());
            } else if (c == '\'' || c == '"') {
                tokens.add(string(c));
            } else {
                tokens.add(operator());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private Token name() {
        int start = pos;
        while (pos < text.length()
                && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        return new Token(Token.Type.NAME, text.substring(start, pos), start);
    }

    private Token number() {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) pos++;
            if (pos >= text.length() || !Character.isDigit(text.charAt(pos))) {
                pos = mark;
            } else {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
            }
        }
        if (pos < text.length() && (Character.isLetter(text.charAt(pos)) || text.charAt(pos) == '_')) {
            throw new ResourceProgramException(SYNTAX, text, "invalid number literal at " + start);
        }
        return new Token(Token.Type.NUMBER, text.substring(start, pos), start);
    }

    private Token string(char quote) {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (c == '\\' && pos < text.length()) {
                char e = text.charAt(pos++);
                switch (e) {
                    case 'n'  -> sb.append('\n');
                    case 't'  -> sb.append('\t');
                    case 'r'  -> sb.append('\r');
                    case '0'  -> sb.append('\0');
                    case '\\', '\'', '"' -> sb.append(e);
                    default   -> sb.append('\\').append(e);
                }
            } else {
                sb.append(c);
            }
        }
        throw new ResourceProgramException(SYNTAX, text, "unterminated string literal at " + start);
    }

    private Token operator() {
        for (String op : OPERATORS) {
            if (text.startsWith(op, pos)) {
                Token t = new Token(Token.Type.OPERATOR, op, pos);
                pos += op.length();
                return t;
            }
        }
        throw new ResourceProgramException(SYNTAX, text,
                "unexpected character '" + text.charAt(pos) + "' at " + pos);
    }
}
