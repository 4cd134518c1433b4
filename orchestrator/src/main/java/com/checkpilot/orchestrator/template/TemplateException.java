package com.checkpilot.orchestrator.template;

/**
 * A template could not be instantiated against a record: a field references
 * an attribute the record lacks, a pattern is malformed, or the produced
 * unit is invalid. Aborts that template only.
 */
public class TemplateException extends RuntimeException {

    private final String templateId;

    public TemplateException(String templateId, String message) {
        super(templateId + ": " + message);
        this.templateId = templateId;
    }

    public TemplateException(String templateId, String message, Throwable cause) {
        super(templateId + ": " + message, cause);
        this.templateId = templateId;
    }

    public String getTemplateId() { return templateId; }
}
