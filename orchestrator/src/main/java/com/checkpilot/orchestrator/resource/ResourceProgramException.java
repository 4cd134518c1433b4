package com.checkpilot.orchestrator.resource;

/**
 * A requirement expression was rejected at compile time.
 *
 * Never raised while evaluating: a compiled expression either yields a
 * boolean or treats the offending record as not matching.
 */
public class ResourceProgramException extends RuntimeException {

    public enum Kind { SYNTAX, CODE_NOT_ALLOWED, NO_RESOURCES_REFERENCED, MULTIPLE_RESOURCES_REFERENCED }

    private final Kind kind;
    private final String expression;

    public ResourceProgramException(Kind kind, String expression, String message) {
        super("[" + kind + "] " + message + " in '" + expression + "'");
        this.kind       = kind;
        this.expression = expression;
    }

    public Kind   getKind()       { return kind; }
    public String getExpression() { return expression; }
}
