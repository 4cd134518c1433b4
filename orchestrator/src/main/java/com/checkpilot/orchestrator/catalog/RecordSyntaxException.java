package com.checkpilot.orchestrator.catalog;

/** Malformed record text; carries the 1-based line the parser stopped at. */
public class RecordSyntaxException extends RuntimeException {

    private final String origin;
    private final int line;

    public RecordSyntaxException(String origin, int line, String message) {
        super(origin + ":" + line + ": " + message);
        this.origin = origin;
        this.line   = line;
    }

    public String getOrigin() { return origin; }
    public int    getLine()   { return line; }
}
