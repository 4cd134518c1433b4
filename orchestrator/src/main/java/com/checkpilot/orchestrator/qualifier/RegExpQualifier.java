package com.checkpilot.orchestrator.qualifier;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Selects job ids matching a regular expression over the whole id.
 * {@code pattern} is kept as written (after namespace qualification) so that
 * a job whose id equals it literally can be given priority.
 */
public final class RegExpQualifier implements JobQualifier {

    private final String pattern;
    private final Pattern regex;

    /** @throws PatternSyntaxException if {@code pattern} is not a valid expression */
    public RegExpQualifier(String pattern) {
        this.pattern = pattern;
        this.regex   = Pattern.compile("^(?:" + pattern + ")$");
    }

    @Override
    public boolean designates(String jobId) {
        return regex.matcher(jobId).matches();
    }

    @Override
    public String origin() {
        return pattern;
    }

    public String pattern() { return pattern; }

    @Override
    public String toString() {
        return "RegExpQualifier[" + pattern + "]";
    }
}
