package com.checkpilot.orchestrator.model;

/**
 * How a job is executed and how its output is interpreted.
 *
 * LOCAL and RESOURCE jobs feed back into resolution: a local job prints
 * further unit definitions, a resource job prints key/value records that
 * other jobs' requirement expressions are evaluated against.
 */
public enum Plugin {
    SHELL("shell"),
    MANUAL("manual"),
    USER_INTERACT("user-interact"),
    USER_INTERACT_VERIFY("user-interact-verify"),
    ATTACHMENT("attachment"),
    LOCAL("local"),
    RESOURCE("resource"),
    QML("qml");

    private final String value;

    Plugin(String value) {
        this.value = value;
    }

    /** The spelling used in unit files and the session document. */
    public String value() { return value; }

    /** True when the job needs no operator interaction at all. */
    public boolean isAutomated() {
        return switch (this) {
            case SHELL, ATTACHMENT, LOCAL, RESOURCE -> true;
            case MANUAL, USER_INTERACT, USER_INTERACT_VERIFY, QML -> false;
        };
    }

    /** True for plugins whose output generates units or resource records. */
    public boolean isGenerator() {
        return this == LOCAL || this == RESOURCE;
    }

    public static Plugin fromValue(String value) {
        for (Plugin plugin : values()) {
            if (plugin.value.equals(value)) {
                return plugin;
            }
        }
        throw new IllegalArgumentException("unknown plugin: '" + value + "'");
    }
}
