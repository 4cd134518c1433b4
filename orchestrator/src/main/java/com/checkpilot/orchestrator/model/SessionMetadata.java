package com.checkpilot.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Free-form session attributes owned by the application driving the session.
 */
public class SessionMetadata {

    public static final String FLAG_INCOMPLETE = "incomplete";
    public static final String FLAG_SUBMITTED  = "submitted";

    private String appId;
    private String title;
    private byte[] appBlob;
    private final Set<String> flags = new LinkedHashSet<>();

    // Job dispatched but not yet recorded; survives a crash or reboot.
    private String runningJobId;

    public String getAppId()        { return appId; }
    public String getTitle()        { return title; }
    public byte[] getAppBlob()      { return appBlob; }
    public String getRunningJobId() { return runningJobId; }

    public Set<String> getFlags()   { return Collections.unmodifiableSet(flags); }
    public boolean hasFlag(String flag) { return flags.contains(flag); }

    public void setAppId(String appId)               { this.appId = appId; }
    public void setTitle(String title)               { this.title = title; }
    public void setAppBlob(byte[] appBlob)           { this.appBlob = appBlob; }
    public void setRunningJobId(String runningJobId) { this.runningJobId = runningJobId; }

    public void addFlag(String flag)    { flags.add(flag); }
    public void removeFlag(String flag) { flags.remove(flag); }
}
