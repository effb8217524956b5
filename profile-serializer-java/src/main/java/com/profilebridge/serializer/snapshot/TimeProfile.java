package com.profilebridge.serializer.snapshot;

import com.google.gson.annotations.SerializedName;

/**
 * Snapshot returned by the CPU profiler when a capture stops.
 * Start and end times are in microseconds, as reported by the runtime.
 */
public final class TimeProfile {

    @SerializedName("title")       private String title;
    @SerializedName("topDownRoot") private TimeProfileNode topDownRoot;
    @SerializedName("startTime")   private long startTime;
    @SerializedName("endTime")     private long endTime;

    private TimeProfile() {}

    public TimeProfile(String title, TimeProfileNode topDownRoot, long startTime, long endTime) {
        this.title = title;
        this.topDownRoot = topDownRoot;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public String getTitle()               { return title != null ? title : ""; }
    public TimeProfileNode getTopDownRoot() { return topDownRoot; }
    public long getStartTime()             { return startTime; }
    public long getEndTime()               { return endTime; }
}
