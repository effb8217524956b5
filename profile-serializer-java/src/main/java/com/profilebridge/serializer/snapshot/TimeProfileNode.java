package com.profilebridge.serializer.snapshot;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * One vertex of the CPU profiler's top-down call tree.
 */
public final class TimeProfileNode implements ProfileNode {

    @SerializedName("name")         private String name;
    @SerializedName("scriptName")   private String scriptName;
    @SerializedName("scriptId")     private int scriptId;
    @SerializedName("lineNumber")   private int lineNumber;
    @SerializedName("columnNumber") private int columnNumber;
    @SerializedName("hitCount")     private long hitCount;
    @SerializedName("children")     private List<TimeProfileNode> children;

    /** Present only when the capture ran with line-level detail. */
    @SerializedName("lineTicks")    private List<LineTick> lineTicks;

    private TimeProfileNode() {}

    public TimeProfileNode(
            String name, String scriptName, int scriptId,
            int lineNumber, int columnNumber, long hitCount,
            List<TimeProfileNode> children, List<LineTick> lineTicks
    ) {
        this.name = name;
        this.scriptName = scriptName;
        this.scriptId = scriptId;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.hitCount = hitCount;
        this.children = children != null ? List.copyOf(children) : null;
        this.lineTicks = lineTicks != null ? List.copyOf(lineTicks) : null;
    }

    public TimeProfileNode(
            String name, String scriptName, int scriptId,
            int lineNumber, int columnNumber, long hitCount,
            List<TimeProfileNode> children
    ) {
        this(name, scriptName, scriptId, lineNumber, columnNumber, hitCount, children, null);
    }

    @Override public String getName()       { return name != null ? name : ""; }
    @Override public String getScriptName() { return scriptName != null ? scriptName : ""; }
    @Override public int getScriptId()      { return scriptId; }
    @Override public int getLineNumber()    { return lineNumber; }
    @Override public int getColumnNumber()  { return columnNumber; }
    public long getHitCount()               { return hitCount; }

    @Override
    public List<TimeProfileNode> getChildren() {
        return children != null ? Collections.unmodifiableList(children) : Collections.emptyList();
    }

    public List<LineTick> getLineTicks() {
        return lineTicks != null ? Collections.unmodifiableList(lineTicks) : Collections.emptyList();
    }
}
