package com.profilebridge.serializer.snapshot;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * One vertex of the sampling heap profiler's allocation tree.
 */
public final class AllocationProfileNode implements ProfileNode {

    @SerializedName("name")         private String name;
    @SerializedName("scriptName")   private String scriptName;
    @SerializedName("scriptId")     private int scriptId;
    @SerializedName("lineNumber")   private int lineNumber;
    @SerializedName("columnNumber") private int columnNumber;
    @SerializedName("allocations")  private List<Allocation> allocations;
    @SerializedName("children")     private List<AllocationProfileNode> children;

    private AllocationProfileNode() {}

    public AllocationProfileNode(
            String name, String scriptName, int scriptId,
            int lineNumber, int columnNumber,
            List<Allocation> allocations, List<AllocationProfileNode> children
    ) {
        this.name = name;
        this.scriptName = scriptName;
        this.scriptId = scriptId;
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
        this.allocations = allocations != null ? List.copyOf(allocations) : null;
        this.children = children != null ? List.copyOf(children) : null;
    }

    @Override public String getName()       { return name != null ? name : ""; }
    @Override public String getScriptName() { return scriptName != null ? scriptName : ""; }
    @Override public int getScriptId()      { return scriptId; }
    @Override public int getLineNumber()    { return lineNumber; }
    @Override public int getColumnNumber()  { return columnNumber; }

    public List<Allocation> getAllocations() {
        return allocations != null ? Collections.unmodifiableList(allocations) : Collections.emptyList();
    }

    @Override
    public List<AllocationProfileNode> getChildren() {
        return children != null ? Collections.unmodifiableList(children) : Collections.emptyList();
    }
}
