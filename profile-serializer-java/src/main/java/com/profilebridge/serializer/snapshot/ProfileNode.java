package com.profilebridge.serializer.snapshot;

import java.util.List;

/**
 * Identity fields shared by every vertex of a native call tree, whether it came
 * from the CPU profiler or the sampling heap profiler.
 *
 * Implementations normalize absent fields: empty string for names, 0 for ids and
 * positions, an empty list for children.
 */
public interface ProfileNode {

    String getName();

    String getScriptName();

    int getScriptId();

    /** 1-based line of the function declaration, 0 when unknown. */
    int getLineNumber();

    /** 1-based column of the function declaration, 0 when unknown. */
    int getColumnNumber();

    List<? extends ProfileNode> getChildren();
}
