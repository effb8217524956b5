package com.profilebridge.serializer.walk;

/**
 * Granularity of CPU profile locations.
 */
public enum WalkMode {
    /** One location per call-tree node, at the function's declared line. */
    FUNCTION_LEVEL,
    /** Additionally, one location per line of a function that received hits. */
    LINE_LEVEL
}
