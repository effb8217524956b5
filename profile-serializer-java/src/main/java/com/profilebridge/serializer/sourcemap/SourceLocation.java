package com.profilebridge.serializer.sourcemap;

/**
 * A position in a script, 1-based line and column (0 when unknown), together with
 * the name of the function the runtime attributed to it.
 */
public record SourceLocation(String file, int line, int column, String name) {}
