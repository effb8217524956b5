package com.profilebridge.serializer.sourcemap;

import java.util.Optional;

/**
 * Translates a generated-code position back to its original source.
 */
@FunctionalInterface
public interface SourceResolver {

    /** Resolver used when no source maps are configured: every position passes through. */
    SourceResolver IDENTITY = generated -> Optional.empty();

    /**
     * @return the original position, or empty when the generated position should be
     *         used as-is (no map for the script, no segment for the position, or the
     *         lookup failed)
     */
    Optional<SourceLocation> resolve(SourceLocation generated);

    static SourceResolver identity() {
        return IDENTITY;
    }
}
