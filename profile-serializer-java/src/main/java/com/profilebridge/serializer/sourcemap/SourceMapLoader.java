package com.profilebridge.serializer.sourcemap;

import java.io.IOException;
import java.util.Optional;

/**
 * Loads the source map describing a generated script, if there is one.
 */
@FunctionalInterface
public interface SourceMapLoader {

    Optional<SourceMap> load(String scriptPath) throws IOException;
}
