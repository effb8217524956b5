package com.profilebridge.serializer.sourcemap;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SourceResolver} backed by source maps.
 *
 * Each script's map is loaded on first lookup and cached, including the absence of
 * a map and load failures, so a script is never loaded twice. Concurrent lookups for
 * a script whose map is still loading wait for that load; lookups for other scripts
 * do not. Lookup failures fall back to the generated position.
 *
 * Safe to share between serialization calls.
 */
public class SourceMapResolver implements SourceResolver {

    private final SourceMapLoader loader;
    private final ConcurrentHashMap<String, CompletableFuture<Optional<SourceMap>>> cache = new ConcurrentHashMap<>();

    public SourceMapResolver(SourceMapLoader loader) {
        this.loader = loader;
    }

    /** Resolver over every source map found under {@code roots}. */
    public static SourceMapResolver forRoots(List<Path> roots) {
        return new SourceMapResolver(SourceMapIndex.scan(roots));
    }

    @Override
    public Optional<SourceLocation> resolve(SourceLocation generated) {
        if (generated.file() == null || generated.file().isEmpty() || generated.line() <= 0) {
            return Optional.empty();
        }
        Optional<SourceMap> map = mapFor(generated.file());
        if (map.isEmpty()) {
            return Optional.empty();
        }
        int column = generated.column() > 0 ? generated.column() - 1 : 0;
        try {
            return map.get().originalPositionFor(generated.line(), column, generated.name());
        } catch (RuntimeException e) {
            System.err.println("[profile-serializer] WARNING: source map lookup failed for "
                    + generated.file() + ":" + generated.line() + ":" + generated.column()
                    + ", using generated position: " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Number of scripts whose map (or lack of one) has been cached. */
    public int cachedScriptCount() {
        return cache.size();
    }

    /**
     * The load runs outside the map's locks: the first caller for a script installs a
     * future and completes it, later callers wait on that future.
     */
    private Optional<SourceMap> mapFor(String scriptPath) {
        CompletableFuture<Optional<SourceMap>> pending = new CompletableFuture<>();
        CompletableFuture<Optional<SourceMap>> existing = cache.putIfAbsent(scriptPath, pending);
        if (existing != null) {
            return existing.join();
        }
        try {
            pending.complete(loadOnce(scriptPath));
        } catch (Error e) {
            pending.completeExceptionally(e);
            throw e;
        }
        return pending.join();
    }

    private Optional<SourceMap> loadOnce(String scriptPath) {
        try {
            Optional<SourceMap> map = loader.load(scriptPath);
            return map != null ? map : Optional.empty();
        } catch (Exception e) {
            System.err.println("[profile-serializer] WARNING: could not load source map for "
                    + scriptPath + ", using generated positions: " + e.getMessage());
            return Optional.empty();
        }
    }
}
