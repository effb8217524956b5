package com.profilebridge.serializer.sourcemap;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the {@code *.map} files under a set of root directories and remembers which
 * generated script each one describes, without decoding any mappings.
 *
 * The generated script is taken from the map's {@code file} property, resolved
 * against the map's directory; maps without it are assumed to sit next to their
 * script as {@code <script>.map}.
 */
public class SourceMapIndex implements SourceMapLoader {

    private final Map<String, Path> mapFilesByScript;

    SourceMapIndex(Map<String, Path> mapFilesByScript) {
        this.mapFilesByScript = Map.copyOf(mapFilesByScript);
    }

    /**
     * Scans every root recursively. Unreadable roots and unreadable maps are reported
     * and skipped.
     */
    public static SourceMapIndex scan(List<Path> roots) {
        Map<String, Path> index = new HashMap<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                System.err.println("[profile-serializer] WARNING: source map root is not a directory: " + root);
                continue;
            }
            for (Path mapFile : listMapFiles(root)) {
                try {
                    String script = generatedScriptFor(mapFile);
                    Path previous = index.putIfAbsent(script, mapFile);
                    if (previous != null) {
                        System.err.println("[profile-serializer] WARNING: " + script + " is described by both "
                                + previous + " and " + mapFile + "; keeping the first");
                    }
                } catch (IOException e) {
                    System.err.println("[profile-serializer] WARNING: could not read source map "
                            + mapFile + ": " + e.getMessage());
                }
            }
        }
        System.err.println("[profile-serializer] Indexed " + index.size() + " source maps");
        return new SourceMapIndex(index);
    }

    @Override
    public Optional<SourceMap> load(String scriptPath) throws IOException {
        Path mapFile = mapFilesByScript.get(normalize(scriptPath));
        if (mapFile == null) {
            return Optional.empty();
        }
        return Optional.of(SourceMap.read(mapFile));
    }

    public boolean hasMapFor(String scriptPath) {
        return mapFilesByScript.containsKey(normalize(scriptPath));
    }

    public Map<String, Path> entries() {
        return Collections.unmodifiableMap(mapFilesByScript);
    }

    private static List<Path> listMapFiles(Path root) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".map"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[profile-serializer] WARNING: could not scan source map root " + root
                    + ": " + e.getMessage());
            return Collections.emptyList();
        }
    }

    /** Reads only the top-level {@code file} property of a map. */
    static String generatedScriptFor(Path mapFile) throws IOException {
        Path dir = mapFile.toAbsolutePath().getParent();
        String file = null;
        try (Reader r = Files.newBufferedReader(mapFile); JsonReader json = new JsonReader(r)) {
            json.beginObject();
            while (json.hasNext()) {
                String key = json.nextName();
                if (key.equals("file") && json.peek() == JsonToken.STRING) {
                    file = json.nextString();
                    break;
                }
                json.skipValue();
            }
        } catch (IllegalStateException e) {
            throw new IOException("Not a JSON object: " + e.getMessage(), e);
        }
        if (file == null || file.isEmpty()) {
            String mapName = mapFile.getFileName().toString();
            return normalize(dir.resolve(mapName.substring(0, mapName.length() - ".map".length())).toString());
        }
        return normalize(dir.resolve(file).toString());
    }

    private static String normalize(String scriptPath) {
        try {
            return Path.of(scriptPath).toAbsolutePath().normalize().toString();
        } catch (InvalidPathException e) {
            return scriptPath;
        }
    }
}
