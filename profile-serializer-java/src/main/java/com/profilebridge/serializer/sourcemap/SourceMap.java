package com.profilebridge.serializer.sourcemap;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A parsed Source Map v3 document.
 *
 * Only the fields needed for position lookup are decoded: {@code sources},
 * {@code sourceRoot}, {@code names} and the Base64 VLQ {@code mappings}.
 */
public final class SourceMap {

    private static final Gson GSON = new Gson();
    private static final String BASE64 = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    /** Raw JSON shape of a v3 map. */
    static class SourceMapJson {
        @SerializedName("version")    int version;
        @SerializedName("file")       String file;
        @SerializedName("sourceRoot") String sourceRoot;
        @SerializedName("sources")    List<String> sources;
        @SerializedName("names")      List<String> names;
        @SerializedName("mappings")   String mappings;
    }

    /** One decoded mapping segment; all positions 0-based. */
    record Segment(int generatedColumn, int sourceIndex, int originalLine, int originalColumn, int nameIndex) {}

    private final Path mapDirectory;
    private final String sourceRoot;
    private final List<String> sources;
    private final List<String> names;
    private final List<List<Segment>> lines;

    private SourceMap(Path mapDirectory, SourceMapJson json) {
        this.mapDirectory = mapDirectory;
        this.sourceRoot = json.sourceRoot != null ? json.sourceRoot : "";
        this.sources = json.sources != null ? json.sources : Collections.emptyList();
        this.names = json.names != null ? json.names : Collections.emptyList();
        this.lines = decode(json.mappings != null ? json.mappings : "");
    }

    /**
     * Reads and decodes the map at {@code mapFile}. Original sources are resolved
     * relative to the map's directory.
     *
     * @throws IOException if the file cannot be read or is not a v3 source map
     */
    public static SourceMap read(Path mapFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(mapFile)) {
            return parse(mapFile.toAbsolutePath().getParent(), reader);
        }
    }

    static SourceMap parse(Path mapDirectory, Reader reader) throws IOException {
        SourceMapJson json;
        try {
            json = GSON.fromJson(reader, SourceMapJson.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed source map: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new IOException("Source map is empty");
        }
        if (json.version != 3) {
            throw new IOException("Unsupported source map version: " + json.version);
        }
        try {
            return new SourceMap(mapDirectory, json);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed source map mappings: " + e.getMessage(), e);
        }
    }

    /**
     * Finds the original position for a generated one, using the closest segment
     * at or before {@code generatedColumn} on the same line.
     *
     * @param generatedLine   1-based generated line
     * @param generatedColumn 0-based generated column
     */
    public Optional<SourceLocation> originalPositionFor(int generatedLine, int generatedColumn, String generatedName) {
        int lineIndex = generatedLine - 1;
        if (lineIndex < 0 || lineIndex >= lines.size()) {
            return Optional.empty();
        }
        Segment best = null;
        for (Segment segment : lines.get(lineIndex)) {
            if (segment.generatedColumn() > generatedColumn) break;
            best = segment;
        }
        if (best == null || best.sourceIndex() < 0) {
            return Optional.empty();
        }
        if (best.sourceIndex() >= sources.size()) {
            throw new IllegalStateException("Mapping references source index " + best.sourceIndex()
                    + " but map lists " + sources.size() + " sources");
        }
        String source = sourcePath(sources.get(best.sourceIndex()));
        String file = mapDirectory != null
                ? mapDirectory.resolve(source).normalize().toString()
                : source;
        String name = best.nameIndex() >= 0 && best.nameIndex() < names.size()
                ? names.get(best.nameIndex())
                : generatedName;
        return Optional.of(new SourceLocation(file, best.originalLine() + 1, best.originalColumn() + 1, name));
    }

    /** Joins {@code sourceRoot} and a source name as path segments. */
    private String sourcePath(String source) {
        if (sourceRoot.isEmpty()) {
            return source;
        }
        return sourceRoot.endsWith("/") ? sourceRoot + source : sourceRoot + "/" + source;
    }

    // -----------------------------------------------------------------------
    // VLQ decoding
    // -----------------------------------------------------------------------

    private static List<List<Segment>> decode(String mappings) {
        List<List<Segment>> result = new ArrayList<>();
        int sourceIndex = 0;
        int originalLine = 0;
        int originalColumn = 0;
        int nameIndex = 0;

        for (String line : mappings.split(";", -1)) {
            List<Segment> segments = new ArrayList<>();
            int generatedColumn = 0;
            if (!line.isEmpty()) {
                for (String encoded : line.split(",")) {
                    if (encoded.isEmpty()) continue;
                    int[] fields = decodeVlq(encoded);
                    generatedColumn += fields[0];
                    if (fields.length == 1) {
                        segments.add(new Segment(generatedColumn, -1, -1, -1, -1));
                        continue;
                    }
                    if (fields.length < 4) {
                        throw new IllegalArgumentException("Segment has " + fields.length + " fields: " + encoded);
                    }
                    sourceIndex += fields[1];
                    originalLine += fields[2];
                    originalColumn += fields[3];
                    int segmentName = -1;
                    if (fields.length >= 5) {
                        nameIndex += fields[4];
                        segmentName = nameIndex;
                    }
                    segments.add(new Segment(generatedColumn, sourceIndex, originalLine, originalColumn, segmentName));
                }
            }
            segments.sort(Comparator.comparingInt(Segment::generatedColumn));
            result.add(segments);
        }
        return result;
    }

    static int[] decodeVlq(String encoded) {
        List<Integer> values = new ArrayList<>();
        int value = 0;
        int shift = 0;
        for (int i = 0; i < encoded.length(); i++) {
            int digit = BASE64.indexOf(encoded.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base64 VLQ character '" + encoded.charAt(i) + "'");
            }
            value += (digit & 0x1f) << shift;
            if ((digit & 0x20) != 0) {
                shift += 5;
                if (shift > 30) {
                    throw new IllegalArgumentException("Base64 VLQ value does not fit in 32 bits: " + encoded);
                }
                continue;
            }
            boolean negative = (value & 1) == 1;
            value >>>= 1;
            values.add(negative ? -value : value);
            value = 0;
            shift = 0;
        }
        if (shift != 0) {
            throw new IllegalArgumentException("Truncated base64 VLQ value: " + encoded);
        }
        int[] out = new int[values.size()];
        for (int i = 0; i < out.length; i++) out[i] = values.get(i);
        return out;
    }
}
