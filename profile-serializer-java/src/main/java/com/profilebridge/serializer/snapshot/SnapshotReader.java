package com.profilebridge.serializer.snapshot;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads snapshots that a profiler binding dumped to disk as JSON.
 */
public class SnapshotReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads a CPU profile snapshot.
     *
     * @throws SnapshotReadException if the file is missing, malformed, or has no call tree
     */
    public TimeProfile readTimeProfile(Path path) {
        TimeProfile profile = read(path, TimeProfile.class);
        if (profile.getTopDownRoot() == null) {
            throw new SnapshotReadException("Time profile has no topDownRoot: " + path);
        }
        return profile;
    }

    /**
     * Reads the root node of an allocation profile snapshot.
     *
     * @throws SnapshotReadException if the file is missing or malformed
     */
    public AllocationProfileNode readAllocationProfile(Path path) {
        return read(path, AllocationProfileNode.class);
    }

    private <T> T read(Path path, Class<T> type) {
        if (!path.toFile().exists()) {
            throw new SnapshotReadException("Snapshot file not found: " + path);
        }
        try (FileReader reader = new FileReader(path.toFile())) {
            T value = GSON.fromJson(reader, type);
            if (value == null) {
                throw new SnapshotReadException("Snapshot file is empty or invalid JSON: " + path);
            }
            return value;
        } catch (FileNotFoundException e) {
            throw new SnapshotReadException("Snapshot file not found: " + path, e);
        } catch (JsonParseException e) {
            throw new SnapshotReadException("Malformed snapshot " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SnapshotReadException("Failed to read snapshot: " + path + ": " + e.getMessage(), e);
        }
    }

    public static class SnapshotReadException extends RuntimeException {
        public SnapshotReadException(String message) { super(message); }
        public SnapshotReadException(String message, Throwable cause) { super(message, cause); }
    }
}
