package com.profilebridge.serializer.encode;

import com.google.gson.GsonBuilder;
import com.profilebridge.serializer.profile.ProfileModel;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes an encoded profile to {@code outputDir/profile.pb.gz}, plus a
 * {@code metadata.json} summary next to it.
 */
public class ProfileWriter {

    public static final String PROFILE_FILE = "profile.pb.gz";
    public static final String METADATA_FILE = "metadata.json";

    private final ProfileEncoder encoder;

    public ProfileWriter() {
        this(new ProfileEncoder());
    }

    public ProfileWriter(ProfileEncoder encoder) {
        this.encoder = encoder;
    }

    public static class WriterException extends RuntimeException {
        public WriterException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * @param profileType "time" or "heap", recorded in metadata.json
     * @return path of the written profile
     */
    public Path write(ProfileModel.Profile profile, Path outputDir, String profileType) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new WriterException("Could not create output directory: " + outputDir, e);
        }

        byte[] encoded = encoder.encode(profile);
        Path profilePath = outputDir.resolve(PROFILE_FILE);
        try {
            Files.write(profilePath, encoded);
        } catch (IOException e) {
            throw new WriterException("Failed to write " + PROFILE_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[profile-serializer] " + PROFILE_FILE + " written: " + profilePath
                + " (" + encoded.length + " bytes)");

        var meta = new Metadata(
                profileType,
                profile.samples().size(),
                profile.locations().size(),
                profile.functions().size(),
                profile.mappings().size(),
                encoded.length,
                Instant.now().toString());
        Path metaPath = outputDir.resolve(METADATA_FILE);
        try (Writer w = new FileWriter(metaPath.toFile())) {
            new GsonBuilder().setPrettyPrinting().create().toJson(meta, w);
        } catch (IOException e) {
            throw new WriterException("Failed to write " + METADATA_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[profile-serializer] " + METADATA_FILE + " written: " + metaPath);
        return profilePath;
    }

    /** Summary record for Gson serialization. */
    private record Metadata(
            String profileType,
            int sampleCount,
            int locationCount,
            int functionCount,
            int mappingCount,
            int encodedBytes,
            String timestamp
    ) {}
}
