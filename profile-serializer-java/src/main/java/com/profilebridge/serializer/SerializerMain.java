package com.profilebridge.serializer;

import com.profilebridge.serializer.encode.ProfileWriter;
import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.snapshot.AllocationProfileNode;
import com.profilebridge.serializer.snapshot.SnapshotReader;
import com.profilebridge.serializer.snapshot.TimeProfile;
import com.profilebridge.serializer.sourcemap.SourceMapResolver;
import com.profilebridge.serializer.sourcemap.SourceResolver;
import com.profilebridge.serializer.walk.WalkMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: converts a snapshot dumped as JSON into a pprof profile.
 *
 * Usage:
 *   java -jar profile-serializer-java.jar convert \
 *     --snapshot <time-profile.json> --output <dir> \
 *     [--interval <micros>] [--line-numbers] [--source-maps <dir>]...
 *
 *   java -jar profile-serializer-java.jar convert-heap \
 *     --snapshot <allocation-profile.json> --output <dir> \
 *     [--interval-bytes <n>] [--start-nanos <n>] [--ignore-path <substring>] [--source-maps <dir>]...
 */
public class SerializerMain {

    static final int DEFAULT_INTERVAL_BYTES = 512 * 1024;

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[profile-serializer] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar profile-serializer-java.jar convert|convert-heap "
                    + "--snapshot <path> --output <dir> [options]");
            System.exit(2);
        } catch (ProfileSerializationException e) {
            System.err.println("[profile-serializer] FATAL (" + e.getReason() + "): " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("[profile-serializer] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static Path run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        boolean heap = switch (args[0]) {
            case "convert" -> false;
            case "convert-heap" -> true;
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        };

        String snapshotPath = null;
        String outputDir = null;
        long interval = 0;
        long startNanos = -1;
        boolean lineNumbers = false;
        String ignorePath = null;
        List<Path> sourceMapRoots = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--snapshot"       -> snapshotPath = requireNext(args, i++, "--snapshot");
                case "--output"         -> outputDir    = requireNext(args, i++, "--output");
                case "--source-maps"    -> sourceMapRoots.add(Paths.get(requireNext(args, i++, "--source-maps")));
                case "--line-numbers"   -> lineNumbers  = true;
                case "--ignore-path"    -> ignorePath   = requireNext(args, i++, "--ignore-path");
                case "--interval"       -> interval     = parsePositive(requireNext(args, i++, "--interval"), "--interval");
                case "--interval-bytes" -> interval     = parsePositive(requireNext(args, i++, "--interval-bytes"), "--interval-bytes");
                case "--start-nanos"    -> startNanos   = parsePositive(requireNext(args, i++, "--start-nanos"), "--start-nanos");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (snapshotPath == null) throw new UsageException("--snapshot is required");
        if (outputDir == null)    throw new UsageException("--output is required");
        if (!heap && (ignorePath != null || startNanos >= 0)) {
            throw new UsageException("--ignore-path and --start-nanos only apply to convert-heap");
        }
        if (heap && lineNumbers) {
            throw new UsageException("--line-numbers only applies to convert");
        }

        SourceResolver resolver = sourceMapRoots.isEmpty()
                ? SourceResolver.identity()
                : SourceMapResolver.forRoots(sourceMapRoots);
        ProfileSerializer serializer = new ProfileSerializer();
        SnapshotReader reader = new SnapshotReader();
        Path snapshot = Paths.get(snapshotPath);

        ProfileModel.Profile profile;
        if (heap) {
            System.err.println("[profile-serializer] Reading allocation profile: " + snapshot);
            AllocationProfileNode root = reader.readAllocationProfile(snapshot);
            profile = serializer.serializeHeapProfile(
                    root,
                    startNanos >= 0 ? startNanos : System.currentTimeMillis() * 1_000_000L,
                    interval > 0 ? interval : DEFAULT_INTERVAL_BYTES,
                    ignorePath,
                    resolver);
        } else {
            System.err.println("[profile-serializer] Reading time profile: " + snapshot);
            TimeProfile timeProfile = reader.readTimeProfile(snapshot);
            profile = serializer.serializeTimeProfile(
                    timeProfile,
                    interval > 0 ? interval : 1000,
                    resolver,
                    lineNumbers ? WalkMode.LINE_LEVEL : WalkMode.FUNCTION_LEVEL);
        }

        Path written = new ProfileWriter().write(profile, Paths.get(outputDir), heap ? "heap" : "time");
        System.err.println("[profile-serializer] Done.");
        return written;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static long parsePositive(String value, String flag) {
        try {
            long parsed = Long.parseLong(value);
            if (parsed <= 0) {
                throw new UsageException(flag + " must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " is not a number: " + value);
        }
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
