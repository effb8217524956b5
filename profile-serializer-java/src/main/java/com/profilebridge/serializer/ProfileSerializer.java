package com.profilebridge.serializer;

import com.profilebridge.serializer.encode.ProfileEncoder;
import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.snapshot.AllocationProfileNode;
import com.profilebridge.serializer.snapshot.TimeProfile;
import com.profilebridge.serializer.sourcemap.SourceResolver;
import com.profilebridge.serializer.walk.ProfileTreeWalker;
import com.profilebridge.serializer.walk.SampleAggregator;
import com.profilebridge.serializer.walk.WalkMode;

/**
 * Converts profiler snapshots into canonical profile documents and encodes them.
 *
 * Every call builds a fresh document with its own tables; the only state that may
 * outlive a call is inside the {@link SourceResolver} the caller passes in.
 */
public class ProfileSerializer {

    private final ProfileEncoder encoder = new ProfileEncoder();

    /**
     * Builds a CPU profile document. Sample values are {@code [count, wall microseconds]}.
     *
     * @param intervalMicros sampling interval the capture ran with
     * @param sourceResolver may be null, meaning positions are used as generated
     * @throws ProfileSerializationException {@code NO_ACTIVE_CAPTURE} if there is no snapshot,
     *         {@code INTERNAL_ERROR} if the interval is not positive or the timestamps overflow
     */
    public ProfileModel.Profile serializeTimeProfile(
            TimeProfile snapshot, long intervalMicros, SourceResolver sourceResolver, WalkMode mode) {
        if (snapshot == null || snapshot.getTopDownRoot() == null) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.NO_ACTIVE_CAPTURE,
                    "No time profile snapshot to serialize");
        }
        if (intervalMicros <= 0) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.INTERNAL_ERROR,
                    "Sampling interval must be positive: " + intervalMicros);
        }
        try {
            ProfileModel.Profile profile = new ProfileModel.Profile()
                    .addSampleType("sample", "count")
                    .addSampleType("wall", "microseconds")
                    .setPeriodType("wall", "microseconds")
                    .setPeriod(intervalMicros)
                    .setTimeNanos(Math.multiplyExact(snapshot.getStartTime(), 1000L))
                    .setDurationNanos(Math.multiplyExact(
                            Math.subtractExact(snapshot.getEndTime(), snapshot.getStartTime()), 1000L));

            SampleAggregator aggregator = SampleAggregator.forCpu(intervalMicros);
            new ProfileTreeWalker(profile, sourceResolver)
                    .walkTimeProfile(snapshot.getTopDownRoot(), mode != null ? mode : WalkMode.FUNCTION_LEVEL, aggregator);
            profile.addSamples(aggregator.samples());

            log("time", profile);
            return profile;
        } catch (ArithmeticException e) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.INTERNAL_ERROR,
                    "Profile timestamps out of range: " + e.getMessage(), e);
        } catch (OutOfMemoryError e) {
            throw resourceExhausted(e);
        }
    }

    /**
     * Builds a heap profile document. Sample values are {@code [objects, bytes]}.
     *
     * @param startTimeNanos wall-clock time the allocation profile was taken
     * @param intervalBytes  average bytes between heap samples
     * @param ignorePath     skip nodes (and their subtrees) whose script name contains this; may be null
     * @param sourceResolver may be null, meaning positions are used as generated
     * @throws ProfileSerializationException {@code NO_ACTIVE_CAPTURE} if there is no snapshot
     */
    public ProfileModel.Profile serializeHeapProfile(
            AllocationProfileNode root, long startTimeNanos, long intervalBytes,
            String ignorePath, SourceResolver sourceResolver) {
        if (root == null) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.NO_ACTIVE_CAPTURE,
                    "No allocation profile snapshot to serialize");
        }
        try {
            ProfileModel.Profile profile = new ProfileModel.Profile()
                    .addSampleType("objects", "count")
                    .addSampleType("space", "bytes")
                    .setPeriodType("space", "bytes")
                    .setPeriod(intervalBytes)
                    .setTimeNanos(startTimeNanos);

            SampleAggregator aggregator = SampleAggregator.forHeap();
            new ProfileTreeWalker(profile, sourceResolver).walkAllocationProfile(root, ignorePath, aggregator);
            profile.addSamples(aggregator.samples());

            log("heap", profile);
            return profile;
        } catch (OutOfMemoryError e) {
            throw resourceExhausted(e);
        }
    }

    /** Validates, encodes and gzips a document. */
    public byte[] encode(ProfileModel.Profile profile) {
        return encoder.encode(profile);
    }

    private static ProfileSerializationException resourceExhausted(OutOfMemoryError e) {
        return new ProfileSerializationException(ProfileSerializationException.Reason.RESOURCE_EXHAUSTED,
                "Out of memory while serializing profile", e);
    }

    private static void log(String kind, ProfileModel.Profile profile) {
        System.err.println("[profile-serializer] Serialized " + kind + " profile: "
                + profile.samples().size() + " samples, "
                + profile.locations().size() + " locations, "
                + profile.functions().size() + " functions");
    }
}
