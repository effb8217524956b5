package com.profilebridge.serializer.session;

import com.profilebridge.serializer.ProfileSerializationException;
import com.profilebridge.serializer.ProfileSerializer;
import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.snapshot.AllocationProfileNode;
import com.profilebridge.serializer.sourcemap.SourceResolver;

/**
 * Controls the runtime's sampling heap profiler. Unlike CPU captures, the heap
 * profiler keeps running after a profile is taken; callers take any number of
 * profiles between {@link #start} and {@link #stop}.
 */
public class HeapProfiler {

    private final HeapProfilerBindings bindings;
    private final ProfileSerializer serializer;

    private boolean enabled;
    private long intervalBytes;
    private int stackDepth;

    public HeapProfiler(HeapProfilerBindings bindings) {
        this(bindings, new ProfileSerializer());
    }

    public HeapProfiler(HeapProfilerBindings bindings, ProfileSerializer serializer) {
        this.bindings = bindings;
        this.serializer = serializer;
    }

    public static class AlreadyStartedException extends RuntimeException {
        public AlreadyStartedException(String msg) { super(msg); }
    }

    /**
     * @throws AlreadyStartedException if the heap profiler is already running
     */
    public synchronized void start(long intervalBytes, int stackDepth) {
        if (enabled) {
            throw new AlreadyStartedException("Heap profiler is already started with intervalBytes "
                    + this.intervalBytes + " and stackDepth " + this.stackDepth);
        }
        if (intervalBytes <= 0) {
            throw new IllegalArgumentException("intervalBytes must be positive: " + intervalBytes);
        }
        bindings.startSamplingHeapProfiler(intervalBytes, stackDepth);
        this.intervalBytes = intervalBytes;
        this.stackDepth = stackDepth;
        this.enabled = true;
        System.err.println("[profile-serializer] Heap profiler started: intervalBytes=" + intervalBytes
                + " stackDepth=" + stackDepth);
    }

    /**
     * Raw allocation tree collected so far.
     *
     * @throws ProfileSerializationException {@code NO_ACTIVE_CAPTURE} if not started
     */
    public synchronized AllocationProfileNode allocationProfile() {
        if (!enabled) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.NO_ACTIVE_CAPTURE,
                    "Heap profiler is not enabled.");
        }
        return bindings.getAllocationProfile();
    }

    /**
     * Serializes the allocations sampled so far.
     *
     * @param ignorePath     skip nodes whose script name contains this; may be null
     * @param sourceResolver may be null
     */
    public ProfileModel.Profile profile(String ignorePath, SourceResolver sourceResolver) {
        long startTimeNanos = System.currentTimeMillis() * 1_000_000L;
        AllocationProfileNode root;
        long interval;
        synchronized (this) {
            root = allocationProfile();
            interval = intervalBytes;
        }
        return serializer.serializeHeapProfile(root, startTimeNanos, interval, ignorePath, sourceResolver);
    }

    public synchronized void stop() {
        if (enabled) {
            enabled = false;
            bindings.stopSamplingHeapProfiler();
            System.err.println("[profile-serializer] Heap profiler stopped");
        }
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }
}
