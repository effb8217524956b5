package com.profilebridge.serializer.walk;

import com.profilebridge.serializer.ProfileSerializationException;
import com.profilebridge.serializer.profile.ProfileModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns per-node weights into samples.
 *
 * CPU samples carry {@code [hitCount, hitCount * intervalMicros]}; heap samples carry
 * {@code [count, sizeBytes * count]} for each allocation bucket. Samples with equal
 * paths are kept apart: every contributing node yields its own sample.
 */
public final class SampleAggregator {

    public enum ValueKind { CPU, HEAP }

    private final ValueKind kind;
    private final long intervalMicros;
    private final List<ProfileModel.Sample> samples = new ArrayList<>();

    private SampleAggregator(ValueKind kind, long intervalMicros) {
        this.kind = kind;
        this.intervalMicros = intervalMicros;
    }

    public static SampleAggregator forCpu(long intervalMicros) {
        if (intervalMicros <= 0) {
            throw new IllegalArgumentException("Sampling interval must be positive: " + intervalMicros);
        }
        return new SampleAggregator(ValueKind.CPU, intervalMicros);
    }

    public static SampleAggregator forHeap() {
        return new SampleAggregator(ValueKind.HEAP, 0);
    }

    public ValueKind kind() {
        return kind;
    }

    /** Appends a CPU sample for {@code path} (leaf first); zero hits add nothing. */
    public void attributeHits(List<Long> path, long hitCount) {
        requireKind(ValueKind.CPU);
        if (hitCount <= 0) return;
        samples.add(new ProfileModel.Sample(path, List.of(hitCount, multiply(hitCount, intervalMicros))));
    }

    /** Appends a heap sample for one allocation bucket; empty buckets add nothing. */
    public void attributeAllocation(List<Long> path, long count, long sizeBytes) {
        requireKind(ValueKind.HEAP);
        if (count <= 0) return;
        samples.add(new ProfileModel.Sample(path, List.of(count, multiply(sizeBytes, count))));
    }

    public List<ProfileModel.Sample> samples() {
        return Collections.unmodifiableList(samples);
    }

    private void requireKind(ValueKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Aggregator collects " + kind + " samples, not " + expected);
        }
    }

    private static long multiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.INTERNAL_ERROR,
                    "Sample value overflow: " + a + " * " + b, e);
        }
    }
}
