package com.profilebridge.serializer;

import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.walk.SampleAggregator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleAggregatorTest {

    @Test
    void cpuHitsAreConvertedWithInterval() {
        SampleAggregator aggregator = SampleAggregator.forCpu(1000);
        aggregator.attributeHits(List.of(3L, 2L), 7);

        ProfileModel.Sample sample = aggregator.samples().get(0);
        assertEquals(List.of(7L, 7000L), sample.values());
        assertEquals(SampleAggregator.ValueKind.CPU, aggregator.kind());
        assertEquals(List.of(3L, 2L), sample.locationIds());
    }

    @Test
    void zeroHitsProduceNoSample() {
        SampleAggregator aggregator = SampleAggregator.forCpu(1000);
        aggregator.attributeHits(List.of(1L), 0);
        assertTrue(aggregator.samples().isEmpty());
    }

    @Test
    void heapValuesAreCountAndTotalBytes() {
        SampleAggregator aggregator = SampleAggregator.forHeap();
        aggregator.attributeAllocation(List.of(1L), 4, 64);
        assertEquals(List.of(4L, 256L), aggregator.samples().get(0).values());
    }

    @Test
    void identicalPathsAreKeptAsSeparateSamples() {
        SampleAggregator aggregator = SampleAggregator.forCpu(10);
        aggregator.attributeHits(List.of(2L, 1L), 1);
        aggregator.attributeHits(List.of(2L, 1L), 2);

        assertEquals(2, aggregator.samples().size(), "duplicate paths are not merged");
        assertEquals(List.of(1L, 10L), aggregator.samples().get(0).values());
        assertEquals(List.of(2L, 20L), aggregator.samples().get(1).values());
    }

    @Test
    void wrongValueKindIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> SampleAggregator.forHeap().attributeHits(List.of(1L), 1));
        assertThrows(IllegalStateException.class,
                () -> SampleAggregator.forCpu(1000).attributeAllocation(List.of(1L), 1, 8));
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SampleAggregator.forCpu(0));
    }

    @Test
    void overflowIsAnInternalError() {
        SampleAggregator aggregator = SampleAggregator.forCpu(Long.MAX_VALUE / 2);
        ProfileSerializationException e = assertThrows(ProfileSerializationException.class,
                () -> aggregator.attributeHits(List.of(1L), 3));
        assertEquals(ProfileSerializationException.Reason.INTERNAL_ERROR, e.getReason());
    }
}
