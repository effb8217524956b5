package com.profilebridge.serializer;

import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.session.HeapProfiler;
import com.profilebridge.serializer.session.HeapProfilerBindings;
import com.profilebridge.serializer.snapshot.Allocation;
import com.profilebridge.serializer.snapshot.AllocationProfileNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeapProfilerTest {

    static class FakeBindings implements HeapProfilerBindings {
        int starts;
        int stops;
        long lastInterval;
        int lastDepth;

        @Override
        public void startSamplingHeapProfiler(long intervalBytes, int stackDepth) {
            starts++;
            lastInterval = intervalBytes;
            lastDepth = stackDepth;
        }

        @Override
        public void stopSamplingHeapProfiler() {
            stops++;
        }

        @Override
        public AllocationProfileNode getAllocationProfile() {
            AllocationProfileNode vendor = new AllocationProfileNode("lib", "/app/node_modules/lib.js", 2, 1, 1,
                    List.of(new Allocation(100, 1)), List.of());
            AllocationProfileNode app = new AllocationProfileNode("alloc", "/app/main.js", 1, 3, 1,
                    List.of(new Allocation(48, 3)), List.of(vendor));
            return new AllocationProfileNode("(root)", "", 0, 0, 0, List.of(), List.of(app));
        }
    }

    private final FakeBindings bindings = new FakeBindings();
    private final HeapProfiler profiler = new HeapProfiler(bindings);

    @Test
    void profileSerializesAllocationsSoFar() {
        profiler.start(1024, 64);

        ProfileModel.Profile profile = profiler.profile(null, null);

        assertEquals(1024, profile.period());
        assertEquals(2, profile.samples().size());
        assertEquals(List.of(3L, 144L), profile.samples().get(0).values());
        assertTrue(profile.timeNanos() > 0);
        assertTrue(profiler.isEnabled(), "taking a profile does not stop the heap profiler");
    }

    @Test
    void ignorePathIsApplied() {
        profiler.start(1024, 64);

        ProfileModel.Profile profile = profiler.profile("node_modules", null);

        assertEquals(1, profile.samples().size());
    }

    @Test
    void startingTwiceIsRejected() {
        profiler.start(1024, 64);

        HeapProfiler.AlreadyStartedException e = assertThrows(HeapProfiler.AlreadyStartedException.class,
                () -> profiler.start(2048, 16));
        assertTrue(e.getMessage().contains("1024"));
        assertEquals(1, bindings.starts);
    }

    @Test
    void profileBeforeStartIsNoActiveCapture() {
        ProfileSerializationException e = assertThrows(ProfileSerializationException.class,
                () -> profiler.profile(null, null));
        assertEquals(ProfileSerializationException.Reason.NO_ACTIVE_CAPTURE, e.getReason());
        assertEquals("Heap profiler is not enabled.", e.getMessage());
    }

    @Test
    void stopIsIdempotentAndAllowsRestart() {
        profiler.start(1024, 64);
        profiler.stop();
        profiler.stop();

        assertEquals(1, bindings.stops);
        assertFalse(profiler.isEnabled());

        profiler.start(4096, 8);
        assertEquals(4096, bindings.lastInterval);
        assertEquals(8, bindings.lastDepth);
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> profiler.start(0, 64));
        assertFalse(profiler.isEnabled());
        assertEquals(0, bindings.starts);
    }
}
