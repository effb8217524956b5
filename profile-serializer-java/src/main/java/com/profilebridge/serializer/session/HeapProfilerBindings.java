package com.profilebridge.serializer.session;

import com.profilebridge.serializer.snapshot.AllocationProfileNode;

/**
 * Control surface of the runtime's sampling heap profiler.
 */
public interface HeapProfilerBindings {

    void startSamplingHeapProfiler(long intervalBytes, int stackDepth);

    void stopSamplingHeapProfiler();

    /** Root of the allocation tree sampled so far. */
    AllocationProfileNode getAllocationProfile();
}
