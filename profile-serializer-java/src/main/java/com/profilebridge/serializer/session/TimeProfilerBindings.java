package com.profilebridge.serializer.session;

import com.profilebridge.serializer.snapshot.TimeProfile;

/**
 * Control surface of the runtime's CPU profiler.
 */
public interface TimeProfilerBindings {

    void setSamplingInterval(int intervalMicros);

    void startProfiling(String runName, boolean lineNumbers);

    /** Stops the named capture and returns its call tree. */
    TimeProfile stopProfiling(String runName, boolean lineNumbers);
}
