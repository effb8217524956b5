package com.profilebridge.serializer.session;

import com.profilebridge.serializer.sourcemap.SourceResolver;

/**
 * Options for one CPU profile capture.
 *
 * @param durationMillis how long {@link TimeProfiler#profile} captures for
 * @param intervalMicros average time between samples
 * @param sourceResolver translation to original sources; null for none
 * @param name           capture name; a unique one is generated when null
 * @param lineNumbers    aggregate at line level instead of function level
 */
public record TimeProfilerOptions(
        long durationMillis,
        int intervalMicros,
        SourceResolver sourceResolver,
        String name,
        boolean lineNumbers
) {

    public static final int DEFAULT_INTERVAL_MICROS = 1000;

    public TimeProfilerOptions {
        if (durationMillis < 0) {
            throw new IllegalArgumentException("durationMillis must not be negative: " + durationMillis);
        }
        if (intervalMicros <= 0) {
            intervalMicros = DEFAULT_INTERVAL_MICROS;
        }
    }

    public static TimeProfilerOptions defaults() {
        return new TimeProfilerOptions(10_000, DEFAULT_INTERVAL_MICROS, null, null, false);
    }

    public TimeProfilerOptions withDuration(long millis) {
        return new TimeProfilerOptions(millis, intervalMicros, sourceResolver, name, lineNumbers);
    }

    public TimeProfilerOptions withInterval(int micros) {
        return new TimeProfilerOptions(durationMillis, micros, sourceResolver, name, lineNumbers);
    }

    public TimeProfilerOptions withSourceResolver(SourceResolver resolver) {
        return new TimeProfilerOptions(durationMillis, intervalMicros, resolver, name, lineNumbers);
    }

    public TimeProfilerOptions withName(String runName) {
        return new TimeProfilerOptions(durationMillis, intervalMicros, sourceResolver, runName, lineNumbers);
    }

    public TimeProfilerOptions withLineNumbers(boolean enabled) {
        return new TimeProfilerOptions(durationMillis, intervalMicros, sourceResolver, name, enabled);
    }
}
