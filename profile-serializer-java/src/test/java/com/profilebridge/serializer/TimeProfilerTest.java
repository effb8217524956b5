package com.profilebridge.serializer;

import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.session.TimeProfiler;
import com.profilebridge.serializer.session.TimeProfilerBindings;
import com.profilebridge.serializer.session.TimeProfilerOptions;
import com.profilebridge.serializer.snapshot.LineTick;
import com.profilebridge.serializer.snapshot.TimeProfile;
import com.profilebridge.serializer.snapshot.TimeProfileNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TimeProfilerTest {

    /** Records every call and returns a fixed tree with one hot function. */
    static class FakeBindings implements TimeProfilerBindings {
        final List<String> calls = new ArrayList<>();
        Integer interval;
        Boolean lineNumbersAtStart;
        Boolean lineNumbersAtStop;
        RuntimeException failOnStart;

        @Override
        public void setSamplingInterval(int intervalMicros) {
            interval = intervalMicros;
            calls.add("interval");
        }

        @Override
        public void startProfiling(String runName, boolean lineNumbers) {
            if (failOnStart != null) throw failOnStart;
            lineNumbersAtStart = lineNumbers;
            calls.add("start " + runName);
        }

        @Override
        public TimeProfile stopProfiling(String runName, boolean lineNumbers) {
            lineNumbersAtStop = lineNumbers;
            calls.add("stop " + runName);
            TimeProfileNode hot = new TimeProfileNode("hot", "/app/main.js", 1, 4, 1, 3, List.of(),
                    List.of(new LineTick(5, 2)));
            return new TimeProfile(runName, new TimeProfileNode("(root)", "", 0, 0, 0, 0, List.of(hot)), 10, 20);
        }
    }

    private final FakeBindings bindings = new FakeBindings();
    private final TimeProfiler profiler = new TimeProfiler(bindings);

    @Test
    void startThenStopSerializesCapture() {
        TimeProfiler.Session session = profiler.start(TimeProfilerOptions.defaults().withName("run-1").withInterval(500));

        assertTrue(profiler.isProfiling());
        assertEquals(500, bindings.interval);

        ProfileModel.Profile profile = session.stop();

        assertFalse(profiler.isProfiling());
        assertEquals(List.of("interval", "start run-1", "stop run-1"), bindings.calls);
        assertEquals(500, profile.period());
        assertEquals(1, profile.samples().size());
        assertEquals(List.of(3L, 1500L), profile.samples().get(0).values());
        assertEquals(10_000L, profile.timeNanos());
    }

    @Test
    void secondStartWhileRunningIsRejected() {
        profiler.start(TimeProfilerOptions.defaults().withName("first"));

        TimeProfiler.AlreadyProfilingException e = assertThrows(TimeProfiler.AlreadyProfilingException.class,
                () -> profiler.start(TimeProfilerOptions.defaults()));
        assertTrue(e.getMessage().startsWith("already profiling"));
        assertEquals(List.of("interval", "start first"), bindings.calls);
    }

    @Test
    void stoppingTwiceIsNoActiveCapture() {
        TimeProfiler.Session session = profiler.start(TimeProfilerOptions.defaults());
        session.stop();

        ProfileSerializationException e = assertThrows(ProfileSerializationException.class, session::stop);
        assertEquals(ProfileSerializationException.Reason.NO_ACTIVE_CAPTURE, e.getReason());
    }

    @Test
    void abandonReleasesTheProfiler() {
        TimeProfiler.Session session = profiler.start(TimeProfilerOptions.defaults().withName("dropped"));
        session.abandon();

        assertFalse(profiler.isProfiling());
        assertTrue(bindings.calls.contains("stop dropped"));
        assertThrows(ProfileSerializationException.class, session::stop);
        assertDoesNotThrow(() -> profiler.start(TimeProfilerOptions.defaults()).stop());
    }

    @Test
    void lineNumbersSelectLineLevelAggregation() {
        ProfileModel.Profile profile = profiler.start(TimeProfilerOptions.defaults().withLineNumbers(true)).stop();

        assertTrue(bindings.lineNumbersAtStart);
        assertTrue(bindings.lineNumbersAtStop);
        assertEquals(2, profile.samples().size());
        assertEquals(List.of(2L, 2000L), profile.samples().get(1).values());
    }

    @Test
    void generatedRunNamesAreUnique() {
        TimeProfiler.Session session = profiler.start(TimeProfilerOptions.defaults());
        String first = session.runName();
        session.abandon();
        String second = profiler.start(TimeProfilerOptions.defaults()).runName();

        assertNotEquals(first, second);
        assertTrue(first.startsWith("pprof-"));
    }

    @Test
    void failedStartLeavesProfilerIdle() {
        bindings.failOnStart = new IllegalStateException("profiler unavailable");

        assertThrows(IllegalStateException.class, () -> profiler.start(TimeProfilerOptions.defaults()));
        assertFalse(profiler.isProfiling());
    }

    @Test
    void profileCapturesForRequestedDuration() throws Exception {
        ProfileModel.Profile profile = profiler.profile(TimeProfilerOptions.defaults().withDuration(5));

        assertEquals(1, profile.samples().size());
        assertFalse(profiler.isProfiling());
    }

    @Test
    void profileAsyncCompletesOnExecutor() throws Exception {
        ProfileModel.Profile profile = profiler
                .profileAsync(TimeProfilerOptions.defaults().withDuration(1), Runnable::run)
                .get(5, TimeUnit.SECONDS);

        assertEquals(1, profile.samples().size());
    }

    @Test
    void interruptedCaptureIsAbandoned() {
        Thread.currentThread().interrupt();

        assertThrows(InterruptedException.class, () -> profiler.profile(TimeProfilerOptions.defaults().withDuration(1_000)));
        assertFalse(profiler.isProfiling());
        assertEquals("stop", bindings.calls.get(bindings.calls.size() - 1).split(" ")[0]);
    }

    @Test
    void nonPositiveIntervalFallsBackToDefault() {
        assertEquals(TimeProfilerOptions.DEFAULT_INTERVAL_MICROS,
                TimeProfilerOptions.defaults().withInterval(0).intervalMicros());
        assertThrows(IllegalArgumentException.class, () -> TimeProfilerOptions.defaults().withDuration(-1));
    }
}
