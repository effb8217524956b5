package com.profilebridge.serializer.session;

import com.profilebridge.serializer.ProfileSerializationException;
import com.profilebridge.serializer.ProfileSerializer;
import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.snapshot.TimeProfile;
import com.profilebridge.serializer.walk.WalkMode;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts and stops CPU profile captures and serializes what they collected.
 *
 * At most one capture runs per profiler at a time; the running capture is owned
 * by the {@link Session} handle returned from {@link #start}.
 */
public class TimeProfiler {

    private final TimeProfilerBindings bindings;
    private final ProfileSerializer serializer;
    private final AtomicReference<Session> active = new AtomicReference<>();

    public TimeProfiler(TimeProfilerBindings bindings) {
        this(bindings, new ProfileSerializer());
    }

    public TimeProfiler(TimeProfilerBindings bindings, ProfileSerializer serializer) {
        this.bindings = bindings;
        this.serializer = serializer;
    }

    public static class AlreadyProfilingException extends RuntimeException {
        public AlreadyProfilingException(String msg) { super(msg); }
    }

    /**
     * Starts a capture.
     *
     * @throws AlreadyProfilingException if a capture started here is still running
     */
    public Session start(TimeProfilerOptions options) {
        String runName = options.name() != null
                ? options.name()
                : "pprof-" + System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextLong(Long.MAX_VALUE);
        Session session = new Session(runName, options);
        if (!active.compareAndSet(null, session)) {
            Session current = active.get();
            throw new AlreadyProfilingException("already profiling"
                    + (current != null ? ": " + current.runName : ""));
        }
        try {
            System.err.println("[profile-serializer] Setting sampling interval to " + options.intervalMicros() + "us");
            bindings.setSamplingInterval(options.intervalMicros());
            System.err.println("[profile-serializer] Starting profile collection: " + runName);
            bindings.startProfiling(runName, options.lineNumbers());
        } catch (RuntimeException e) {
            active.compareAndSet(session, null);
            throw e;
        }
        return session;
    }

    /**
     * Captures for {@code options.durationMillis()} and returns the serialized profile.
     * If interrupted while waiting, the capture is abandoned.
     */
    public ProfileModel.Profile profile(TimeProfilerOptions options) throws InterruptedException {
        Session session = start(options);
        try {
            Thread.sleep(options.durationMillis());
        } catch (InterruptedException e) {
            session.abandon();
            throw e;
        }
        return session.stop();
    }

    /** {@link #profile} on {@code executor}. */
    public CompletableFuture<ProfileModel.Profile> profileAsync(TimeProfilerOptions options, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return profile(options);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }, executor);
    }

    public boolean isProfiling() {
        return active.get() != null;
    }

    /**
     * Handle to one running capture.
     */
    public final class Session {

        private final String runName;
        private final TimeProfilerOptions options;

        private Session(String runName, TimeProfilerOptions options) {
            this.runName = runName;
            this.options = options;
        }

        public String runName() {
            return runName;
        }

        /**
         * Stops the capture and serializes it.
         *
         * @throws ProfileSerializationException {@code NO_ACTIVE_CAPTURE} if this session
         *         was already stopped or abandoned
         */
        public ProfileModel.Profile stop() {
            TimeProfile snapshot = release();
            System.err.println("[profile-serializer] Serializing profile: " + runName);
            return serializer.serializeTimeProfile(
                    snapshot,
                    options.intervalMicros(),
                    options.sourceResolver(),
                    options.lineNumbers() ? WalkMode.LINE_LEVEL : WalkMode.FUNCTION_LEVEL);
        }

        /** Stops the capture and discards what it collected. */
        public void abandon() {
            release();
            System.err.println("[profile-serializer] Abandoned profile collection: " + runName);
        }

        private TimeProfile release() {
            if (!active.compareAndSet(this, null)) {
                throw new ProfileSerializationException(ProfileSerializationException.Reason.NO_ACTIVE_CAPTURE,
                        "Profile collection " + runName + " is not running");
            }
            System.err.println("[profile-serializer] Stopping profile collection: " + runName);
            return bindings.stopProfiling(runName, options.lineNumbers());
        }
    }
}
