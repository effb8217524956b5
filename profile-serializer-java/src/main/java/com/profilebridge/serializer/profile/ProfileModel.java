package com.profilebridge.serializer.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical, table-based profile document, shaped after the pprof
 * {@code perftools.profiles.Profile} message.
 *
 * All string-valued fields are indexes into the document's {@link StringTable};
 * all cross references are ids into its interners.
 */
public final class ProfileModel {

    private ProfileModel() {}

    public record ValueType(long type, long unit) {}

    /**
     * Interned function identity. {@code scriptId} takes part in equality but has
     * no wire field of its own.
     */
    public record Function(long name, long systemName, long filename, long scriptId) {}

    /**
     * Interned call site. {@code column} is 0 when unused; {@code mappingId} is null
     * unless the position was translated through a source map.
     */
    public record Location(long functionId, long line, long column, Long mappingId) {}

    /** The generated script a translated location came from. */
    public record Mapping(long filename, long memoryStart, long memoryLimit) {}

    /** One weighted call path, leaf first. */
    public record Sample(List<Long> locationIds, List<Long> values) {
        public Sample {
            locationIds = List.copyOf(locationIds);
            values = List.copyOf(values);
        }
    }

    /**
     * The document itself. Built once per serialization call, then handed to the
     * encoder and discarded.
     */
    public static final class Profile {
        private final StringTable strings = new StringTable();
        private final Interner<Function> functions = new Interner<>();
        private final Interner<Location> locations = new Interner<>();
        private final Interner<Mapping> mappings = new Interner<>();
        private final List<ValueType> sampleTypes = new ArrayList<>();
        private final List<Sample> samples = new ArrayList<>();
        private final List<Long> comments = new ArrayList<>();

        private ValueType periodType;
        private long period;
        private long timeNanos;
        private long durationNanos;

        public StringTable strings()              { return strings; }
        public Interner<Function> functions()     { return functions; }
        public Interner<Location> locations()     { return locations; }
        public Interner<Mapping> mappings()       { return mappings; }

        public List<ValueType> sampleTypes()      { return Collections.unmodifiableList(sampleTypes); }
        public List<Sample> samples()             { return Collections.unmodifiableList(samples); }
        public List<Long> comments()              { return Collections.unmodifiableList(comments); }

        public ValueType periodType()             { return periodType; }
        public long period()                      { return period; }
        public long timeNanos()                   { return timeNanos; }
        public long durationNanos()               { return durationNanos; }

        /** Adds a sample type described by its type and unit names. */
        public Profile addSampleType(String type, String unit) {
            sampleTypes.add(new ValueType(strings.intern(type), strings.intern(unit)));
            return this;
        }

        public Profile setPeriodType(String type, String unit) {
            this.periodType = new ValueType(strings.intern(type), strings.intern(unit));
            return this;
        }

        public Profile setPeriod(long period) {
            this.period = period;
            return this;
        }

        public Profile setTimeNanos(long timeNanos) {
            this.timeNanos = timeNanos;
            return this;
        }

        public Profile setDurationNanos(long durationNanos) {
            this.durationNanos = durationNanos;
            return this;
        }

        public Profile addComment(String comment) {
            comments.add(strings.intern(comment));
            return this;
        }

        public Profile addSamples(List<Sample> newSamples) {
            samples.addAll(newSamples);
            return this;
        }
    }
}
