package com.profilebridge.serializer;

import com.profilebridge.serializer.encode.ProfileEncoder;
import com.profilebridge.serializer.profile.ProfileModel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileEncoderTest {

    private final ProfileEncoder encoder = new ProfileEncoder();

    /** root -> main -> work(3 hits), with work translated through a map. */
    private static ProfileModel.Profile sampleProfile() {
        ProfileModel.Profile profile = new ProfileModel.Profile()
                .addSampleType("sample", "count")
                .addSampleType("wall", "microseconds")
                .setPeriodType("wall", "microseconds")
                .setPeriod(1000)
                .setTimeNanos(1_000_000_000L)
                .setDurationNanos(2_000_000_000L)
                .addComment("captured by test");

        long mainName = profile.strings().intern("main");
        long workName = profile.strings().intern("work");
        long generated = profile.strings().intern("/app/dist/app.js");
        long original = profile.strings().intern("/app/src/app.ts");

        long mapping = profile.mappings().intern(new ProfileModel.Mapping(generated, 0, 0));
        long mainFn = profile.functions().intern(new ProfileModel.Function(mainName, mainName, generated, 5));
        long workFn = profile.functions().intern(new ProfileModel.Function(workName, workName, original, 5));
        long mainLoc = profile.locations().intern(new ProfileModel.Location(mainFn, 1, 1, null));
        long workLoc = profile.locations().intern(new ProfileModel.Location(workFn, 12, 4, mapping));

        profile.addSamples(List.of(new ProfileModel.Sample(List.of(workLoc, mainLoc), List.of(3L, 3000L))));
        return profile;
    }

    @Test
    void encodingIsDeterministic() {
        byte[] first = encoder.encode(sampleProfile());
        byte[] second = encoder.encode(sampleProfile());

        assertArrayEquals(first, second);
    }

    @Test
    void outputIsGzippedPprof() throws IOException {
        byte[] encoded = encoder.encode(sampleProfile());

        assertEquals((byte) 0x1f, encoded[0]);
        assertEquals((byte) 0x8b, encoded[1]);
        PprofDecoder.Decoded decoded = PprofDecoder.decodeGzipped(encoded);
        assertEquals("", decoded.strings.get(0));
    }

    @Test
    void headerFieldsSurviveEncoding() throws IOException {
        PprofDecoder.Decoded d = PprofDecoder.decodeGzipped(encoder.encode(sampleProfile()));

        assertEquals(2, d.sampleTypes.size());
        assertEquals("sample", d.string(d.sampleTypes.get(0)[0]));
        assertEquals("count", d.string(d.sampleTypes.get(0)[1]));
        assertEquals("wall", d.string(d.sampleTypes.get(1)[0]));
        assertEquals("microseconds", d.string(d.sampleTypes.get(1)[1]));
        assertEquals("wall", d.string(d.periodType[0]));
        assertEquals(1000, d.period);
        assertEquals(1_000_000_000L, d.timeNanos);
        assertEquals(2_000_000_000L, d.durationNanos);
        assertEquals(List.of("captured by test"), d.comments.stream().map(d::string).toList());
    }

    @Test
    void tablesAndSamplesSurviveEncoding() throws IOException {
        PprofDecoder.Decoded d = PprofDecoder.decodeGzipped(encoder.encode(sampleProfile()));

        assertEquals(1, d.samples.size());
        PprofDecoder.Sample sample = d.samples.get(0);
        assertEquals(List.of(3L, 3000L), sample.values());
        assertEquals(2, sample.locationIds().size());

        PprofDecoder.Location work = d.locations.get(sample.locationIds().get(0));
        assertEquals(12, work.line());
        assertEquals(4, work.column());
        assertEquals("work", d.string(d.functions.get(work.functionId()).name()));
        assertEquals("/app/src/app.ts", d.string(d.functions.get(work.functionId()).filename()));

        PprofDecoder.Mapping mapping = d.mappings.get(work.mappingId());
        assertNotNull(mapping);
        assertEquals("/app/dist/app.js", d.string(mapping.filename()));

        PprofDecoder.Location main = d.locations.get(sample.locationIds().get(1));
        assertEquals(0, main.mappingId(), "unmapped locations carry no mapping id");
        assertEquals("main", d.string(d.functions.get(main.functionId()).name()));
    }

    @Test
    void idsAreOneBased() throws IOException {
        PprofDecoder.Decoded d = PprofDecoder.decodeGzipped(encoder.encode(sampleProfile()));

        assertEquals(List.of(1L, 2L), List.copyOf(d.locations.keySet()));
        assertEquals(List.of(1L, 2L), List.copyOf(d.functions.keySet()));
        assertEquals(List.of(1L), List.copyOf(d.mappings.keySet()));
    }

    @Test
    void emptyProfileStillEncodes() throws IOException {
        PprofDecoder.Decoded d = PprofDecoder.decodeGzipped(encoder.encode(new ProfileModel.Profile()));

        assertEquals(List.of(""), d.strings);
        assertTrue(d.samples.isEmpty());
    }

    @Test
    void invalidDocumentIsNotEncoded() {
        ProfileModel.Profile profile = sampleProfile();
        profile.addSamples(List.of(new ProfileModel.Sample(List.of(99L), List.of(1L, 1000L))));

        ProfileSerializationException e = assertThrows(ProfileSerializationException.class,
                () -> encoder.encode(profile));
        assertEquals(ProfileSerializationException.Reason.INTERNAL_ERROR, e.getReason());
    }
}
