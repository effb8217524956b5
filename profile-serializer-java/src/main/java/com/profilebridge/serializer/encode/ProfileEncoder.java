package com.profilebridge.serializer.encode;

import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import com.profilebridge.serializer.ProfileSerializationException;
import com.profilebridge.serializer.profile.ProfileModel;
import com.profilebridge.serializer.profile.ProfileValidator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Writes a {@link ProfileModel.Profile} as a {@code perftools.profiles.Profile}
 * protobuf message and gzips it.
 *
 * Fields are always written in the same order and zero scalars are omitted, as
 * generated protobuf code does, so the same document always yields the same bytes.
 */
public class ProfileEncoder {

    private static final int GZIP_BUFFER_SIZE = 4096;

    @FunctionalInterface
    private interface MessageBody {
        void writeTo(CodedOutputStream out) throws IOException;
    }

    /**
     * Validates and encodes {@code profile}, then compresses the result.
     *
     * @throws ProfileSerializationException with {@code INTERNAL_ERROR} if the document
     *         references an id missing from its tables, {@code RESOURCE_EXHAUSTED} if the
     *         JVM runs out of memory
     */
    public byte[] encode(ProfileModel.Profile profile) {
        try {
            return gzip(toProto(profile));
        } catch (OutOfMemoryError e) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.RESOURCE_EXHAUSTED,
                    "Out of memory while encoding profile", e);
        }
    }

    /** Uncompressed protobuf bytes of {@code profile}. */
    public byte[] toProto(ProfileModel.Profile profile) {
        ProfileValidator.validate(profile);
        try {
            return toBytes(out -> writeProfile(out, profile));
        } catch (IOException e) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.INTERNAL_ERROR,
                    "Failed to encode profile: " + e.getMessage(), e);
        }
    }

    static byte[] gzip(byte[] raw) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(raw.length / 4 + 64);
        try (GZIPOutputStream gz = new GZIPOutputStream(bytes, GZIP_BUFFER_SIZE)) {
            gz.write(raw);
        } catch (IOException e) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.INTERNAL_ERROR,
                    "Failed to compress profile: " + e.getMessage(), e);
        }
        return bytes.toByteArray();
    }

    // -----------------------------------------------------------------------
    // perftools.profiles.Profile
    // -----------------------------------------------------------------------

    private static void writeProfile(CodedOutputStream out, ProfileModel.Profile profile) throws IOException {
        for (ProfileModel.ValueType sampleType : profile.sampleTypes()) {
            writeMessage(out, 1, valueType(sampleType));
        }
        for (ProfileModel.Sample sample : profile.samples()) {
            writeMessage(out, 2, o -> {
                writePackedUInt64(o, 1, sample.locationIds());
                writePackedInt64(o, 2, sample.values());
            });
        }
        profile.mappings().forEach((id, mapping) -> writeNested(out, 3, o -> {
            writeUInt64(o, 1, id);
            writeUInt64(o, 2, mapping.memoryStart());
            writeUInt64(o, 3, mapping.memoryLimit());
            writeInt64(o, 5, mapping.filename());
            o.writeBool(7, true);   // has_functions
            o.writeBool(8, true);   // has_filenames
            o.writeBool(9, true);   // has_line_numbers
        }));
        profile.locations().forEach((id, location) -> writeNested(out, 4, o -> {
            writeUInt64(o, 1, id);
            if (location.mappingId() != null) {
                writeUInt64(o, 2, location.mappingId());
            }
            writeMessage(o, 4, line -> {
                writeUInt64(line, 1, location.functionId());
                writeInt64(line, 2, location.line());
                writeInt64(line, 3, location.column());
            });
        }));
        profile.functions().forEach((id, function) -> writeNested(out, 5, o -> {
            writeUInt64(o, 1, id);
            writeInt64(o, 2, function.name());
            writeInt64(o, 3, function.systemName());
            writeInt64(o, 4, function.filename());
        }));
        for (String s : profile.strings().strings()) {
            out.writeString(6, s);
        }
        writeInt64(out, 9, profile.timeNanos());
        writeInt64(out, 10, profile.durationNanos());
        if (profile.periodType() != null) {
            writeMessage(out, 11, valueType(profile.periodType()));
        }
        writeInt64(out, 12, profile.period());
        writePackedInt64(out, 13, profile.comments());
    }

    private static MessageBody valueType(ProfileModel.ValueType vt) {
        return o -> {
            writeInt64(o, 1, vt.type());
            writeInt64(o, 2, vt.unit());
        };
    }

    // -----------------------------------------------------------------------
    // Wire helpers
    // -----------------------------------------------------------------------

    private static byte[] toBytes(MessageBody body) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        body.writeTo(out);
        out.flush();
        return bytes.toByteArray();
    }

    private static void writeMessage(CodedOutputStream out, int field, MessageBody body) throws IOException {
        out.writeByteArray(field, toBytes(body));
    }

    /** {@link #writeMessage} for use inside table iteration lambdas. */
    private static void writeNested(CodedOutputStream out, int field, MessageBody body) {
        try {
            writeMessage(out, field, body);
        } catch (IOException e) {
            throw new ProfileSerializationException(ProfileSerializationException.Reason.INTERNAL_ERROR,
                    "Failed to encode field " + field + ": " + e.getMessage(), e);
        }
    }

    private static void writeUInt64(CodedOutputStream out, int field, long value) throws IOException {
        if (value != 0) out.writeUInt64(field, value);
    }

    private static void writeInt64(CodedOutputStream out, int field, long value) throws IOException {
        if (value != 0) out.writeInt64(field, value);
    }

    private static void writePackedUInt64(CodedOutputStream out, int field, List<Long> values) throws IOException {
        if (values.isEmpty()) return;
        int size = 0;
        for (long v : values) size += CodedOutputStream.computeUInt64SizeNoTag(v);
        out.writeTag(field, WireFormat.WIRETYPE_LENGTH_DELIMITED);
        out.writeUInt32NoTag(size);
        for (long v : values) out.writeUInt64NoTag(v);
    }

    private static void writePackedInt64(CodedOutputStream out, int field, List<Long> values) throws IOException {
        if (values.isEmpty()) return;
        int size = 0;
        for (long v : values) size += CodedOutputStream.computeInt64SizeNoTag(v);
        out.writeTag(field, WireFormat.WIRETYPE_LENGTH_DELIMITED);
        out.writeUInt32NoTag(size);
        for (long v : values) out.writeInt64NoTag(v);
    }
}
