package com.profilebridge.serializer.profile;

import com.profilebridge.serializer.ProfileSerializationException;

/**
 * Checks that every id referenced inside a {@link ProfileModel.Profile} resolves in
 * its owning table. A failure here is a bug in the walker or the interners, never
 * bad input, so it is reported as an internal error.
 */
public final class ProfileValidator {

    private ProfileValidator() {}

    public static void validate(ProfileModel.Profile profile) {
        StringTable strings = profile.strings();
        Interner<ProfileModel.Function> functions = profile.functions();
        Interner<ProfileModel.Location> locations = profile.locations();
        Interner<ProfileModel.Mapping> mappings = profile.mappings();

        int valueCount = profile.sampleTypes().size();
        for (ProfileModel.ValueType vt : profile.sampleTypes()) {
            requireString(strings, vt.type(), "sample type");
            requireString(strings, vt.unit(), "sample unit");
        }
        if (profile.periodType() != null) {
            requireString(strings, profile.periodType().type(), "period type");
            requireString(strings, profile.periodType().unit(), "period unit");
        }
        for (long comment : profile.comments()) {
            requireString(strings, comment, "comment");
        }

        for (ProfileModel.Sample sample : profile.samples()) {
            if (sample.values().size() != valueCount) {
                throw internal("Sample has " + sample.values().size()
                        + " values but profile declares " + valueCount + " sample types");
            }
            for (long locationId : sample.locationIds()) {
                if (!locations.contains(locationId)) {
                    throw internal("Sample references unknown location id " + locationId);
                }
            }
        }

        locations.forEach((id, location) -> {
            if (!functions.contains(location.functionId())) {
                throw internal("Location " + id + " references unknown function id " + location.functionId());
            }
            if (location.mappingId() != null && !mappings.contains(location.mappingId())) {
                throw internal("Location " + id + " references unknown mapping id " + location.mappingId());
            }
        });

        functions.forEach((id, function) -> {
            requireString(strings, function.name(), "function " + id + " name");
            requireString(strings, function.systemName(), "function " + id + " system name");
            requireString(strings, function.filename(), "function " + id + " filename");
        });

        mappings.forEach((id, mapping) -> requireString(strings, mapping.filename(), "mapping " + id + " filename"));
    }

    private static void requireString(StringTable strings, long index, String what) {
        if (!strings.contains(index)) {
            throw internal("String index " + index + " for " + what + " is out of range");
        }
    }

    private static ProfileSerializationException internal(String message) {
        return new ProfileSerializationException(ProfileSerializationException.Reason.INTERNAL_ERROR, message);
    }
}
