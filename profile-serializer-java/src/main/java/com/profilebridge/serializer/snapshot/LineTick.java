package com.profilebridge.serializer.snapshot;

import com.google.gson.annotations.SerializedName;

/**
 * Hits recorded against a single source line inside a function (line-ticks mode).
 */
public record LineTick(
        @SerializedName("line")     int line,
        @SerializedName("hitCount") long hitCount
) {}
