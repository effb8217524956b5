package com.profilebridge.serializer.snapshot;

import com.google.gson.annotations.SerializedName;

/**
 * A bucket of sampled allocations of identical size made at one call site.
 */
public record Allocation(
        @SerializedName("sizeBytes") long sizeBytes,
        @SerializedName("count")     long count
) {}
