package com.profilebridge.serializer.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated string table. Index 0 is always the empty string, as the profile
 * format requires.
 */
public final class StringTable {

    private final List<String> strings = new ArrayList<>();
    private final Map<String, Long> indexes = new HashMap<>();

    public StringTable() {
        strings.add("");
        indexes.put("", 0L);
    }

    /** Returns the index of {@code value}, adding it if absent. Null is treated as "". */
    public long intern(String value) {
        String s = value != null ? value : "";
        Long existing = indexes.get(s);
        if (existing != null) {
            return existing;
        }
        long index = strings.size();
        strings.add(s);
        indexes.put(s, index);
        return index;
    }

    public boolean contains(long index) {
        return index >= 0 && index < strings.size();
    }

    public String get(long index) {
        if (!contains(index)) {
            throw new IndexOutOfBoundsException("No string at index " + index);
        }
        return strings.get((int) index);
    }

    public int size() {
        return strings.size();
    }

    public List<String> strings() {
        return Collections.unmodifiableList(strings);
    }
}
