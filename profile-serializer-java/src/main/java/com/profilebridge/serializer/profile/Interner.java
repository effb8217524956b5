package com.profilebridge.serializer.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Assigns stable ids to structurally-equal values.
 *
 * Ids start at 1 and increase by one per distinct value, in first-seen order;
 * 0 is never assigned and means "absent" on the wire. Equality is whatever the
 * value's {@code equals}/{@code hashCode} say, so values should be records.
 *
 * Not thread-safe. One instance lives for exactly one serialization call.
 */
public final class Interner<T> {

    private final List<T> values = new ArrayList<>();
    private final Map<T, Long> ids = new HashMap<>();

    /** Returns the id of an equal value already interned, or assigns the next id. */
    public long intern(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot intern null");
        }
        Long existing = ids.get(value);
        if (existing != null) {
            return existing;
        }
        values.add(value);
        long id = values.size();
        ids.put(value, id);
        return id;
    }

    public boolean contains(long id) {
        return id >= 1 && id <= values.size();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code id} was never assigned
     */
    public T get(long id) {
        if (!contains(id)) {
            throw new IndexOutOfBoundsException("No value interned with id " + id);
        }
        return values.get((int) (id - 1));
    }

    public int size() {
        return values.size();
    }

    /** Values in id order; element {@code i} has id {@code i + 1}. */
    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    public void forEach(BiConsumer<Long, T> action) {
        for (int i = 0; i < values.size(); i++) {
            action.accept((long) i + 1, values.get(i));
        }
    }
}
