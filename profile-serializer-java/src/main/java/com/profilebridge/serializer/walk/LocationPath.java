package com.profilebridge.serializer.walk;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable call path sharing its tail with the parent frame's path.
 * The head is the innermost (leaf) location.
 */
final class LocationPath {

    private final long locationId;
    private final LocationPath caller;
    private final int depth;

    LocationPath(long locationId, LocationPath caller) {
        this.locationId = locationId;
        this.caller = caller;
        this.depth = caller == null ? 1 : caller.depth + 1;
    }

    /** Location ids ordered leaf to root. */
    List<Long> toList() {
        List<Long> ids = new ArrayList<>(depth);
        for (LocationPath p = this; p != null; p = p.caller) {
            ids.add(p.locationId);
        }
        return ids;
    }
}
