package com.sheetdelta.sheetdelta.snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable state of the monitored entity at one point in time: nested maps, lists and scalars.
 * <p>
 * Containers are copied into unmodifiable collections; other values are kept as given and checked
 * by {@link SnapshotDiffer} when it reaches them.
 */
public final class Snapshot {

    private static final Snapshot EMPTY = new Snapshot(Map.of());

    private final Map<String, Object> root;

    private Snapshot(Map<String, Object> root) {
        this.root = root;
    }

    public static Snapshot of(Map<String, ?> root) {
        if (root == null || root.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : root.entrySet()) {
            frozen.put(entry.getKey(), freeze(entry.getValue()));
        }
        return new Snapshot(Collections.unmodifiableMap(frozen));
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public Map<String, Object> root() {
        return root;
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Snapshot other && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "Snapshot" + root;
    }
}
