package com.sheetdelta.sheetdelta.snapshot;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Structural differ: walks two snapshots in lock-step and emits one {@link FieldChange} per differing path.
 * <p>
 * Map keys are visited in sorted order, so the result does not depend on map iteration order. Lists whose
 * elements all carry the identity key are matched by that key; other lists are compared by position.
 */
public class SnapshotDiffer {

    private enum NodeType {
        MAP,
        LIST,
        SCALAR
    }

    public List<FieldChange> diff(Snapshot previous, Snapshot current) {
        return diff(previous, current, SnapshotConstants.DEFAULT_LIST_IDENTITY_KEY);
    }

    /**
     * Returns every atomic change between the two snapshots, failing fast on an unsupported value.
     */
    public List<FieldChange> diff(Snapshot previous, Snapshot current, String listIdentityKey) {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
        String identityKey = listIdentityKey == null || listIdentityKey.isBlank()
                ? SnapshotConstants.DEFAULT_LIST_IDENTITY_KEY
                : listIdentityKey;

        List<FieldChange> changes = new ArrayList<>();
        diffMaps(FieldPath.root(), previous.root(), current.root(), identityKey, changes);
        return changes;
    }

    private void diffValues(FieldPath path, Object before, Object after, String identityKey, List<FieldChange> out) {
        NodeType beforeType = nodeType(before, path);
        NodeType afterType = nodeType(after, path);

        if (beforeType != afterType) {
            requireSupported(before, path);
            requireSupported(after, path);
            out.add(FieldChange.removed(path, before));
            out.add(FieldChange.added(path, after));
            return;
        }

        switch (beforeType) {
            case MAP -> diffMaps(path, (Map<?, ?>) before, (Map<?, ?>) after, identityKey, out);
            case LIST -> diffLists(path, (List<?>) before, (List<?>) after, identityKey, out);
            case SCALAR -> {
                if (!scalarsEqual(before, after)) {
                    out.add(FieldChange.modified(path, before, after));
                }
            }
        }
    }

    private void diffMaps(FieldPath path, Map<?, ?> before, Map<?, ?> after, String identityKey, List<FieldChange> out) {
        TreeSet<String> keys = new TreeSet<>();
        collectKeys(path, before, keys);
        collectKeys(path, after, keys);

        for (String key : keys) {
            FieldPath child = path.child(key);
            boolean inBefore = before.containsKey(key);
            boolean inAfter = after.containsKey(key);
            if (inBefore && inAfter) {
                diffValues(child, before.get(key), after.get(key), identityKey, out);
            } else if (inBefore) {
                Object removed = before.get(key);
                requireSupported(removed, child);
                out.add(FieldChange.removed(child, removed));
            } else {
                Object added = after.get(key);
                requireSupported(added, child);
                out.add(FieldChange.added(child, added));
            }
        }
    }

    private void diffLists(FieldPath path, List<?> before, List<?> after, String identityKey, List<FieldChange> out) {
        Map<String, Object> beforeById = indexByIdentity(path, before, identityKey);
        Map<String, Object> afterById = beforeById == null ? null : indexByIdentity(path, after, identityKey);
        if (beforeById != null && afterById != null) {
            diffIdentifiedLists(path, beforeById, afterById, identityKey, out);
            return;
        }

        int shared = Math.min(before.size(), after.size());
        for (int i = 0; i < shared; i++) {
            diffValues(path.index(i), before.get(i), after.get(i), identityKey, out);
        }
        for (int i = shared; i < before.size(); i++) {
            FieldPath element = path.index(i);
            requireSupported(before.get(i), element);
            out.add(FieldChange.removed(element, before.get(i)));
        }
        for (int i = shared; i < after.size(); i++) {
            FieldPath element = path.index(i);
            requireSupported(after.get(i), element);
            out.add(FieldChange.added(element, after.get(i)));
        }
    }

    private void diffIdentifiedLists(
            FieldPath path,
            Map<String, Object> beforeById,
            Map<String, Object> afterById,
            String identityKey,
            List<FieldChange> out
    ) {
        for (Map.Entry<String, Object> entry : beforeById.entrySet()) {
            FieldPath element = path.identity(identityKey, entry.getKey());
            if (afterById.containsKey(entry.getKey())) {
                diffValues(element, entry.getValue(), afterById.get(entry.getKey()), identityKey, out);
            } else {
                requireSupported(entry.getValue(), element);
                out.add(FieldChange.removed(element, entry.getValue()));
            }
        }
        for (Map.Entry<String, Object> entry : afterById.entrySet()) {
            if (!beforeById.containsKey(entry.getKey())) {
                FieldPath element = path.identity(identityKey, entry.getKey());
                requireSupported(entry.getValue(), element);
                out.add(FieldChange.added(element, entry.getValue()));
            }
        }
    }

    /**
     * Indexes list elements by their identity value, or returns {@code null} when the list cannot be
     * matched by identity (an element is not a map, lacks a scalar id, or an id repeats).
     */
    private Map<String, Object> indexByIdentity(FieldPath path, List<?> list, String identityKey) {
        Map<String, Object> byId = new LinkedHashMap<>();
        for (Object element : list) {
            if (!(element instanceof Map<?, ?> map)) {
                return null;
            }
            Object id = map.get(identityKey);
            if (id == null || nodeType(id, path) != NodeType.SCALAR) {
                return null;
            }
            String rendered = identityString(id);
            // a bracket in the id would end the selector early
            if (rendered.indexOf('[') >= 0 || rendered.indexOf(']') >= 0) {
                return null;
            }
            if (byId.putIfAbsent(rendered, element) != null) {
                return null;
            }
        }
        return byId;
    }

    private void requireSupported(Object value, FieldPath path) {
        NodeType type = nodeType(value, path);
        if (type == NodeType.MAP) {
            Map<?, ?> map = (Map<?, ?>) value;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = requireKey(path, entry.getKey());
                requireSupported(entry.getValue(), path.child(key));
            }
        } else if (type == NodeType.LIST) {
            List<?> list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                requireSupported(list.get(i), path.index(i));
            }
        }
    }

    private void collectKeys(FieldPath path, Map<?, ?> map, TreeSet<String> keys) {
        for (Object key : map.keySet()) {
            keys.add(requireKey(path, key));
        }
    }

    private static String requireKey(FieldPath path, Object key) {
        if (!(key instanceof String name) || name.isEmpty()) {
            throw new MalformedSnapshotException(path, SnapshotConstants.MSG_NON_STRING_KEY.formatted(key, path));
        }
        if (!FieldPath.isValidKey(name)) {
            throw new MalformedSnapshotException(path, SnapshotConstants.MSG_AMBIGUOUS_KEY.formatted(name, path));
        }
        return name;
    }

    private NodeType nodeType(Object value, FieldPath path) {
        if (value instanceof Map<?, ?>) {
            return NodeType.MAP;
        }
        if (value instanceof List<?>) {
            return NodeType.LIST;
        }
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return NodeType.SCALAR;
        }
        throw new MalformedSnapshotException(path,
                SnapshotConstants.MSG_UNSUPPORTED_VALUE.formatted(value.getClass().getName(), path));
    }

    static boolean scalarsEqual(Object before, Object after) {
        if (before == null || after == null) {
            return before == after;
        }
        if (before instanceof Number x && after instanceof Number y) {
            return numbersEqual(x, y);
        }
        return before.equals(after);
    }

    private static boolean numbersEqual(Number x, Number y) {
        if (isIntegral(x) && isIntegral(y)) {
            return toBigInteger(x).equals(toBigInteger(y));
        }
        double a = x.doubleValue();
        double b = y.doubleValue();
        if (Double.isNaN(a) || Double.isNaN(b)) {
            return Double.isNaN(a) && Double.isNaN(b);
        }
        return Math.abs(a - b) <= SnapshotConstants.FLOAT_EPSILON;
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger;
    }

    private static BigInteger toBigInteger(Number number) {
        return number instanceof BigInteger big ? big : BigInteger.valueOf(number.longValue());
    }

    private static String identityString(Object id) {
        if (id instanceof Number number && isIntegral(number)) {
            return toBigInteger(number).toString();
        }
        if (id instanceof Number number) {
            return decimalString(number);
        }
        return String.valueOf(id);
    }

    /**
     * Renders {@code 1.0} as {@code 1} so a double id selects the same element as an integer one.
     */
    private static String decimalString(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
