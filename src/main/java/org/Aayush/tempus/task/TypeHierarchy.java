package org.Aayush.tempus.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declared type names with their single parent. {@code object} is the implicit root.
 */
public final class TypeHierarchy {
    public static final String ROOT = "object";

    private final Map<String, String> parentByType;

    /**
     * @param parentByType every declared type mapped to its parent; the root may be absent.
     */
    public TypeHierarchy(Map<String, String> parentByType) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        copy.put(ROOT, null);
        for (Map.Entry<String, String> entry : Objects.requireNonNull(parentByType, "parentByType").entrySet()) {
            if (!ROOT.equals(entry.getKey())) {
                copy.put(entry.getKey(), entry.getValue() == null ? ROOT : entry.getValue());
            }
        }
        this.parentByType = Collections.unmodifiableMap(copy);
    }

    public boolean isDeclared(String type) {
        return parentByType.containsKey(type);
    }

    /**
     * Returns the parent of a type, or null for the root.
     */
    public String parentOf(String type) {
        return parentByType.get(type);
    }

    /**
     * Returns whether {@code type} equals {@code ancestor} or specializes it transitively.
     */
    public boolean isSubtypeOf(String type, String ancestor) {
        String cursor = type;
        // bounded against cyclic chains
        for (int hops = 0; cursor != null && hops <= parentByType.size(); hops++) {
            if (cursor.equals(ancestor)) {
                return true;
            }
            cursor = parentByType.get(cursor);
        }
        return false;
    }

    public Set<String> typeNames() {
        return parentByType.keySet();
    }

    @Override
    public String toString() {
        return "TypeHierarchy" + parentByType;
    }
}
