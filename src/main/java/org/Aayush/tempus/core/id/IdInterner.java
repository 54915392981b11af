package org.Aayush.tempus.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Append-only interner used while grounding: first-seen signatures receive increasing ids.
 *
 * <p>Not thread-safe. Call {@link #freeze()} once grounding is done to obtain the immutable
 * mapper shared by the search.</p>
 */
public final class IdInterner {
    private final Object2IntOpenHashMap<String> ids = new Object2IntOpenHashMap<>();
    private final ObjectArrayList<String> signatures = new ObjectArrayList<>();

    public IdInterner() {
        ids.defaultReturnValue(IDMapper.NOT_FOUND);
    }

    /**
     * Returns the id of a signature, assigning the next free id on first sight.
     */
    public int intern(String signature) {
        int existing = ids.getInt(signature);
        if (existing != IDMapper.NOT_FOUND) {
            return existing;
        }
        int id = signatures.size();
        ids.put(signature, id);
        signatures.add(signature);
        return id;
    }

    /**
     * Returns the id of a signature or {@link IDMapper#NOT_FOUND} without interning.
     */
    public int lookup(String signature) {
        return ids.getInt(signature);
    }

    public int size() {
        return signatures.size();
    }

    /**
     * Snapshots the current content into an immutable mapper.
     */
    public IDMapper freeze() {
        return IDMapper.createImmutable(signatures);
    }
}
