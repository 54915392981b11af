package org.Aayush.tempus.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link IDMapper} backed by fastutil.
 *
 * <p>Safe for concurrent reads once constructed; the search shares one instance across
 * every node and worker thread.</p>
 */
public final class FastUtilIDMapper implements IDMapper {

    // signature -> id, no boxing on lookup
    private final Object2IntOpenHashMap<String> forward;
    // id -> signature
    private final String[] reverse;

    /**
     * Builds the mapper from signatures in id order.
     *
     * @param signaturesInIdOrder distinct, non-null signatures.
     */
    public FastUtilIDMapper(List<String> signaturesInIdOrder) {
        if (signaturesInIdOrder == null) {
            throw new IllegalArgumentException("Signatures cannot be null");
        }
        int size = signaturesInIdOrder.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(NOT_FOUND);
        this.reverse = new String[size];

        for (int id = 0; id < size; id++) {
            String signature = signaturesInIdOrder.get(id);
            if (signature == null) {
                throw new IllegalArgumentException("Null signature at index " + id);
            }
            if (forward.put(signature, id) != NOT_FOUND) {
                throw new IllegalArgumentException("Duplicate signature detected in input: " + signature);
            }
            reverse[id] = signature;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String signature) throws UnknownIDException {
        int id = forward.getInt(signature);
        if (id == NOT_FOUND) {
            throw new UnknownIDException("Signature not found: " + signature);
        }
        return id;
    }

    @Override
    public int indexOf(String signature) {
        return forward.getInt(signature);
    }

    @Override
    public String toExternal(int internalId) {
        try {
            return reverse[internalId];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
    }

    @Override
    public boolean containsExternal(String signature) {
        return forward.containsKey(signature);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
