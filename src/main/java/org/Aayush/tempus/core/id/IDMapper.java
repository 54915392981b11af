package org.Aayush.tempus.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between symbolic signatures (ground atoms, ground fluents) and
 * dense integer ids used by states, ground actions and the relaxed planning graph.
 */
public interface IDMapper {

    /** Sentinel returned by {@link #indexOf(String)} for unknown signatures. */
    int NOT_FOUND = -1;

    /**
     * Converts a signature to its dense id.
     * @param signature canonical signature, for example {@code (at robot1 depot)}.
     * @return the dense id.
     * @throws UnknownIDException if the signature was never interned.
     */
    int toInternal(String signature) throws UnknownIDException;

    /**
     * Lookup without exceptions for hot paths.
     *
     * @param signature canonical signature.
     * @return dense id, or {@link #NOT_FOUND}.
     */
    int indexOf(String signature);

    /**
     * Converts a dense id back to its signature.
     * @param internalId dense id.
     * @return the signature.
     * @throws IndexOutOfBoundsException if the id is invalid.
     */
    String toExternal(int internalId);

    /**
     * @param signature signature to test.
     * @return true when the signature is mapped.
     */
    boolean containsExternal(String signature);

    /**
     * @param internalId id to test.
     * @return true when the id is within mapper bounds.
     */
    boolean containsInternal(int internalId);

    /**
     * @return total number of mapped signatures.
     */
    int size();

    /**
     * Exception thrown when a signature cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable implementation from signatures listed in id order.
     *
     * @param signaturesInIdOrder signature at index {@code i} receives id {@code i}.
     * @return immutable mapper.
     */
    static IDMapper createImmutable(List<String> signaturesInIdOrder) {
        return new FastUtilIDMapper(signaturesInIdOrder);
    }
}
