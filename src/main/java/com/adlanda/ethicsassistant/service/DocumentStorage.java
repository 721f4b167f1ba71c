package com.adlanda.ethicsassistant.service;

import java.util.List;

/**
 * Source of raw documents, addressed by logical key.
 */
public interface DocumentStorage {

    /**
     * Lists keys of eligible documents under the configured prefix plus {@code prefixFilter}.
     *
     * @param prefixFilter additional key prefix, may be empty
     * @return matching keys in a stable order
     */
    List<String> list(String prefixFilter);

    /**
     * Reads the raw bytes of a document.
     *
     * @throws com.adlanda.ethicsassistant.exception.StorageException if it cannot be read
     */
    byte[] fetch(String logicalKey);

    /**
     * @return true if the storage can be read
     */
    boolean probe();
}
