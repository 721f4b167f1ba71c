package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Derives deterministic identifiers for documents and their chunks.
 *
 * A document ID is the first 16 hex characters of the SHA-256 of its logical key
 * with the storage prefix removed, so moving the prefix keeps IDs while renaming
 * the file changes them. A chunk ID is a version 5 (SHA-1, name-based) UUID of
 * {@code <documentId>_chunk_<index>} in the DNS namespace.
 */
@Service
public class DocumentIdentity {

    static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    private static final int DOCUMENT_ID_LENGTH = 16;

    private final String storagePrefix;

    @Autowired
    public DocumentIdentity(AssistantProperties properties) {
        this(properties.getStorage().getPrefix());
    }

    public DocumentIdentity(String storagePrefix) {
        this.storagePrefix = storagePrefix == null ? "" : storagePrefix;
    }

    /**
     * Computes the document ID for a logical key.
     *
     * @return 16 lowercase hex characters
     */
    public String documentId(String logicalKey) {
        String cleaned = !storagePrefix.isEmpty() && logicalKey.startsWith(storagePrefix)
                ? logicalKey.substring(storagePrefix.length())
                : logicalKey;
        byte[] hash = digest("SHA-256").digest(cleaned.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(hash).substring(0, DOCUMENT_ID_LENGTH);
    }

    /**
     * Computes the ID of the chunk at {@code chunkIndex} within a document.
     */
    public String chunkId(String documentId, int chunkIndex) {
        return nameUuid(NAMESPACE_DNS, documentId + "_chunk_" + chunkIndex).toString();
    }

    /**
     * RFC 4122 version 5 UUID.
     */
    static UUID nameUuid(UUID namespace, String name) {
        MessageDigest sha1 = digest("SHA-1");
        sha1.update(ByteBuffer.allocate(16)
                .putLong(namespace.getMostSignificantBits())
                .putLong(namespace.getLeastSignificantBits())
                .array());
        byte[] hash = sha1.digest(name.getBytes(StandardCharsets.UTF_8));

        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);  // version 5
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);  // IETF variant

        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }

    private static MessageDigest digest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 and SHA-1 are always available in standard JVMs
            throw new IllegalStateException(algorithm + " algorithm not available", e);
        }
    }
}
