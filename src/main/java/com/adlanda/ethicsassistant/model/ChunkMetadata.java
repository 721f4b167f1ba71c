package com.adlanda.ethicsassistant.model;

import java.time.Instant;

/**
 * Document-level metadata shared by every chunk of one document.
 *
 * @param filename    Source filename (last segment of the logical key)
 * @param documentId  Deterministic document identifier
 * @param fileSize    Size of the raw document in bytes
 * @param processedAt When this ingestion run processed the document
 */
public record ChunkMetadata(
        String filename,
        String documentId,
        long fileSize,
        Instant processedAt
) {}
