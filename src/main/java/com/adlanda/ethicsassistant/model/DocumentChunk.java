package com.adlanda.ethicsassistant.model;

/**
 * A bounded segment of a document's extracted text.
 *
 * @param chunkIndex 0-based position within the document, contiguous
 * @param text       The text content of the chunk
 * @param metadata   Document-level metadata
 */
public record DocumentChunk(
        int chunkIndex,
        String text,
        ChunkMetadata metadata
) {
    public DocumentChunk {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be >= 0");
        }
        if (text == null) {
            throw new IllegalArgumentException("text is required");
        }
    }
}
