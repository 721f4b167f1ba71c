package com.adlanda.ethicsassistant.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A chunk as stored in the vector index: its deterministic ID, embedding and payload.
 *
 * @param id      Chunk ID (name-based UUID)
 * @param vector  Embedding of the chunk text
 * @param payload Chunk metadata, text and storage timestamp
 */
public record IndexedPoint(
        String id,
        float[] vector,
        Map<String, Object> payload
) {
    public static final String TEXT = "text";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String FILENAME = "filename";
    public static final String DOCUMENT_ID = "document_id";
    public static final String FILE_SIZE = "file_size";
    public static final String PROCESSED_DATE = "processed_date";
    public static final String CREATED_AT = "created_at";

    public static IndexedPoint of(String chunkId, float[] vector, DocumentChunk chunk, Instant storedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TEXT, chunk.text());
        payload.put(CHUNK_INDEX, chunk.chunkIndex());
        payload.put(FILENAME, chunk.metadata().filename());
        payload.put(DOCUMENT_ID, chunk.metadata().documentId());
        payload.put(FILE_SIZE, chunk.metadata().fileSize());
        payload.put(PROCESSED_DATE, chunk.metadata().processedAt());
        payload.put(CREATED_AT, storedAt);
        return new IndexedPoint(chunkId, vector, Map.copyOf(payload));
    }
}
