package com.adlanda.ethicsassistant.model;

import com.adlanda.ethicsassistant.repository.ScoredPoint;

/**
 * A single retrieval hit: the matched chunk's text and attribution plus its similarity score.
 *
 * @param text       Chunk text
 * @param filename   Source filename
 * @param documentId Document the chunk belongs to
 * @param chunkIndex Position of the chunk within its document
 * @param score      Similarity to the query (higher is more similar)
 */
public record RetrievedChunk(
        String text,
        String filename,
        String documentId,
        int chunkIndex,
        double score
) {
    public static RetrievedChunk from(ScoredPoint point) {
        var payload = point.payload();
        Object index = payload.getOrDefault(IndexedPoint.CHUNK_INDEX, 0);
        return new RetrievedChunk(
                String.valueOf(payload.getOrDefault(IndexedPoint.TEXT, "")),
                String.valueOf(payload.getOrDefault(IndexedPoint.FILENAME, "Unknown")),
                String.valueOf(payload.getOrDefault(IndexedPoint.DOCUMENT_ID, "")),
                index instanceof Number n ? n.intValue() : 0,
                point.score()
        );
    }
}
