package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.EmbeddingException;
import com.adlanda.ethicsassistant.exception.ErrorKind;
import com.adlanda.ethicsassistant.exception.IngestionException;
import com.adlanda.ethicsassistant.model.ChunkMetadata;
import com.adlanda.ethicsassistant.model.DocumentChunk;
import com.adlanda.ethicsassistant.model.FileIngestionResult;
import com.adlanda.ethicsassistant.model.IndexedPoint;
import com.adlanda.ethicsassistant.model.IngestionResult;
import com.adlanda.ethicsassistant.model.SourceDocument;
import com.adlanda.ethicsassistant.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

/**
 * Drives document ingestion: delete old chunks, fetch, extract, chunk, embed, upsert.
 *
 * Re-ingesting a document replaces its chunks: existing points are deleted by
 * document ID first, then fresh points with deterministic chunk IDs are upserted.
 * The two steps are not atomic; a crash in between leaves the document absent
 * until the next run.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final DocumentStorage documentStorage;
    private final TextExtractor textExtractor;
    private final TextChunker textChunker;
    private final EmbeddingBackend embeddingBackend;
    private final VectorIndex vectorIndex;
    private final DocumentIdentity documentIdentity;
    private final Clock clock;
    private final int parallelism;

    public IngestionService(DocumentStorage documentStorage,
                            TextExtractor textExtractor,
                            TextChunker textChunker,
                            EmbeddingBackend embeddingBackend,
                            VectorIndex vectorIndex,
                            DocumentIdentity documentIdentity,
                            Clock clock,
                            AssistantProperties properties) {
        this.documentStorage = documentStorage;
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.embeddingBackend = embeddingBackend;
        this.vectorIndex = vectorIndex;
        this.documentIdentity = documentIdentity;
        this.clock = clock;
        this.parallelism = properties.getIngestion().getParallelism();
    }

    /**
     * Ingests every eligible document in storage.
     */
    public IngestionResult ingestAll() {
        return ingestAll("");
    }

    /**
     * Ingests every eligible document whose key starts with the given filter.
     *
     * Each document is ingested independently: a failure is recorded in the
     * result and the remaining documents are still processed. Results are
     * reported in listing order.
     *
     * @throws com.adlanda.ethicsassistant.exception.StorageException if listing fails
     */
    public IngestionResult ingestAll(String prefixFilter) {
        log.info("Starting ingestion of all documents");

        List<String> keys = documentStorage.list(prefixFilter);
        if (keys.isEmpty()) {
            log.info("No documents found to ingest");
            return IngestionResult.empty();
        }
        log.info("Found {} documents to process", keys.size());

        List<FileIngestionResult> files = parallelism > 1 && keys.size() > 1
                ? ingestConcurrently(keys)
                : ingestSequentially(keys);

        IngestionResult result = IngestionResult.of(files);
        log.info("Ingestion complete: {} succeeded, {} failed", result.processed(), result.failed());
        return result;
    }

    /**
     * Ingests one document and reports the outcome instead of throwing.
     */
    public FileIngestionResult ingestDocument(String logicalKey) {
        try {
            int chunks = ingestOne(logicalKey);
            log.info("Successfully processed {}", logicalKey);
            return FileIngestionResult.success(logicalKey, chunks);
        } catch (IngestionException e) {
            log.error("Failed to process {}: {}", logicalKey, e.getMessage(), e);
            return FileIngestionResult.failed(logicalKey, e.getMessage(), e.causeKind());
        }
    }

    /**
     * Ingests a single document, replacing any chunks previously indexed for it.
     *
     * @return number of chunks indexed; 0 if the document produced no text
     * @throws IngestionException wrapping the first fetch, extraction, embedding or index failure
     */
    public int ingestOne(String logicalKey) {
        log.info("Processing document: {}", logicalKey);

        String documentId = documentIdentity.documentId(logicalKey);
        deleteExistingChunks(documentId);

        try {
            SourceDocument source = new SourceDocument(logicalKey, documentStorage.fetch(logicalKey));
            String text = textExtractor.extract(source.content(), logicalKey);

            ChunkMetadata metadata = new ChunkMetadata(
                    source.filename(), documentId, source.size(), clock.instant());
            List<DocumentChunk> chunks = textChunker.chunk(text, metadata);

            if (chunks.isEmpty()) {
                log.warn("No chunks created for {}", logicalKey);
                return 0;
            }

            List<float[]> embeddings = embeddingBackend.embedMany(
                    chunks.stream().map(DocumentChunk::text).toList());
            if (embeddings.size() != chunks.size()) {
                throw new EmbeddingException("Expected " + chunks.size() + " embeddings, got " + embeddings.size());
            }

            vectorIndex.upsert(toPoints(documentId, chunks, embeddings));

            log.info("Successfully processed {}: {} chunks stored", logicalKey, chunks.size());
            return chunks.size();
        } catch (RuntimeException e) {
            throw new IngestionException(logicalKey, e);
        }
    }

    private List<IndexedPoint> toPoints(String documentId, List<DocumentChunk> chunks, List<float[]> embeddings) {
        Instant storedAt = clock.instant();
        return IntStream.range(0, chunks.size())
                .mapToObj(i -> {
                    DocumentChunk chunk = chunks.get(i);
                    String chunkId = documentIdentity.chunkId(documentId, chunk.chunkIndex());
                    return IndexedPoint.of(chunkId, embeddings.get(i), chunk, storedAt);
                })
                .toList();
    }

    /**
     * Removes previously indexed chunks of a document. A failure is logged and
     * ingestion continues: a temporary duplicate is preferable to blocking fresh content.
     */
    private void deleteExistingChunks(String documentId) {
        try {
            int deleted = vectorIndex.deleteWhere(IndexedPoint.DOCUMENT_ID, documentId);
            if (deleted > 0) {
                log.info("Deleted {} existing chunks for document {}", deleted, documentId);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to delete existing chunks for {}: {}", documentId, e.getMessage());
        }
    }

    private List<FileIngestionResult> ingestSequentially(List<String> keys) {
        List<FileIngestionResult> results = new ArrayList<>(keys.size());
        for (String key : keys) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Ingestion interrupted; {} documents not started", keys.size() - results.size());
                break;
            }
            results.add(ingestDocument(key));
        }
        return results;
    }

    private List<FileIngestionResult> ingestConcurrently(List<String> keys) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, keys.size()));
        try {
            List<Future<FileIngestionResult>> futures = keys.stream()
                    .map(key -> executor.submit(() -> ingestDocument(key)))
                    .toList();

            // Collect in submission order so the report matches the listing
            List<FileIngestionResult> results = new ArrayList<>(keys.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.forEach(future -> future.cancel(false));
                    log.warn("Ingestion interrupted; pending documents will not be started");
                    break;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Failed to process {}: {}", keys.get(i), cause.getMessage(), cause);
                    results.add(FileIngestionResult.failed(keys.get(i), cause.getMessage(), ErrorKind.INGESTION));
                }
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }
}
