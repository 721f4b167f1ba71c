package com.adlanda.ethicsassistant.model;

import java.util.List;

/**
 * Summary of a batch ingestion run.
 *
 * @param processed Documents ingested successfully
 * @param failed    Documents that failed
 * @param files     Per-document outcome, in listing order
 */
public record IngestionResult(
        int processed,
        int failed,
        List<FileIngestionResult> files
) {
    public static IngestionResult empty() {
        return new IngestionResult(0, 0, List.of());
    }

    public static IngestionResult of(List<FileIngestionResult> files) {
        int processed = (int) files.stream().filter(FileIngestionResult::succeeded).count();
        return new IngestionResult(processed, files.size() - processed, List.copyOf(files));
    }

    public int totalChunks() {
        return files.stream()
                .filter(FileIngestionResult::succeeded)
                .mapToInt(FileIngestionResult::chunks)
                .sum();
    }
}
