package com.adlanda.ethicsassistant.model;

/**
 * Raw content of a source document, held only for the duration of one ingestion.
 *
 * @param logicalKey Storage key (root-relative path, forward slashes)
 * @param content    Raw bytes as stored
 */
public record SourceDocument(String logicalKey, byte[] content) {

    /**
     * Last path segment of the logical key.
     */
    public String filename() {
        int slash = logicalKey.lastIndexOf('/');
        return slash < 0 ? logicalKey : logicalKey.substring(slash + 1);
    }

    public long size() {
        return content.length;
    }
}
