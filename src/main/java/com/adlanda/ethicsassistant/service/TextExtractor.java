package com.adlanda.ethicsassistant.service;

/**
 * Turns a binary document into plain text.
 */
public interface TextExtractor {

    /**
     * @param content raw document bytes
     * @param label   name used for format detection and logging
     * @throws com.adlanda.ethicsassistant.exception.ExtractionException on corrupt or unsupported input
     */
    String extract(byte[] content, String label);
}
