package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.exception.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.reader.tika.TikaDocumentReader;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Extracts text with Apache Tika through Spring AI's document reader.
 */
@Service
public class TikaTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaTextExtractor.class);

    @Override
    public String extract(byte[] content, String label) {
        var resource = new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return label;
            }
        };

        try {
            List<Document> documents = new TikaDocumentReader(resource).get();
            String text = documents.stream()
                    .map(Document::getText)
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining("\n\n"));

            log.info("Extracted {} characters from '{}'", text.length(), label);
            return text;
        } catch (RuntimeException e) {
            throw new ExtractionException("Failed to extract text from '" + label + "': " + e.getMessage(), e);
        }
    }
}
