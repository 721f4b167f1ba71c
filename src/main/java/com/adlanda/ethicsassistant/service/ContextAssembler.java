package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.model.RetrievedChunk;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders retrieved chunks into the attributed context block given to the generation backend.
 */
@Service
public class ContextAssembler {

    public static final String NO_DOCUMENTS = "No relevant documents found.";

    static final String DELIMITER = "\n---\n";

    /**
     * Formats chunks as numbered blocks naming their source file, in the given order.
     *
     * @return the context, or {@link #NO_DOCUMENTS} when there are no chunks
     */
    public String format(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return NO_DOCUMENTS;
        }

        List<String> parts = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            parts.add("Document %d (from %s):\n%s\n".formatted(i + 1, chunk.filename(), chunk.text()));
        }
        return String.join(DELIMITER, parts);
    }
}
