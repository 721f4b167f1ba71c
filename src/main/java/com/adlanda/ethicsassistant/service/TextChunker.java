package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.ConfigurationException;
import com.adlanda.ethicsassistant.model.ChunkMetadata;
import com.adlanda.ethicsassistant.model.DocumentChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits extracted text into overlapping chunks of bounded size.
 *
 * Separators are tried coarsest first (paragraph, line, sentence, word, character);
 * a finer separator is only used on a piece that is still too long. Adjacent pieces
 * are merged up to the chunk size, and each new chunk starts with trailing pieces of
 * the previous one totalling at most the overlap. Separators are kept at the start
 * of the piece that follows them and chunks are whitespace-stripped.
 *
 * Stateless: the output is a pure function of the text and the configured size,
 * overlap and separators.
 */
@Service
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    /**
     * Paragraph break, line break, sentence end, space, then hard cut.
     */
    public static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", ". ", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;
    private final List<String> separators;

    @Autowired
    public TextChunker(AssistantProperties properties) {
        this(properties.getChunking().getSize(), properties.getChunking().getOverlap());
    }

    public TextChunker(int chunkSize, int chunkOverlap) {
        this(chunkSize, chunkOverlap, DEFAULT_SEPARATORS);
    }

    /**
     * @param separators separators in priority order; without a trailing "" a piece
     *                   that no separator can split is emitted as an oversized chunk
     */
    public TextChunker(int chunkSize, int chunkOverlap, List<String> separators) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("Chunk size must be positive, got " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new ConfigurationException("Chunk overlap (" + chunkOverlap
                    + ") must be between 0 and the chunk size (" + chunkSize + ")");
        }
        if (separators.isEmpty()) {
            throw new ConfigurationException("At least one separator is required");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.separators = List.copyOf(separators);

        log.info("Initialized text chunker (size={}, overlap={})", chunkSize, chunkOverlap);
    }

    /**
     * Splits text into chunks carrying the given document metadata.
     *
     * @return chunks indexed 0..n-1; empty for empty or blank text
     */
    public List<DocumentChunk> chunk(String text, ChunkMetadata metadata) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> pieces = split(text, separators);

        List<DocumentChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new DocumentChunk(i, pieces.get(i), metadata));
        }

        log.debug("Split text into {} chunks", chunks.size());
        return chunks;
    }

    /**
     * Splits text into chunk strings without metadata.
     */
    public List<String> splitText(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return split(text, separators);
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int chunkOverlap() {
        return chunkOverlap;
    }

    private List<String> split(String text, List<String> candidates) {
        // Pick the first separator present in the text; "" always matches
        String separator = candidates.get(candidates.size() - 1);
        List<String> finer = List.of();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                finer = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        List<String> result = new ArrayList<>();
        List<String> fitting = new ArrayList<>();

        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                result.addAll(merge(fitting));
                fitting = new ArrayList<>();
            }
            if (finer.isEmpty()) {
                String stripped = piece.strip();
                if (!stripped.isEmpty()) {
                    log.warn("Emitting oversized chunk of {} characters (limit {})", stripped.length(), chunkSize);
                    result.add(stripped);
                }
            } else {
                result.addAll(split(piece, finer));
            }
        }

        if (!fitting.isEmpty()) {
            result.addAll(merge(fitting));
        }
        return result;
    }

    /**
     * Splits on every non-overlapping occurrence of the separator, attaching the
     * separator to the start of the following piece. Empty pieces are dropped.
     */
    private static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();

        if (separator.isEmpty()) {
            text.codePoints().forEach(cp -> pieces.add(Character.toString(cp)));
            return pieces;
        }

        int match = text.indexOf(separator);
        if (match < 0) {
            pieces.add(text);
            return pieces;
        }

        pieces.add(text.substring(0, match));
        while (match >= 0) {
            int next = text.indexOf(separator, match + separator.length());
            pieces.add(text.substring(match, next < 0 ? text.length() : next));
            match = next;
        }

        pieces.removeIf(String::isEmpty);
        return pieces;
    }

    /**
     * Greedily merges small pieces into chunks no longer than the chunk size,
     * carrying trailing pieces of up to the overlap into the next chunk.
     */
    private List<String> merge(List<String> pieces) {
        List<String> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int total = 0;

        for (String piece : pieces) {
            int length = piece.length();

            if (total + length > chunkSize) {
                if (!current.isEmpty()) {
                    addStripped(chunks, String.join("", current));

                    while (total > chunkOverlap || (total + length > chunkSize && total > 0)) {
                        total -= current.remove(0).length();
                    }
                }
            }

            current.add(piece);
            total += length;
        }

        addStripped(chunks, String.join("", current));
        return chunks;
    }

    private static void addStripped(List<String> chunks, String chunk) {
        String stripped = chunk.strip();
        if (!stripped.isEmpty()) {
            chunks.add(stripped);
        }
    }
}
