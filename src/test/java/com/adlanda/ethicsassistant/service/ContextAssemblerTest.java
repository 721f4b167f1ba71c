package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.model.RetrievedChunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextAssemblerTest {

    private final ContextAssembler assembler = new ContextAssembler();

    @Test
    void format_noChunks_returnsSentinel() {
        assertThat(assembler.format(List.of())).isEqualTo("No relevant documents found.");
        assertThat(assembler.format(null)).isEqualTo(ContextAssembler.NO_DOCUMENTS);
    }

    @Test
    void format_singleChunk_numbersAndAttributes() {
        List<RetrievedChunk> chunks = List.of(
                new RetrievedChunk("Article 5 lists prohibited practices.", "eu-ai-act.pdf", "21fa9e41ed2a21b2", 4, 0.91));

        assertThat(assembler.format(chunks))
                .isEqualTo("Document 1 (from eu-ai-act.pdf):\nArticle 5 lists prohibited practices.\n");
    }

    @Test
    void format_multipleChunks_joinedWithDelimiterInRankOrder() {
        List<RetrievedChunk> chunks = List.of(
                new RetrievedChunk("first", "a.pdf", "x", 0, 0.9),
                new RetrievedChunk("second", "b.pdf", "y", 2, 0.8));

        assertThat(assembler.format(chunks)).isEqualTo(
                "Document 1 (from a.pdf):\nfirst\n\n---\nDocument 2 (from b.pdf):\nsecond\n");
    }
}
