package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.exception.EmbeddingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiEmbeddingBackendTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private SpringAiEmbeddingBackend backend;

    @BeforeEach
    void setUp() {
        backend = new SpringAiEmbeddingBackend(embeddingModel);
    }

    @Test
    void embedOne_delegatesToModel() {
        float[] vector = {0.1f, 0.2f, 0.3f};
        when(embeddingModel.embed("oversight")).thenReturn(vector);

        assertThat(backend.embedOne("oversight")).containsExactly(0.1f, 0.2f, 0.3f);
    }

    @Test
    void embedMany_preservesOrder() {
        when(embeddingModel.embed(List.of("a", "b"))).thenReturn(List.of(new float[]{1f}, new float[]{2f}));

        List<float[]> vectors = backend.embedMany(List.of("a", "b"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(1f);
        assertThat(vectors.get(1)).containsExactly(2f);
    }

    @Test
    void embedMany_emptyInput_skipsModel() {
        assertThat(backend.embedMany(List.of())).isEmpty();

        verifyNoInteractions(embeddingModel);
    }

    @Test
    void embedMany_countMismatch_throwsEmbeddingException() {
        when(embeddingModel.embed(anyList())).thenReturn(List.of(new float[]{1f}));

        assertThatThrownBy(() -> backend.embedMany(List.of("a", "b")))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    void embedOne_modelFails_throwsEmbeddingException() {
        when(embeddingModel.embed("x")).thenThrow(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> backend.embedOne("x"))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("quota exceeded");
    }

    @Test
    void dimensions_queriedOnceAndCached() {
        when(embeddingModel.dimensions()).thenReturn(1536);

        assertThat(backend.dimensions()).isEqualTo(1536);
        assertThat(backend.dimensions()).isEqualTo(1536);

        verify(embeddingModel, times(1)).dimensions();
    }
}
