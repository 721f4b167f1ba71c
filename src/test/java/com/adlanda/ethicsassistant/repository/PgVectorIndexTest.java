package com.adlanda.ethicsassistant.repository;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.ConfigurationException;
import com.adlanda.ethicsassistant.exception.IndexException;
import com.adlanda.ethicsassistant.model.ChunkMetadata;
import com.adlanda.ethicsassistant.model.DocumentChunk;
import com.adlanda.ethicsassistant.model.IndexedPoint;
import com.pgvector.PGvector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PgVectorIndex.
 * Tests the SQL issued for collection setup, upsert, search and filtered deletion.
 */
@ExtendWith(MockitoExtension.class)
class PgVectorIndexTest {

    private static final String DIMENSION_QUERY =
            "SELECT atttypmod FROM pg_attribute WHERE attrelid = to_regclass(?) AND attname = 'embedding'";

    @Mock
    private JdbcTemplate jdbcTemplate;

    private PgVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new PgVectorIndex(jdbcTemplate, new AssistantProperties());
    }

    @Test
    void ensureCollection_absent_createsTableAndIndexes() {
        when(jdbcTemplate.queryForList(DIMENSION_QUERY, Integer.class, "ai_ethics_docs")).thenReturn(List.of());
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);

        index.ensureCollection(1536, DistanceMetric.COSINE);

        verify(jdbcTemplate, times(4)).execute(sql.capture());
        assertThat(sql.getAllValues().get(0)).isEqualTo("CREATE EXTENSION IF NOT EXISTS vector");
        assertThat(sql.getAllValues().get(1))
                .contains("CREATE TABLE IF NOT EXISTS ai_ethics_docs")
                .contains("embedding vector(1536)");
        assertThat(sql.getAllValues().get(2)).contains("USING hnsw (embedding vector_cosine_ops)");
        assertThat(sql.getAllValues().get(3)).contains("(document_id)");
    }

    @Test
    void ensureCollection_existingWithSameDimension_createsNothing() {
        when(jdbcTemplate.queryForList(DIMENSION_QUERY, Integer.class, "ai_ethics_docs")).thenReturn(List.of(1536));

        index.ensureCollection(1536, DistanceMetric.COSINE);

        verify(jdbcTemplate, times(1)).execute(anyString());
    }

    @Test
    void ensureCollection_existingWithOtherDimension_throwsConfigurationException() {
        when(jdbcTemplate.queryForList(DIMENSION_QUERY, Integer.class, "ai_ethics_docs")).thenReturn(List.of(768));

        assertThatThrownBy(() -> index.ensureCollection(1536, DistanceMetric.COSINE))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("768")
                .hasMessageContaining("1536");
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsert_writesRowsWithConflictUpdate() {
        Instant processed = Instant.parse("2024-05-01T10:00:00Z");
        ChunkMetadata metadata = new ChunkMetadata("policy.pdf", "53346a8acb0ecef8", 2048L, processed);
        String id = "41c898cb-d09a-5760-a52e-b2686eec169a";
        IndexedPoint point = IndexedPoint.of(id, new float[]{0.1f, 0.2f},
                new DocumentChunk(3, "Human oversight", metadata), processed.plusSeconds(5));

        index.upsert(List.of(point));

        ArgumentCaptor<List<Object[]>> rows = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(ArgumentMatchers.contains("ON CONFLICT (id) DO UPDATE"), rows.capture());

        Object[] row = rows.getValue().get(0);
        assertThat(row[0]).isEqualTo(UUID.fromString(id));
        assertThat(row[1]).isInstanceOf(PGvector.class);
        assertThat(row[2]).isEqualTo("Human oversight");
        assertThat(row[3]).isEqualTo(3);
        assertThat(row[4]).isEqualTo("policy.pdf");
        assertThat(row[5]).isEqualTo("53346a8acb0ecef8");
        assertThat(row[6]).isEqualTo(2048L);
        assertThat(row[7]).isEqualTo(Timestamp.from(processed));
        assertThat(row[8]).isEqualTo(Timestamp.from(processed.plusSeconds(5)));
    }

    @Test
    void upsert_emptyList_doesNothing() {
        index.upsert(List.of());

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void search_ordersByMetricDistanceOperator() {
        ScoredPoint hit = new ScoredPoint("p1", 0.9, Map.of());
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<ScoredPoint>>any(), any(), any(), eq(3)))
                .thenReturn(List.of(hit));
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);

        List<ScoredPoint> results = index.search(new float[]{1f, 0f}, 3);

        assertThat(results).containsExactly(hit);
        verify(jdbcTemplate).query(sql.capture(), ArgumentMatchers.<RowMapper<ScoredPoint>>any(), any(), any(), eq(3));
        assertThat(sql.getValue())
                .contains("FROM ai_ethics_docs")
                .contains("ORDER BY embedding <=> ?")
                .endsWith("LIMIT ?");
    }

    @Test
    void deleteWhere_executesFilteredDelete() {
        when(jdbcTemplate.update(anyString(), eq("53346a8acb0ecef8"))).thenReturn(5);

        int deleted = index.deleteWhere(IndexedPoint.DOCUMENT_ID, "53346a8acb0ecef8");

        assertThat(deleted).isEqualTo(5);
        verify(jdbcTemplate).update("DELETE FROM ai_ethics_docs WHERE document_id = ?", "53346a8acb0ecef8");
    }

    @Test
    void deleteWhere_unknownField_rejected() {
        assertThatThrownBy(() -> index.deleteWhere("text; DROP TABLE x", "v"))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void deleteWhere_databaseFailure_throwsIndexException() {
        when(jdbcTemplate.update(anyString(), eq("abc"))).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> index.deleteWhere(IndexedPoint.DOCUMENT_ID, "abc"))
                .isInstanceOf(IndexException.class)
                .hasMessageContaining("down");
    }

    @Test
    void probe_databaseReachable_returnsTrue() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);

        assertThat(index.probe()).isTrue();
    }

    @Test
    void probe_databaseDown_returnsFalse() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(index.probe()).isFalse();
    }
}
