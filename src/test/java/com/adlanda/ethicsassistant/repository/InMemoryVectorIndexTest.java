package com.adlanda.ethicsassistant.repository;

import com.adlanda.ethicsassistant.exception.ConfigurationException;
import com.adlanda.ethicsassistant.exception.IndexException;
import com.adlanda.ethicsassistant.model.IndexedPoint;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryVectorIndexTest {

    private InMemoryVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndex();
        index.ensureCollection(3, DistanceMetric.COSINE);
    }

    @Test
    void upsert_pointWithVector_storesSuccessfully() {
        index.upsert(List.of(point("1", "doc-a", 1f, 0f, 0f)));

        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void upsert_sameId_replacesPoint() {
        index.upsert(List.of(point("1", "doc-a", 1f, 0f, 0f)));
        index.upsert(List.of(point("1", "doc-a", 0f, 1f, 0f)));

        assertThat(index.size()).isEqualTo(1);
        assertThat(index.search(new float[]{0f, 1f, 0f}, 1).get(0).score()).isCloseTo(1.0, within(0.001));
    }

    @Test
    void upsert_pointWithoutVector_throwsException() {
        assertThatThrownBy(() -> index.upsert(List.of(new IndexedPoint("1", new float[0], Map.of()))))
                .isInstanceOf(IndexException.class)
                .hasMessageContaining("without a vector");
    }

    @Test
    void upsert_wrongDimension_throwsException() {
        assertThatThrownBy(() -> index.upsert(List.of(point("1", "doc-a", 1f, 0f))))
                .isInstanceOf(IndexException.class)
                .hasMessageContaining("dimension");
    }

    @Test
    void search_identicalVector_returnsHighScore() {
        index.upsert(List.of(point("1", "doc-a", 1f, 0f, 0f)));

        List<ScoredPoint> results = index.search(new float[]{1f, 0f, 0f}, 5);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).score()).isCloseTo(1.0, within(0.001));
    }

    @Test
    void search_orthogonalVector_returnsZeroScore() {
        index.upsert(List.of(point("1", "doc-a", 1f, 0f, 0f)));

        List<ScoredPoint> results = index.search(new float[]{0f, 1f, 0f}, 5);

        assertThat(results.get(0).score()).isCloseTo(0.0, within(0.001));
    }

    @Test
    void search_multiplePoints_returnsSortedByScore() {
        index.upsert(List.of(
                point("1", "first", 1f, 0f, 0f),
                point("2", "second", 0.7f, 0.7f, 0f),
                point("3", "third", 0f, 1f, 0f)));

        List<ScoredPoint> results = index.search(new float[]{1f, 0f, 0f}, 5);

        assertThat(results).extracting(ScoredPoint::id).containsExactly("1", "2", "3");
        assertThat(results.get(0).score()).isGreaterThan(results.get(1).score());
        assertThat(results.get(1).score()).isGreaterThan(results.get(2).score());
    }

    @Test
    void search_limitsResults() {
        for (int i = 0; i < 10; i++) {
            index.upsert(List.of(point(String.valueOf(i), "doc", (float) i / 10, 0.5f, 0.5f)));
        }

        assertThat(index.search(new float[]{1f, 0.5f, 0.5f}, 3)).hasSize(3);
    }

    @Test
    void search_emptyIndex_returnsEmpty() {
        assertThat(index.search(new float[]{1f, 0f, 0f}, 5)).isEmpty();
    }

    @Test
    void deleteWhere_removesOnlyMatchingPoints() {
        index.upsert(List.of(
                point("1", "doc-a", 1f, 0f, 0f),
                point("2", "doc-a", 0f, 1f, 0f),
                point("3", "doc-b", 0f, 0f, 1f)));

        int deleted = index.deleteWhere(IndexedPoint.DOCUMENT_ID, "doc-a");

        assertThat(deleted).isEqualTo(2);
        assertThat(index.ids()).containsExactly("3");
    }

    @Test
    void deleteWhere_noMatch_returnsZero() {
        assertThat(index.deleteWhere(IndexedPoint.DOCUMENT_ID, "missing")).isZero();
    }

    @Test
    void ensureCollection_sameDimension_isNoOp() {
        index.upsert(List.of(point("1", "doc-a", 1f, 0f, 0f)));

        index.ensureCollection(3, DistanceMetric.COSINE);

        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void ensureCollection_differentDimension_throwsException() {
        assertThatThrownBy(() -> index.ensureCollection(1536, DistanceMetric.COSINE))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void search_dotMetric_ranksByInnerProduct() {
        InMemoryVectorIndex dot = new InMemoryVectorIndex();
        dot.ensureCollection(2, DistanceMetric.DOT);
        dot.upsert(List.of(point("small", "doc", 1f, 0f), point("large", "doc", 3f, 0f)));

        List<ScoredPoint> results = dot.search(new float[]{1f, 0f}, 2);

        assertThat(results).extracting(ScoredPoint::id).containsExactly("large", "small");
        assertThat(results.get(0).score()).isCloseTo(3.0, within(0.001));
    }

    private static IndexedPoint point(String id, String documentId, float... vector) {
        return new IndexedPoint(id, vector, Map.of(
                IndexedPoint.TEXT, "text " + id,
                IndexedPoint.DOCUMENT_ID, documentId,
                IndexedPoint.FILENAME, documentId + ".pdf",
                IndexedPoint.CHUNK_INDEX, 0));
    }

    private static Offset<Double> within(double value) {
        return Offset.offset(value);
    }
}
