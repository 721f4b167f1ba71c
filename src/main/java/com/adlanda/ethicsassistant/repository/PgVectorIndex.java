package com.adlanda.ethicsassistant.repository;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.ConfigurationException;
import com.adlanda.ethicsassistant.exception.IndexException;
import com.adlanda.ethicsassistant.model.IndexedPoint;
import com.pgvector.PGvector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * PostgreSQL-based vector index using the pgvector extension.
 *
 * One table per collection; payload fields are stored as columns so that
 * delete-by-document can use a plain indexed equality filter.
 */
@Repository
@ConditionalOnProperty(prefix = "assistant.index", name = "type", havingValue = "pgvector", matchIfMissing = true)
public class PgVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

    private static final Set<String> FILTERABLE_FIELDS = Set.of(
            IndexedPoint.DOCUMENT_ID, IndexedPoint.FILENAME, IndexedPoint.CHUNK_INDEX);

    private static final String COLUMNS =
            "id, text, chunk_index, filename, document_id, file_size, processed_date, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final String table;
    private volatile DistanceMetric metric;

    public PgVectorIndex(JdbcTemplate jdbcTemplate, AssistantProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = properties.getIndex().getCollection();
        this.metric = properties.getIndex().getMetric();
    }

    @Override
    public void ensureCollection(int dimension, DistanceMetric metric) {
        try {
            jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");

            List<Integer> existing = jdbcTemplate.queryForList(
                    "SELECT atttypmod FROM pg_attribute WHERE attrelid = to_regclass(?) AND attname = 'embedding'",
                    Integer.class, table);
            this.metric = metric;

            if (!existing.isEmpty()) {
                int existingDimension = existing.get(0);
                if (existingDimension != dimension) {
                    throw new ConfigurationException("Collection '" + table + "' has dimension "
                            + existingDimension + " but the embedding backend produces " + dimension);
                }
                log.info("Collection '{}' already exists", table);
                return;
            }

            jdbcTemplate.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        id UUID PRIMARY KEY,
                        embedding vector(%d) NOT NULL,
                        text TEXT NOT NULL,
                        chunk_index INTEGER NOT NULL,
                        filename TEXT,
                        document_id TEXT NOT NULL,
                        file_size BIGINT,
                        processed_date TIMESTAMPTZ,
                        created_at TIMESTAMPTZ
                    )""".formatted(table, dimension));
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %s_embedding_idx ON %s USING hnsw (embedding %s)"
                    .formatted(table, table, metric.operatorClass()));
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS %s_document_id_idx ON %s (document_id)"
                    .formatted(table, table));

            log.info("Created collection '{}' (dimension={}, metric={})", table, dimension, metric);
        } catch (DataAccessException e) {
            throw new IndexException("Failed to ensure collection '" + table + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void upsert(List<IndexedPoint> points) {
        if (points.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO %s (id, embedding, text, chunk_index, filename, document_id, file_size, processed_date, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    embedding = EXCLUDED.embedding,
                    text = EXCLUDED.text,
                    chunk_index = EXCLUDED.chunk_index,
                    filename = EXCLUDED.filename,
                    document_id = EXCLUDED.document_id,
                    file_size = EXCLUDED.file_size,
                    processed_date = EXCLUDED.processed_date,
                    created_at = EXCLUDED.created_at""".formatted(table);

        List<Object[]> rows = points.stream()
                .map(point -> {
                    Map<String, Object> payload = point.payload();
                    return new Object[]{
                            UUID.fromString(point.id()),
                            new PGvector(point.vector()),
                            payload.get(IndexedPoint.TEXT),
                            payload.get(IndexedPoint.CHUNK_INDEX),
                            payload.get(IndexedPoint.FILENAME),
                            payload.get(IndexedPoint.DOCUMENT_ID),
                            payload.get(IndexedPoint.FILE_SIZE),
                            toTimestamp(payload.get(IndexedPoint.PROCESSED_DATE)),
                            toTimestamp(payload.getOrDefault(IndexedPoint.CREATED_AT, Instant.now()))
                    };
                })
                .toList();

        try {
            jdbcTemplate.batchUpdate(sql, rows);
            log.info("Stored {} embeddings in collection '{}'", points.size(), table);
        } catch (DataAccessException e) {
            throw new IndexException("Failed to store embeddings: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ScoredPoint> search(float[] vector, int limit) {
        DistanceMetric current = metric;
        String sql = "SELECT %s, embedding %s ? AS distance FROM %s ORDER BY embedding %s ? LIMIT ?"
                .formatted(COLUMNS, current.operator(), table, current.operator());
        PGvector query = new PGvector(vector);

        try {
            List<ScoredPoint> results = jdbcTemplate.query(sql,
                    (rs, rowNum) -> toScoredPoint(rs, current), query, query, limit);
            log.info("Found {} similar documents", results.size());
            return results;
        } catch (DataAccessException e) {
            throw new IndexException("Failed to search documents: " + e.getMessage(), e);
        }
    }

    @Override
    public int deleteWhere(String field, Object value) {
        if (!FILTERABLE_FIELDS.contains(field)) {
            throw new IllegalArgumentException("Cannot filter on field: " + field);
        }

        try {
            int deleted = jdbcTemplate.update("DELETE FROM %s WHERE %s = ?".formatted(table, field), value);
            if (deleted > 0) {
                log.info("Deleted {} points matching {}={}", deleted, field, value);
            } else {
                log.info("No points found matching {}={}", field, value);
            }
            return deleted;
        } catch (DataAccessException e) {
            throw new IndexException("Failed to delete by filter " + field + "=" + value + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean probe() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to connect to vector index: {}", e.getMessage());
            return false;
        }
    }

    private ScoredPoint toScoredPoint(ResultSet rs, DistanceMetric current) throws SQLException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(IndexedPoint.TEXT, rs.getString("text"));
        payload.put(IndexedPoint.CHUNK_INDEX, rs.getInt("chunk_index"));
        payload.put(IndexedPoint.FILENAME, rs.getString("filename"));
        payload.put(IndexedPoint.DOCUMENT_ID, rs.getString("document_id"));
        payload.put(IndexedPoint.FILE_SIZE, rs.getLong("file_size"));
        putInstant(payload, IndexedPoint.PROCESSED_DATE, rs.getTimestamp("processed_date"));
        putInstant(payload, IndexedPoint.CREATED_AT, rs.getTimestamp("created_at"));

        double score = current.similarityFromDistance(rs.getDouble("distance"));
        return new ScoredPoint(rs.getString("id"), score, payload);
    }

    private static void putInstant(Map<String, Object> payload, String key, Timestamp timestamp) {
        if (timestamp != null) {
            payload.put(key, timestamp.toInstant());
        }
    }

    private static Timestamp toTimestamp(Object value) {
        return value instanceof Instant instant ? Timestamp.from(instant) : null;
    }
}
