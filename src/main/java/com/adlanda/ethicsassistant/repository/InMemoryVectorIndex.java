package com.adlanda.ethicsassistant.repository;

import com.adlanda.ethicsassistant.exception.ConfigurationException;
import com.adlanda.ethicsassistant.exception.IndexException;
import com.adlanda.ethicsassistant.model.IndexedPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vector index.
 *
 * Holds points in a map keyed by point ID and searches by brute force.
 * Selected with assistant.index.type=memory; contents are lost on restart.
 */
@Repository
@ConditionalOnProperty(prefix = "assistant.index", name = "type", havingValue = "memory")
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final Map<String, IndexedPoint> points = new ConcurrentHashMap<>();

    private volatile int dimension;
    private volatile DistanceMetric metric = DistanceMetric.COSINE;

    @Override
    public synchronized void ensureCollection(int dimension, DistanceMetric metric) {
        if (this.dimension == 0) {
            this.dimension = dimension;
            this.metric = metric;
            log.info("Created in-memory collection (dimension={}, metric={})", dimension, metric);
            return;
        }
        if (this.dimension != dimension) {
            throw new ConfigurationException("Collection has dimension " + this.dimension
                    + " but " + dimension + " was requested");
        }
        log.info("In-memory collection already exists");
    }

    @Override
    public void upsert(List<IndexedPoint> toStore) {
        for (IndexedPoint point : toStore) {
            if (point.vector() == null || point.vector().length == 0) {
                throw new IndexException("Cannot store point " + point.id() + " without a vector");
            }
            if (dimension != 0 && point.vector().length != dimension) {
                throw new IndexException("Point " + point.id() + " has dimension " + point.vector().length
                        + ", collection expects " + dimension);
            }
        }
        toStore.forEach(point -> points.put(point.id(), point));
        log.info("Stored {} points in collection", toStore.size());
    }

    @Override
    public List<ScoredPoint> search(float[] vector, int limit) {
        return points.values().stream()
                .map(point -> new ScoredPoint(point.id(), score(vector, point.vector()), point.payload()))
                .sorted(Comparator.comparingDouble(ScoredPoint::score).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public int deleteWhere(String field, Object value) {
        List<String> matching = points.values().stream()
                .filter(point -> Objects.equals(point.payload().get(field), value))
                .map(IndexedPoint::id)
                .toList();
        matching.forEach(points::remove);
        log.debug("Deleted {} points where {}={}", matching.size(), field, value);
        return matching.size();
    }

    @Override
    public boolean probe() {
        return true;
    }

    /**
     * Returns the total number of points stored.
     */
    public int size() {
        return points.size();
    }

    /**
     * Returns the IDs of all stored points.
     */
    public List<String> ids() {
        return List.copyOf(points.keySet());
    }

    private double score(float[] query, float[] candidate) {
        if (query.length != candidate.length) {
            throw new IndexException("Vectors must have same dimension");
        }
        return metric.similarity(query, candidate);
    }
}
