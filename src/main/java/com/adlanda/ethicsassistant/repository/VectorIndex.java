package com.adlanda.ethicsassistant.repository;

import com.adlanda.ethicsassistant.model.IndexedPoint;

import java.util.List;

/**
 * Storage and nearest-neighbour search for embedded chunks.
 *
 * Implementations rely on the backend's own consistency for individual calls;
 * no locking is done above them.
 */
public interface VectorIndex {

    /**
     * Creates the collection if absent; no-op if it already exists.
     *
     * @throws com.adlanda.ethicsassistant.exception.ConfigurationException if an existing
     *         collection has a different dimension
     */
    void ensureCollection(int dimension, DistanceMetric metric);

    /**
     * Inserts the points, replacing any existing point with the same ID.
     */
    void upsert(List<IndexedPoint> points);

    /**
     * Returns at most {@code limit} points, most similar first.
     */
    List<ScoredPoint> search(float[] vector, int limit);

    /**
     * Deletes every point whose payload field equals the value.
     *
     * @return number of points deleted
     */
    int deleteWhere(String field, Object value);

    /**
     * @return true if the backend is reachable
     */
    boolean probe();
}
