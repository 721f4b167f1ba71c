package com.adlanda.ethicsassistant.service;

import java.util.List;

/**
 * Computes fixed-length embedding vectors for text.
 */
public interface EmbeddingBackend {

    float[] embedOne(String text);

    /**
     * Embeds a batch in one call.
     *
     * @return one vector per input, in input order
     */
    List<float[]> embedMany(List<String> texts);

    /**
     * Output dimensionality, fixed for the lifetime of the backend.
     */
    int dimensions();
}
