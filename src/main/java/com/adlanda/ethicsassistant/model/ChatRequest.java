package com.adlanda.ethicsassistant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the chat endpoint.
 *
 * @param topK number of chunks to retrieve; null means the configured default.
 *             The range is checked against the configured maximum when the question is answered.
 */
public record ChatRequest(
        @NotBlank(message = "Query is required")
        String query,

        Boolean stream,

        @JsonProperty("top_k")
        Integer topK
) {
    public ChatRequest {
        if (stream == null) {
            stream = false;
        }
    }
}
