package com.adlanda.ethicsassistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One event of a streamed answer: exactly one METADATA first, then CHUNKs, then exactly one END.
 *
 * type    - event type
 * query / reformulatedQuery / numDocuments - set on METADATA only
 * content - answer increment, set on CHUNK only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
        Type type,
        String query,
        @JsonProperty("reformulated_query") String reformulatedQuery,
        @JsonProperty("num_documents") Integer numDocuments,
        String content
) {
    public enum Type {
        METADATA, CHUNK, END;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }

    public static StreamEvent metadata(String query, String reformulatedQuery, int numDocuments) {
        return new StreamEvent(Type.METADATA, query, reformulatedQuery, numDocuments, null);
    }

    public static StreamEvent chunk(String content) {
        return new StreamEvent(Type.CHUNK, null, null, null, content);
    }

    public static StreamEvent end() {
        return new StreamEvent(Type.END, null, null, null, null);
    }
}
