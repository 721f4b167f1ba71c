package com.adlanda.ethicsassistant.service;

import reactor.core.publisher.Flux;

/**
 * Text-generation backend.
 */
public interface GenerationBackend {

    /**
     * Generates a complete response in one blocking call. The text is returned as the
     * model produced it, so it equals the concatenated increments of {@link #completeStreaming}.
     *
     * @param systemPrompt role instructions, may be blank
     * @throws com.adlanda.ethicsassistant.exception.GenerationException on failure
     */
    String complete(String systemPrompt, String userPrompt, int maxTokens, double temperature);

    /**
     * Generates a response as a cold, finite stream of non-empty text increments.
     * Nothing is requested until subscription; cancelling the subscription abandons the call.
     */
    Flux<String> completeStreaming(String systemPrompt, String userPrompt, int maxTokens, double temperature);

    /**
     * @return true if the backend answers a minimal request
     */
    boolean probe();
}
