package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.exception.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Generation backend over Spring AI's ChatModel.
 */
@Service
public class ChatModelGenerationBackend implements GenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(ChatModelGenerationBackend.class);

    private final ChatModel chatModel;

    public ChatModelGenerationBackend(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
        try {
            ChatResponse response = chatModel.call(prompt(systemPrompt, userPrompt, maxTokens, temperature));
            String content = textOf(response);
            return content == null ? "" : content;
        } catch (RuntimeException e) {
            throw new GenerationException("Generation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Flux<String> completeStreaming(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
        return Flux.defer(() -> chatModel.stream(prompt(systemPrompt, userPrompt, maxTokens, temperature)))
                .mapNotNull(ChatModelGenerationBackend::textOf)
                .filter(delta -> !delta.isEmpty())
                .onErrorMap(e -> !(e instanceof GenerationException),
                        e -> new GenerationException("Streaming failed: " + e.getMessage(), e));
    }

    @Override
    public boolean probe() {
        try {
            complete("", "Hello", 1, 0.1);
            log.info("Successfully connected to generation backend");
            return true;
        } catch (GenerationException e) {
            log.error("Failed to connect to generation backend: {}", e.getMessage());
            return false;
        }
    }

    private Prompt prompt(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
        List<Message> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(userPrompt));

        ChatOptions options = ChatOptions.builder()
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
        return new Prompt(messages, options);
    }

    private static String textOf(ChatResponse response) {
        if (response == null) {
            return null;
        }
        Generation generation = response.getResult();
        if (generation == null || generation.getOutput() == null) {
            return null;
        }
        return generation.getOutput().getText();
    }
}
