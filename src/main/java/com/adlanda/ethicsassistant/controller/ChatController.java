package com.adlanda.ethicsassistant.controller;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.model.ChatRequest;
import com.adlanda.ethicsassistant.model.ChatResponse;
import com.adlanda.ethicsassistant.model.StreamEvent;
import com.adlanda.ethicsassistant.service.AnswerService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

/**
 * REST controller for asking questions over the indexed documents.
 */
@RestController
@RequestMapping("/api/v1")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final AnswerService answerService;
    private final int defaultTopK;

    public ChatController(AnswerService answerService, AssistantProperties properties) {
        this.answerService = answerService;
        this.defaultTopK = properties.getRetrieval().getDefaultTopK();
    }

    /**
     * Answers a question.
     *
     * Returns a {@link ChatResponse} body, or when {@code stream} is true an SSE stream of
     * {@link StreamEvent}s sent as {@code data:} JSON lines. An out-of-range
     * {@code top_k} is rejected with 400 by the answer service.
     */
    @PostMapping("/chat")
    public Object chat(@Valid @RequestBody ChatRequest request) {
        int topK = request.topK() != null ? request.topK() : defaultTopK;
        log.info("Chat request (stream={}, top_k={})", request.stream(), topK);

        if (Boolean.TRUE.equals(request.stream())) {
            return stream(answerService.askStreaming(request.query(), topK));
        }
        return ChatResponse.from(answerService.ask(request.query(), topK));
    }

    private SseEmitter stream(Flux<StreamEvent> events) {
        // No timeout; the stream ends with its END event or when the client goes away
        SseEmitter emitter = new SseEmitter(0L);

        Disposable subscription = events.subscribe(
                event -> {
                    try {
                        emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Client disconnect or timeout cancels generation
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }
}
