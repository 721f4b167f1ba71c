package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.ValidationException;
import com.adlanda.ethicsassistant.model.AnswerResult;
import com.adlanda.ethicsassistant.model.ComponentStatus;
import com.adlanda.ethicsassistant.model.HealthStatus;
import com.adlanda.ethicsassistant.model.RetrievalContext;
import com.adlanda.ethicsassistant.model.RetrievedChunk;
import com.adlanda.ethicsassistant.model.StreamEvent;
import com.adlanda.ethicsassistant.repository.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Answers questions over the indexed documents.
 *
 * Each request runs reformulate, retrieve and assemble exactly once, then generates
 * either a complete answer or a stream of increments. Unexpected failures become a
 * fixed apology for the caller and are logged in full.
 */
@Service
public class AnswerService {

    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    public static final String FALLBACK_ANSWER =
            "I encountered an error processing your question. Please try rephrasing or ask a different question.";

    private final QueryReformulator queryReformulator;
    private final RetrievalService retrievalService;
    private final ContextAssembler contextAssembler;
    private final GenerationBackend generationBackend;
    private final VectorIndex vectorIndex;
    private final int maxTokens;
    private final double temperature;

    public AnswerService(QueryReformulator queryReformulator,
                         RetrievalService retrievalService,
                         ContextAssembler contextAssembler,
                         GenerationBackend generationBackend,
                         VectorIndex vectorIndex,
                         AssistantProperties properties) {
        this.queryReformulator = queryReformulator;
        this.retrievalService = retrievalService;
        this.contextAssembler = contextAssembler;
        this.generationBackend = generationBackend;
        this.vectorIndex = vectorIndex;
        this.maxTokens = properties.getGeneration().getMaxTokens();
        this.temperature = properties.getGeneration().getTemperature();
    }

    /**
     * Reformulates the query, retrieves the top chunks and formats them.
     * Not cached: every call reflects the current index.
     */
    public RetrievalContext contextFor(String userQuery, int topK) {
        String reformulated = queryReformulator.reformulate(userQuery);
        List<RetrievedChunk> documents = retrievalService.retrieve(reformulated, topK);
        String context = contextAssembler.format(documents);
        return new RetrievalContext(userQuery, reformulated, documents, context);
    }

    /**
     * Produces a complete answer plus the retrieval metadata gathered in the same pass.
     *
     * @throws ValidationException if the query is blank or topK is out of range
     */
    public AnswerResult ask(String userQuery, int topK) {
        validate(userQuery, topK);

        RetrievalContext context = null;
        try {
            context = contextFor(userQuery, topK);
            String answer = generationBackend.complete(
                    Prompts.SYSTEM_PROMPT, Prompts.rag(context.context(), userQuery), maxTokens, temperature);
            return new AnswerResult(answer, userQuery, context.reformulatedQuery(), context.documentCount());
        } catch (RuntimeException e) {
            log.error("RAG pipeline failed for query '{}'", userQuery, e);
            return context == null
                    ? new AnswerResult(FALLBACK_ANSWER, userQuery, userQuery, 0)
                    : new AnswerResult(FALLBACK_ANSWER, userQuery, context.reformulatedQuery(), context.documentCount());
        }
    }

    /**
     * Streams an answer: one METADATA event, then CHUNK events as the backend produces
     * them, then one END event.
     *
     * Retrieval runs once on subscription, off the caller's thread. Cancelling the
     * subscription abandons generation; nothing further is emitted and nothing is retried.
     *
     * @throws ValidationException if the query is blank or topK is out of range
     */
    public Flux<StreamEvent> askStreaming(String userQuery, int topK) {
        validate(userQuery, topK);

        Mono<Optional<RetrievalContext>> contextMono = Mono.fromCallable(() -> contextFor(userQuery, topK))
                .subscribeOn(Schedulers.boundedElastic())
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.error("RAG pipeline failed for query '{}'", userQuery, e);
                    return Mono.just(Optional.empty());
                });

        return contextMono
                .flatMapMany(context -> context
                        .map(this::streamWithContext)
                        .orElseGet(() -> Flux.just(
                                StreamEvent.metadata(userQuery, userQuery, 0),
                                StreamEvent.chunk(FALLBACK_ANSWER))))
                .concatWith(Mono.just(StreamEvent.end()))
                .doOnCancel(() -> log.info("Streaming answer cancelled by caller for query '{}'", userQuery));
    }

    /**
     * Probes the generation backend and the vector index independently and aggregates.
     * Never throws.
     */
    public HealthStatus healthCheck() {
        try {
            ComponentStatus llm = probe("generation backend", generationBackend::probe);
            ComponentStatus index = probe("vector index", vectorIndex::probe);
            return HealthStatus.of(llm, index);
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return HealthStatus.failed(e.getMessage());
        }
    }

    private Flux<StreamEvent> streamWithContext(RetrievalContext context) {
        String query = context.originalQuery();
        // Deferred so a backend that fails before returning its Flux still hits the fallback
        Flux<StreamEvent> increments = Flux.defer(() -> generationBackend.completeStreaming(
                        Prompts.SYSTEM_PROMPT, Prompts.rag(context.context(), query), maxTokens, temperature))
                .map(StreamEvent::chunk)
                .onErrorResume(e -> {
                    log.error("Streaming generation failed for query '{}'", query, e);
                    return Flux.just(StreamEvent.chunk(FALLBACK_ANSWER));
                });

        return Flux.concat(
                Mono.just(StreamEvent.metadata(query, context.reformulatedQuery(), context.documentCount())),
                increments);
    }

    private void validate(String userQuery, int topK) {
        if (userQuery == null || userQuery.isBlank()) {
            throw new ValidationException("Query is required");
        }
        retrievalService.validateTopK(topK);
    }

    private static ComponentStatus probe(String name, BooleanSupplier probe) {
        try {
            return ComponentStatus.of(probe.getAsBoolean());
        } catch (RuntimeException e) {
            log.warn("Health probe for {} failed: {}", name, e.getMessage());
            return ComponentStatus.UNHEALTHY;
        }
    }
}
