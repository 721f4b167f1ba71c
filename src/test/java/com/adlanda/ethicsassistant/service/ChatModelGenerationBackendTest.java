package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.exception.GenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelGenerationBackendTest {

    @Mock
    private ChatModel chatModel;

    private ChatModelGenerationBackend backend;

    @BeforeEach
    void setUp() {
        backend = new ChatModelGenerationBackend(chatModel);
    }

    @Test
    void complete_returnsTextAsProduced() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("  Accountability means...  \n"));

        assertThat(backend.complete("system", "user", 100, 0.5)).isEqualTo("  Accountability means...  \n");
    }

    @Test
    void completeStreaming_concatenationMatchesComplete() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("\nOversight is required. "));
        when(chatModel.stream(any(Prompt.class)))
                .thenReturn(Flux.just(response("\nOversight "), response("is required"), response(". ")));

        String blocking = backend.complete("system", "user", 100, 0.5);
        String streamed = String.join("", backend.completeStreaming("system", "user", 100, 0.5)
                .collectList()
                .block());

        assertThat(streamed).isEqualTo(blocking);
    }

    @Test
    void complete_passesMessagesAndOptions() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("ok"));
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);

        backend.complete("You are an assistant", "What is fairness?", 250, 0.2);

        verify(chatModel).call(captor.capture());
        Prompt prompt = captor.getValue();
        List<Message> messages = prompt.getInstructions();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(messages.get(0).getText()).isEqualTo("You are an assistant");
        assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
        assertThat(messages.get(1).getText()).isEqualTo("What is fairness?");
        assertThat(prompt.getOptions().getMaxTokens()).isEqualTo(250);
        assertThat(prompt.getOptions().getTemperature()).isEqualTo(0.2);
    }

    @Test
    void complete_blankSystemPrompt_sendsOnlyUserMessage() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("ok"));
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);

        backend.complete("", "Hello", 1, 0.1);

        verify(chatModel).call(captor.capture());
        assertThat(captor.getValue().getInstructions()).singleElement().isInstanceOf(UserMessage.class);
    }

    @Test
    void complete_modelFails_throwsGenerationException() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("401 Unauthorized"));

        assertThatThrownBy(() -> backend.complete("", "Hello", 10, 0.1))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("401 Unauthorized");
    }

    @Test
    void completeStreaming_dropsEmptyIncrements() {
        when(chatModel.stream(any(Prompt.class)))
                .thenReturn(Flux.just(response("Trans"), response(""), response("parency")));

        List<String> increments = backend.completeStreaming("", "Define transparency", 100, 0.7)
                .collectList()
                .block();

        assertThat(increments).containsExactly("Trans", "parency");
    }

    @Test
    void completeStreaming_isColdUntilSubscribed() {
        backend.completeStreaming("", "Hello", 10, 0.1);

        verifyNoInteractions(chatModel);
    }

    @Test
    void completeStreaming_upstreamError_mappedToGenerationException() {
        when(chatModel.stream(any(Prompt.class)))
                .thenReturn(Flux.error(new IllegalStateException("connection reset")));

        assertThatThrownBy(() -> backend.completeStreaming("", "Hello", 10, 0.1).collectList().block())
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("connection reset");
    }

    @Test
    void probe_reachable_returnsTrue() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("Hi"));

        assertThat(backend.probe()).isTrue();
    }

    @Test
    void probe_unreachable_returnsFalse() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("connection refused"));

        assertThat(backend.probe()).isFalse();
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }
}
