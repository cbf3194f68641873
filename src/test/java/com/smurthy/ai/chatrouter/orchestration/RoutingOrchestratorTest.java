package com.smurthy.ai.chatrouter.orchestration;

import com.smurthy.ai.chatrouter.classifier.QueryClassifier;
import com.smurthy.ai.chatrouter.config.ContextConfig;
import com.smurthy.ai.chatrouter.config.ConversationConfig;
import com.smurthy.ai.chatrouter.config.GenerationConfig;
import com.smurthy.ai.chatrouter.config.RetrievalConfig;
import com.smurthy.ai.chatrouter.config.RoutingConfig;
import com.smurthy.ai.chatrouter.context.ContextFormatter;
import com.smurthy.ai.chatrouter.conversation.ConversationHistory;
import com.smurthy.ai.chatrouter.conversation.Turn;
import com.smurthy.ai.chatrouter.generation.CannedReplies;
import com.smurthy.ai.chatrouter.generation.GenerationClient;
import com.smurthy.ai.chatrouter.generation.GenerationTimeoutException;
import com.smurthy.ai.chatrouter.generation.GenerationUnavailableException;
import com.smurthy.ai.chatrouter.generation.PromptAssembler;
import com.smurthy.ai.chatrouter.observability.RoutingMetrics;
import com.smurthy.ai.chatrouter.retrieval.RetrievalClient;
import com.smurthy.ai.chatrouter.retrieval.RetrievalUnavailableException;
import com.smurthy.ai.chatrouter.retrieval.RetrievedDocument;
import com.smurthy.ai.chatrouter.service.CycleCancelledException;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.Message;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RoutingOrchestrator.
 *
 * Tests routing per label, fallbacks on backend failure, history commit and cancellation.
 * The classifier, formatter and prompt assembler are real; the two backends are mocked.
 */
@ExtendWith(MockitoExtension.class)
class RoutingOrchestratorTest {

    private static final String SESSION_ID = "session-1";

    @Mock
    private RetrievalClient retrievalClient;

    @Mock
    private GenerationClient generationClient;

    private RoutingMetrics metrics;
    private ConversationState state;

    @BeforeEach
    void setUp() {
        metrics = new RoutingMetrics();
        state = new ConversationState(SESSION_ID, new ConversationHistory(5));
    }

    @Test
    @DisplayName("Should retrieve exactly once for a domain question and ground the answer in context")
    void testKnowledgeBasePath() {
        // Given
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(retrievalClient.retrieve("What is my daily transaction limit?")).thenReturn(List.of(
                new RetrievedDocument("kb-7", "Basic accounts allow 1,000 EUR per day.", Map.of("category", "Limits"), 0.82)));
        when(generationClient.generate(anyList())).thenReturn("Your daily limit is 1,000 EUR.");

        // When
        CycleResult result = orchestrator.runCycle(state, "What is my daily transaction limit?");

        // Then
        assertThat(result.response()).isEqualTo("Your daily limit is 1,000 EUR.");
        assertThat(result.diagnostic(Diagnostics.LABEL)).isEqualTo("RAG_REQUIRED");
        assertThat(result.diagnostic(Diagnostics.PATH)).isEqualTo("KNOWLEDGE_BASE");
        assertThat(result.diagnostic(Diagnostics.RETRIEVAL_COUNT)).isEqualTo(1);
        assertThat(result.diagnostic(Diagnostics.RETRIEVAL_BACKEND)).isEqualTo("chroma");
        assertThat(result.diagnostic(Diagnostics.GENERATION_BACKEND)).isEqualTo("ollama");
        assertThat(result.diagnostic(Diagnostics.STAGES)).isEqualTo(List.of(
                "START", "CLASSIFIED", "RETRIEVING", "CONTEXT_FORMATTED", "GENERATING", "RESPONDED", "DONE"));
        verify(retrievalClient, times(1)).retrieve(anyString());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> promptCaptor = ArgumentCaptor.forClass(List.class);
        verify(generationClient).generate(promptCaptor.capture());
        assertThat(promptCaptor.getValue().get(1).getText()).contains("[1] Category: Limits");
    }

    @Test
    @DisplayName("Should never retrieve for greetings")
    void testGreetingSkipsRetrieval() {
        // Given
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(generationClient.generate(anyList())).thenReturn("Hello! How can I help?");

        // When
        CycleResult result = orchestrator.runCycle(state, "hello");

        // Then
        assertThat(result.diagnostic(Diagnostics.LABEL)).isEqualTo("GREETING");
        assertThat(result.diagnostic(Diagnostics.RETRIEVAL_COUNT)).isEqualTo(0);
        assertThat(result.hasDiagnostic(Diagnostics.RETRIEVAL_BACKEND)).isFalse();
        verifyNoInteractions(retrievalClient);
    }

    @Test
    @DisplayName("Should answer weather questions directly without retrieval")
    void testDirectPath() {
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(generationClient.generate(anyList())).thenReturn("I can't check live weather.");

        CycleResult result = orchestrator.runCycle(state, "What's the weather?");

        assertThat(result.diagnostic(Diagnostics.LABEL)).isEqualTo("DIRECT_ANSWER");
        assertThat(result.diagnostic(Diagnostics.PATH)).isEqualTo("DIRECT");
        assertThat(result.diagnostic(Diagnostics.STAGES)).isEqualTo(List.of(
                "START", "CLASSIFIED", "DIRECT_GENERATING", "RESPONDED", "DONE"));
        verifyNoInteractions(retrievalClient);
    }

    @Test
    @DisplayName("Should ask for clarification on unclear input without retrieval")
    void testClarificationPath() {
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(generationClient.generate(anyList())).thenReturn("Could you tell me more?");

        CycleResult result = orchestrator.runCycle(state, "asdf");

        assertThat(result.diagnostic(Diagnostics.LABEL)).isEqualTo("UNCLEAR");
        assertThat(result.diagnostic(Diagnostics.PATH)).isEqualTo("CLARIFICATION");
        verifyNoInteractions(retrievalClient);
    }

    @Test
    @DisplayName("Should answer canned greetings without calling any backend")
    void testCannedGreeting() {
        RoutingOrchestrator orchestrator = orchestrator(true);

        CycleResult result = orchestrator.runCycle(state, "thanks");

        assertThat(result.response()).isEqualTo("You're welcome! Is there anything else I can help with?");
        assertThat(result.diagnostic(Diagnostics.GENERATION_BACKEND)).isEqualTo(Diagnostics.CANNED_BACKEND);
        verifyNoInteractions(retrievalClient, generationClient);
        assertThat(state.history().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should continue with an empty context when retrieval fails")
    void testRetrievalFailure() {
        // Given
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(retrievalClient.retrieve(anyString()))
                .thenThrow(new RetrievalUnavailableException("Vector store down", null, false));
        when(generationClient.generate(anyList())).thenReturn("I don't have that information in my knowledge base.");

        // When
        CycleResult result = orchestrator.runCycle(state, "How do I block my card?");

        // Then
        assertThat(result.response()).isNotBlank();
        assertThat(result.diagnostic(Diagnostics.RETRIEVAL_ERROR)).isEqualTo(Diagnostics.UNAVAILABLE);
        assertThat(result.diagnostic(Diagnostics.RETRIEVAL_COUNT)).isEqualTo(0);
        assertThat(state.stage()).isEqualTo(RoutingStage.DONE);
        assertThat(state.history().turns()).containsExactly(
                Turn.user("How do I block my card?"),
                Turn.assistant("I don't have that information in my knowledge base."));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> promptCaptor = ArgumentCaptor.forClass(List.class);
        verify(generationClient).generate(promptCaptor.capture());
        assertThat(promptCaptor.getValue().get(1).getText()).contains(ContextFormatter.NO_CONTEXT);
    }

    @Test
    @DisplayName("Should apologise and flag a generation timeout")
    void testGenerationTimeout() {
        // Given
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(generationClient.generate(anyList()))
                .thenThrow(new GenerationTimeoutException("timed out after 30000ms", null));

        // When
        CycleResult result = orchestrator.runCycle(state, "What's the weather?");

        // Then
        assertThat(result.response()).isEqualTo(CannedReplies.FALLBACK_APOLOGY);
        assertThat(result.diagnostic(Diagnostics.GENERATION_ERROR)).isEqualTo(Diagnostics.TIMEOUT);
        assertThat(result.diagnostic(Diagnostics.ERROR_STAGE)).isEqualTo("DIRECT_GENERATING");
        assertThat(state.history().size()).isEqualTo(2);
        assertThat(metrics.getMetricsSummary().generationTimeouts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat unexpected generation errors as unavailable")
    void testUnexpectedGenerationError() {
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(retrievalClient.retrieve(anyString())).thenReturn(List.of());
        when(generationClient.generate(anyList())).thenThrow(new NullPointerException("adapter bug"));

        CycleResult result = orchestrator.runCycle(state, "What are the fees?");

        assertThat(result.response()).isEqualTo(CannedReplies.FALLBACK_APOLOGY);
        assertThat(result.diagnostic(Diagnostics.GENERATION_ERROR)).isEqualTo(Diagnostics.UNAVAILABLE);
        assertThat(result.diagnostic(Diagnostics.ERROR_STAGE)).isEqualTo("GENERATING");
    }

    @Test
    @DisplayName("Should leave history untouched when the cycle is cancelled")
    void testCancellation() {
        // Given
        RoutingOrchestrator orchestrator = orchestrator(false);
        state.history().appendExchange(Turn.user("hello"), Turn.assistant("Hi!"));
        when(generationClient.generate(anyList()))
                .thenThrow(new CycleCancelledException("generation call cancelled by caller", null))
                .thenReturn("It is 3 pm.");

        // When / Then
        assertThatThrownBy(() -> orchestrator.runCycle(state, "What's the weather?"))
                .isInstanceOf(CycleCancelledException.class);
        assertThat(state.history().size()).isEqualTo(2);
        assertThat(state.stage()).isNull();

        // and the session can run the next cycle
        CycleResult next = orchestrator.runCycle(state, "What time is it?");
        assertThat(next.response()).isEqualTo("It is 3 pm.");
        assertThat(state.history().size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reset the stage when a backend adapter throws an Error")
    void testErrorAbandonsCycle() {
        // Given
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(generationClient.generate(anyList()))
                .thenThrow(new NoClassDefFoundError("adapter class missing"))
                .thenReturn("It is 3 pm.");

        // When / Then
        assertThatThrownBy(() -> orchestrator.runCycle(state, "What's the weather?"))
                .isInstanceOf(NoClassDefFoundError.class);
        assertThat(state.stage()).isNull();
        assertThat(state.utterance()).isNull();
        assertThat(state.history().isEmpty()).isTrue();

        CycleResult next = orchestrator.runCycle(state, "What time is it?");
        assertThat(next.response()).isEqualTo("It is 3 pm.");
        assertThat(state.history().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should clear transient fields and keep turns after a cycle")
    void testTransientFieldsCleared() {
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(retrievalClient.retrieve(anyString())).thenReturn(List.of(
                new RetrievedDocument("kb-1", "Freeze it in the app.", Map.of(), 0.9)));
        when(generationClient.generate(anyList())).thenReturn("Freeze it in the app.");

        orchestrator.runCycle(state, "My card was stolen");

        assertThat(state.utterance()).isNull();
        assertThat(state.retrievedDocuments()).isEmpty();
        assertThat(state.context()).isEmpty();
        assertThat(state.response()).isEmpty();
        assertThat(state.history().size()).isEqualTo(2);
        assertThat(metrics.getMetricsSummary().totalRetrievals()).isEqualTo(1);
        assertThat(metrics.getMetricsSummary().totalDocumentsRetrieved()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should route a follow-up to retrieval using the previous exchange")
    void testFollowUpUsesHistory() {
        // Given
        RoutingOrchestrator orchestrator = orchestrator(false);
        when(retrievalClient.retrieve(anyString())).thenReturn(List.of());
        when(generationClient.generate(anyList())).thenReturn("Transfers cost 1%.", "Usually one business day.");
        orchestrator.runCycle(state, "What is the fee for an international transfer?");

        // When
        CycleResult result = orchestrator.runCycle(state, "And how long does it take?");

        // Then
        assertThat(result.diagnostic(Diagnostics.LABEL)).isEqualTo("RAG_REQUIRED");
        assertThat(result.diagnostic(Diagnostics.MATCHED_SIGNALS))
                .asInstanceOf(InstanceOfAssertFactories.list(String.class))
                .contains("follow_up");
        verify(retrievalClient, times(2)).retrieve(anyString());
    }

    @Test
    @DisplayName("Should refuse to start a cycle while one is in progress")
    void testIllegalTransition() {
        state.beginCycle("hello");

        assertThatThrownBy(() -> state.beginCycle("again")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> state.advance(RoutingStage.GENERATING)).isInstanceOf(IllegalStateException.class);
    }

    private RoutingOrchestrator orchestrator(boolean cannedGreetings) {
        return new RoutingOrchestrator(
                new QueryClassifier(),
                retrievalClient,
                new ContextFormatter(new ContextConfig(2000)),
                new PromptAssembler(),
                generationClient,
                metrics,
                new ConversationConfig(5, 2, true, 10, Duration.ofMinutes(30), 10_000),
                new RetrievalConfig(3, 0.0, Duration.ofSeconds(10), "chroma", null),
                new GenerationConfig(Duration.ofSeconds(30), "ollama"),
                new RoutingConfig(cannedGreetings, 8));
    }
}
