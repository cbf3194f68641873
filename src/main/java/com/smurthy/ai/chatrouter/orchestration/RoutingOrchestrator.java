package com.smurthy.ai.chatrouter.orchestration;

import com.smurthy.ai.chatrouter.classifier.ClassificationResult;
import com.smurthy.ai.chatrouter.classifier.QueryClassifier;
import com.smurthy.ai.chatrouter.classifier.QueryLabel;
import com.smurthy.ai.chatrouter.config.ConversationConfig;
import com.smurthy.ai.chatrouter.config.GenerationConfig;
import com.smurthy.ai.chatrouter.config.RetrievalConfig;
import com.smurthy.ai.chatrouter.config.RoutingConfig;
import com.smurthy.ai.chatrouter.context.ContextFormatter;
import com.smurthy.ai.chatrouter.conversation.Turn;
import com.smurthy.ai.chatrouter.generation.CannedReplies;
import com.smurthy.ai.chatrouter.generation.GenerationClient;
import com.smurthy.ai.chatrouter.generation.GenerationTimeoutException;
import com.smurthy.ai.chatrouter.generation.GenerationUnavailableException;
import com.smurthy.ai.chatrouter.generation.PromptAssembler;
import com.smurthy.ai.chatrouter.observability.RoutingMetrics;
import com.smurthy.ai.chatrouter.observability.RoutingMetrics.CycleMetricData;
import com.smurthy.ai.chatrouter.observability.RoutingMetrics.GenerationError;
import com.smurthy.ai.chatrouter.retrieval.RetrievalClient;
import com.smurthy.ai.chatrouter.retrieval.RetrievalUnavailableException;
import com.smurthy.ai.chatrouter.retrieval.RetrievedDocument;
import com.smurthy.ai.chatrouter.service.CycleCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one request/response cycle through the routing stages.
 *
 * Classify, pick a {@link RoutingPath}, retrieve and format context when the path needs it,
 * generate, then commit the user and assistant turns to history. Backend failures never escape:
 * retrieval degrades to an empty context and generation to a fixed apology, each flagged in the
 * diagnostics. Only {@link CycleCancelledException} leaves a cycle early, and it leaves history
 * untouched.
 */
@Component
public class RoutingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RoutingOrchestrator.class);

    private final QueryClassifier classifier;
    private final RetrievalClient retrievalClient;
    private final ContextFormatter contextFormatter;
    private final PromptAssembler promptAssembler;
    private final GenerationClient generationClient;
    private final RoutingMetrics metrics;
    private final ConversationConfig conversationConfig;
    private final RetrievalConfig retrievalConfig;
    private final GenerationConfig generationConfig;
    private final RoutingConfig routingConfig;

    public RoutingOrchestrator(QueryClassifier classifier,
                               RetrievalClient retrievalClient,
                               ContextFormatter contextFormatter,
                               PromptAssembler promptAssembler,
                               GenerationClient generationClient,
                               RoutingMetrics metrics,
                               ConversationConfig conversationConfig,
                               RetrievalConfig retrievalConfig,
                               GenerationConfig generationConfig,
                               RoutingConfig routingConfig) {
        this.classifier = classifier;
        this.retrievalClient = retrievalClient;
        this.contextFormatter = contextFormatter;
        this.promptAssembler = promptAssembler;
        this.generationClient = generationClient;
        this.metrics = metrics;
        this.conversationConfig = conversationConfig;
        this.retrievalConfig = retrievalConfig;
        this.generationConfig = generationConfig;
        this.routingConfig = routingConfig;
    }

    /**
     * Run a full cycle for {@code utterance} against {@code state}. The caller must hold the session lock.
     */
    public CycleResult runCycle(ConversationState state, String utterance) {
        long start = System.currentTimeMillis();
        state.beginCycle(utterance);
        try {
            ClassificationResult classification = classify(state);
            RoutingPath path = RoutingPath.forLabel(classification.label());
            state.putDiagnostic(Diagnostics.PATH, path.name());

            CycleOutcome outcome = switch (path) {
                case KNOWLEDGE_BASE -> answerFromKnowledgeBase(state);
                case DIRECT, GREETING, CLARIFICATION -> answerDirectly(state, path, classification.label());
            };
            state.advance(RoutingStage.RESPONDED);

            return complete(state, classification, path, outcome, System.currentTimeMillis() - start);
        } finally {
            // any throwable before DONE leaves history untouched and the session ready for the next cycle
            if (state.stage() != RoutingStage.DONE) {
                state.abandonCycle();
            }
        }
    }

    private ClassificationResult classify(ConversationState state) {
        List<Turn> window = state.history().window(conversationConfig.classifierWindowTurns());
        ClassificationResult classification = classifier.classify(state.utterance(), window);
        state.advance(RoutingStage.CLASSIFIED);

        state.putDiagnostic(Diagnostics.LABEL, classification.label().name());
        state.putDiagnostic(Diagnostics.CONFIDENCE, classification.confidence());
        state.putDiagnostic(Diagnostics.CONFIDENT, classification.isConfident());
        state.putDiagnostic(Diagnostics.MATCHED_SIGNALS, List.copyOf(classification.matchedSignals()));

        if (classification.isConfident()) {
            log.info("Session {}: routed as {} (confidence={})", state.sessionId(),
                    classification.label(), String.format("%.2f", classification.confidence()));
        } else {
            log.info("Session {}: low-confidence routing as {} (confidence={}, signals={})", state.sessionId(),
                    classification.label(), String.format("%.2f", classification.confidence()),
                    classification.matchedSignals());
        }
        return classification;
    }

    private CycleOutcome answerFromKnowledgeBase(ConversationState state) {
        state.advance(RoutingStage.RETRIEVING);
        state.putDiagnostic(Diagnostics.RETRIEVAL_BACKEND, retrievalConfig.backendName());
        boolean retrievalFailed = retrieve(state);

        state.advance(RoutingStage.CONTEXT_FORMATTED);
        state.setContext(formatContext(state));

        state.advance(RoutingStage.GENERATING);
        List<Message> prompt = promptAssembler.forKnowledgeBase(state.utterance(), state.context(), promptHistory(state));
        GenerationError generationError = generate(state, prompt);
        return new CycleOutcome(true, retrievalFailed, generationError);
    }

    private CycleOutcome answerDirectly(ConversationState state, RoutingPath path, QueryLabel label) {
        state.advance(RoutingStage.DIRECT_GENERATING);
        state.putDiagnostic(Diagnostics.RETRIEVAL_COUNT, 0);

        if (path == RoutingPath.GREETING && routingConfig.cannedGreetings()) {
            state.setResponse(CannedReplies.greetingReply(state.utterance()));
            state.putDiagnostic(Diagnostics.GENERATION_BACKEND, Diagnostics.CANNED_BACKEND);
            return new CycleOutcome(false, false, null);
        }

        List<Message> prompt = promptAssembler.forDirectAnswer(label, state.utterance(), promptHistory(state));
        return new CycleOutcome(false, false, generate(state, prompt));
    }

    /**
     * @return true when retrieval failed and the cycle continues without documents
     */
    private boolean retrieve(ConversationState state) {
        List<RetrievedDocument> documents;
        boolean failed = false;
        try {
            documents = retrievalClient.retrieve(state.utterance());
        } catch (RetrievalUnavailableException e) {
            log.warn("Session {}: retrieval failed, continuing without context: {}", state.sessionId(), e.getMessage());
            state.putDiagnostic(Diagnostics.RETRIEVAL_ERROR, e.isTimedOut() ? Diagnostics.TIMEOUT : Diagnostics.UNAVAILABLE);
            documents = List.of();
            failed = true;
        } catch (CycleCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Session {}: unexpected retrieval error, continuing without context", state.sessionId(), e);
            state.putDiagnostic(Diagnostics.RETRIEVAL_ERROR, Diagnostics.UNAVAILABLE);
            documents = List.of();
            failed = true;
        }
        state.setRetrievedDocuments(documents);
        state.putDiagnostic(Diagnostics.RETRIEVAL_COUNT, documents.size());
        return failed;
    }

    private String formatContext(ConversationState state) {
        try {
            return contextFormatter.format(state.retrievedDocuments());
        } catch (RuntimeException e) {
            log.warn("Session {}: context formatting failed, using empty context", state.sessionId(), e);
            state.putDiagnostic(Diagnostics.FORMAT_ERROR, e.getClass().getSimpleName());
            return ContextFormatter.NO_CONTEXT;
        }
    }

    /**
     * Sets the response and returns the failure kind, or null on success.
     */
    private GenerationError generate(ConversationState state, List<Message> prompt) {
        state.putDiagnostic(Diagnostics.GENERATION_BACKEND, generationConfig.backendName());
        GenerationError error;
        try {
            state.setResponse(generationClient.generate(prompt));
            return null;
        } catch (GenerationTimeoutException e) {
            log.warn("Session {}: generation timed out: {}", state.sessionId(), e.getMessage());
            error = GenerationError.TIMEOUT;
        } catch (GenerationUnavailableException e) {
            log.warn("Session {}: generation unavailable: {}", state.sessionId(), e.getMessage());
            error = GenerationError.UNAVAILABLE;
        } catch (CycleCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Session {}: unexpected generation error", state.sessionId(), e);
            error = GenerationError.UNAVAILABLE;
        }

        state.setResponse(CannedReplies.FALLBACK_APOLOGY);
        state.putDiagnostic(Diagnostics.GENERATION_ERROR,
                error == GenerationError.TIMEOUT ? Diagnostics.TIMEOUT : Diagnostics.UNAVAILABLE);
        state.putDiagnostic(Diagnostics.ERROR_STAGE, state.stage().name());
        return error;
    }

    private List<Turn> promptHistory(ConversationState state) {
        if (!conversationConfig.historyInPrompt()) {
            return List.of();
        }
        return state.history().window(conversationConfig.promptHistoryTurns());
    }

    private CycleResult complete(ConversationState state,
                                 ClassificationResult classification,
                                 RoutingPath path,
                                 CycleOutcome outcome,
                                 long elapsedMs) {
        state.history().appendExchange(Turn.user(state.utterance()), Turn.assistant(state.response()));
        state.advance(RoutingStage.DONE);

        List<String> stages = new ArrayList<>();
        state.stageTrail().forEach(stage -> stages.add(stage.name()));
        state.putDiagnostic(Diagnostics.SESSION_ID, state.sessionId());
        state.putDiagnostic(Diagnostics.STAGES, stages);
        state.putDiagnostic(Diagnostics.ELAPSED_MS, elapsedMs);
        state.putDiagnostic(Diagnostics.HISTORY_SIZE, state.history().size());

        metrics.recordCycle(new CycleMetricData(
                classification.label(),
                path.name(),
                elapsedMs,
                outcome.retrievalAttempted(),
                outcome.retrievalFailed(),
                state.retrievedDocuments(),
                outcome.generationError()));

        CycleResult result = new CycleResult(state.sessionId(), state.response(), state.diagnostics());
        state.clearTransient();

        log.debug("Session {}: cycle done in {}ms, history now {} turns",
                state.sessionId(), elapsedMs, state.history().size());
        return result;
    }

    private record CycleOutcome(boolean retrievalAttempted, boolean retrievalFailed, GenerationError generationError) {
    }
}
