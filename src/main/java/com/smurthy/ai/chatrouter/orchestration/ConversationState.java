package com.smurthy.ai.chatrouter.orchestration;

import com.smurthy.ai.chatrouter.conversation.ConversationHistory;
import com.smurthy.ai.chatrouter.retrieval.RetrievedDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one session carries through a routing cycle.
 *
 * History survives across cycles. Utterance, documents, context and response live only for the
 * current cycle and are cleared once it is done. Access is serialised by the owning session.
 */
public class ConversationState {

    private final String sessionId;
    private final ConversationHistory history;

    private String utterance;
    private List<RetrievedDocument> retrievedDocuments = List.of();
    private String context = "";
    private String response = "";
    // null between cycles
    private RoutingStage stage;
    private final List<RoutingStage> stageTrail = new ArrayList<>();
    private final Map<String, Object> diagnostics = new LinkedHashMap<>();

    public ConversationState(String sessionId, ConversationHistory history) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.history = Objects.requireNonNull(history, "history");
    }

    /**
     * Start a new cycle at {@link RoutingStage#START}. Diagnostics of the previous cycle are discarded.
     */
    public void beginCycle(String utterance) {
        if (stage != null && stage != RoutingStage.DONE) {
            throw new IllegalStateException("Session " + sessionId + " is already in stage " + stage);
        }
        clearTransient();
        diagnostics.clear();
        stageTrail.clear();
        this.utterance = utterance;
        enter(RoutingStage.START);
    }

    public void advance(RoutingStage next) {
        if (stage == null || !stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal routing transition " + stage + " -> " + next);
        }
        enter(next);
    }

    /**
     * Drop an interrupted cycle without touching history, so the session can start over.
     */
    public void abandonCycle() {
        clearTransient();
        stage = null;
    }

    public void clearTransient() {
        utterance = null;
        retrievedDocuments = List.of();
        context = "";
        response = "";
    }

    private void enter(RoutingStage next) {
        stage = next;
        stageTrail.add(next);
    }

    public String sessionId() {
        return sessionId;
    }

    public ConversationHistory history() {
        return history;
    }

    public String utterance() {
        return utterance;
    }

    public List<RetrievedDocument> retrievedDocuments() {
        return retrievedDocuments;
    }

    public void setRetrievedDocuments(List<RetrievedDocument> retrievedDocuments) {
        this.retrievedDocuments = List.copyOf(retrievedDocuments);
    }

    public String context() {
        return context;
    }

    public void setContext(String context) {
        this.context = context;
    }

    public String response() {
        return response;
    }

    public void setResponse(String response) {
        this.response = response;
    }

    public RoutingStage stage() {
        return stage;
    }

    public List<RoutingStage> stageTrail() {
        return List.copyOf(stageTrail);
    }

    public void putDiagnostic(String key, Object value) {
        diagnostics.put(key, value);
    }

    public Map<String, Object> diagnostics() {
        return diagnostics;
    }
}
