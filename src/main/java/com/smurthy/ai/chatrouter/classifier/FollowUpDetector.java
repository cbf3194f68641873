package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;
import com.smurthy.ai.chatrouter.conversation.TurnRole;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Short follow-ups ("what about that one?") to a knowledge-base question asked in the previous exchange.
 */
public class FollowUpDetector implements SignalDetector {

    public static final String NAME = "follow_up";

    private static final List<String> OPENERS = List.of(
            "and", "also", "what about", "how about", "same for", "what if"
    );

    private static final Set<String> BACK_REFERENCES = Set.of(
            "it", "that", "this", "those", "them", "they"
    );

    private final DomainVocabulary vocabulary;

    public FollowUpDetector(DomainVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<SignalVote> detect(NormalizedUtterance utterance, List<Turn> recentHistory) {
        if (recentHistory == null || recentHistory.isEmpty() || !looksLikeFollowUp(utterance)) {
            return Optional.empty();
        }
        return lastUserTurn(recentHistory)
                .filter(turn -> vocabulary.matches(NormalizedUtterance.of(turn.content())))
                .map(turn -> vote(QueryLabel.RAG_REQUIRED, MODERATE));
    }

    private boolean looksLikeFollowUp(NormalizedUtterance utterance) {
        for (String opener : OPENERS) {
            if (utterance.startsWithPhrase(opener)) {
                return true;
            }
        }
        return utterance.tokens().stream().anyMatch(BACK_REFERENCES::contains);
    }

    private Optional<Turn> lastUserTurn(List<Turn> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).role() == TurnRole.USER) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }
}
