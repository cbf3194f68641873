package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Question phrasing without any domain term. Domain questions are left to {@link DomainKeywordDetector}.
 * <p>
 * An utterance reads as a question when it opens with an auxiliary ("can", "does", "is" ...), carries a
 * wh-word or a request phrase such as "tell me about" anywhere, or ends in a question mark.
 */
public class InterrogativeDetector implements SignalDetector {

    public static final String NAME = "interrogative";

    private static final Set<String> WH_WORDS = Set.of(
            "what", "whats", "how", "hows", "when", "where", "why", "which", "who", "whos"
    );

    // only meaningful in leading position: "is" and "do" are too common mid-sentence
    private static final Set<String> LEADING_AUXILIARIES = Set.of(
            "can", "could", "does", "do", "is", "are", "should", "will", "would"
    );

    private static final List<String> REQUEST_PHRASES = List.of(
            "tell me about", "explain", "describe", "show me", "can i", "should i", "may i"
    );

    private final DomainVocabulary vocabulary;

    public InterrogativeDetector(DomainVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<SignalVote> detect(NormalizedUtterance utterance, List<Turn> recentHistory) {
        if (!isQuestion(utterance) || vocabulary.matches(utterance)) {
            return Optional.empty();
        }
        return Optional.of(vote(QueryLabel.DIRECT_ANSWER, MODERATE));
    }

    static boolean isQuestion(NormalizedUtterance utterance) {
        if (utterance.endsWithQuestionMark() || LEADING_AUXILIARIES.contains(utterance.firstToken())) {
            return true;
        }
        if (utterance.tokens().stream().anyMatch(WH_WORDS::contains)) {
            return true;
        }
        return REQUEST_PHRASES.stream().anyMatch(utterance::containsPhrase);
    }
}
