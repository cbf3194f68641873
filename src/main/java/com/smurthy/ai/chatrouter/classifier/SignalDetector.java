package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;

import java.util.List;
import java.util.Optional;

/**
 * One independent signal used by {@link QueryClassifier}.
 *
 * Implementations are stateless and must never throw; an empty result means "no opinion".
 */
public interface SignalDetector {

    /** Strong votes: a match on their own is decisive. */
    double STRONG = 3.0;
    /** Moderate votes: outweighed by any strong vote. */
    double MODERATE = 2.0;
    /** Weak votes: only cast by fallback detectors. */
    double WEAK = 1.0;

    String name();

    Optional<SignalVote> detect(NormalizedUtterance utterance, List<Turn> recentHistory);

    /**
     * Fallback detectors are consulted only when no regular detector voted.
     */
    default boolean isFallback() {
        return false;
    }

    default SignalVote vote(QueryLabel label, double weight) {
        return new SignalVote(name(), label, weight);
    }
}
