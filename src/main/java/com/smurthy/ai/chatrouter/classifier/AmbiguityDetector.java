package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;

import java.util.List;
import java.util.Optional;

/**
 * Very short utterances that nothing else recognised.
 */
public class AmbiguityDetector implements SignalDetector {

    public static final String NAME = "ambiguity";
    public static final int MIN_TOKENS = 3;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isFallback() {
        return true;
    }

    @Override
    public Optional<SignalVote> detect(NormalizedUtterance utterance, List<Turn> recentHistory) {
        return utterance.tokenCount() < MIN_TOKENS
                ? Optional.of(vote(QueryLabel.UNCLEAR, WEAK))
                : Optional.empty();
    }
}
