package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;

import java.util.List;
import java.util.Optional;

/**
 * Greeting, farewell and gratitude openers.
 */
public class GreetingDetector implements SignalDetector {

    public static final String NAME = "greeting";

    private static final List<String> PHRASES = List.of(
            "hi", "hello", "hey", "hiya", "howdy", "greetings",
            "good morning", "good afternoon", "good evening", "good night",
            "thanks", "thank you", "thx", "cheers", "much appreciated",
            "bye", "goodbye", "see you", "see ya", "farewell",
            "how are you", "whats up", "hows it going"
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<SignalVote> detect(NormalizedUtterance utterance, List<Turn> recentHistory) {
        for (String phrase : PHRASES) {
            if (utterance.startsWithPhrase(phrase)) {
                return Optional.of(vote(QueryLabel.GREETING, STRONG));
            }
        }
        return Optional.empty();
    }
}
