package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * General-knowledge topics the model can answer without the knowledge base:
 * weather, clock and calendar, jokes, and questions about the assistant itself.
 */
public class DirectTopicDetector implements SignalDetector {

    public static final String NAME = "direct_topic";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\bweather\\b"),
            Pattern.compile("\\bwhat\\b.*\\btime\\b|\\bcurrent time\\b|\\btime now\\b"),
            Pattern.compile("\\bwhat\\b.*\\bdate\\b|\\btodays date\\b|\\bcurrent date\\b"),
            Pattern.compile("\\btell me\\b.*\\bjoke\\b|\\bmake me laugh\\b"),
            Pattern.compile("\\bwho are you\\b|\\bwhat are you\\b|\\byour name\\b")
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<SignalVote> detect(NormalizedUtterance utterance, List<Turn> recentHistory) {
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(utterance.text()).find()) {
                return Optional.of(vote(QueryLabel.DIRECT_ANSWER, STRONG));
            }
        }
        return Optional.empty();
    }
}
