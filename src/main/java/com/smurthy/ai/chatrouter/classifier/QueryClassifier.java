package com.smurthy.ai.chatrouter.classifier;

import com.smurthy.ai.chatrouter.conversation.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based query classifier. No model call, so it is fast, deterministic and free of I/O.
 *
 * Every regular {@link SignalDetector} is evaluated and casts at most one weighted vote. Fallback
 * detectors run only when nobody else voted. Votes are summed per label and the heaviest label wins;
 * ties go to the label with the higher {@link QueryLabel#priority() priority}, so a greeting that
 * happens to mention a card is still answered as a greeting.
 *
 * Confidence is the winning weight over the total weight cast, with the total never taken below one
 * strong vote. A lone weak vote therefore reads as low confidence, and an utterance nothing recognised
 * yields {@link QueryLabel#UNCLEAR} at {@link #CONFIDENCE_FLOOR}.
 */
@Component
public class QueryClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

    public static final double CONFIDENCE_FLOOR = 0.3;

    private final List<SignalDetector> detectors;

    public QueryClassifier() {
        this(defaultDetectors());
    }

    public QueryClassifier(List<SignalDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static List<SignalDetector> defaultDetectors() {
        DomainVocabulary vocabulary = new DomainVocabulary();
        return List.of(
                new GreetingDetector(),
                new DomainKeywordDetector(vocabulary),
                new DirectTopicDetector(),
                new InterrogativeDetector(vocabulary),
                new FollowUpDetector(vocabulary),
                new AmbiguityDetector()
        );
    }

    /**
     * Classify an utterance.
     *
     * @param utterance     the current user input
     * @param recentHistory a short window of prior turns, oldest first; may be empty
     * @return the routing label with its confidence and the signals that fired
     */
    public ClassificationResult classify(String utterance, List<Turn> recentHistory) {
        NormalizedUtterance normalized = NormalizedUtterance.of(utterance);
        List<Turn> history = recentHistory == null ? List.of() : recentHistory;

        List<SignalVote> votes = collectVotes(normalized, history, false);
        if (votes.isEmpty()) {
            votes = collectVotes(normalized, history, true);
        }

        if (votes.isEmpty()) {
            log.debug("No signal matched '{}', classifying as UNCLEAR", normalized.text());
            return new ClassificationResult(QueryLabel.UNCLEAR, CONFIDENCE_FLOOR, Set.of());
        }

        ClassificationResult result = aggregate(votes);
        log.debug("Classified '{}' as {} (confidence={}, signals={})",
                normalized.text(), result.label(), String.format("%.2f", result.confidence()), result.matchedSignals());
        return result;
    }

    private List<SignalVote> collectVotes(NormalizedUtterance utterance, List<Turn> history, boolean fallback) {
        List<SignalVote> votes = new ArrayList<>();
        for (SignalDetector detector : detectors) {
            if (detector.isFallback() == fallback) {
                detector.detect(utterance, history).ifPresent(votes::add);
            }
        }
        return votes;
    }

    private ClassificationResult aggregate(List<SignalVote> votes) {
        Map<QueryLabel, Double> totals = new EnumMap<>(QueryLabel.class);
        Set<String> signals = new LinkedHashSet<>();
        double totalWeight = 0.0;

        for (SignalVote vote : votes) {
            totals.merge(vote.label(), vote.weight(), Double::sum);
            signals.add(vote.signal());
            totalWeight += vote.weight();
        }

        // Strict comparison in priority order keeps the higher-priority label on a tie
        QueryLabel winner = QueryLabel.UNCLEAR;
        double winningWeight = -1.0;
        for (QueryLabel label : QueryLabel.byPriority()) {
            double weight = totals.getOrDefault(label, 0.0);
            if (weight > winningWeight) {
                winner = label;
                winningWeight = weight;
            }
        }

        double confidence = winningWeight / Math.max(totalWeight, SignalDetector.STRONG);
        confidence = Math.max(CONFIDENCE_FLOOR, Math.min(1.0, confidence));
        return new ClassificationResult(winner, confidence, signals);
    }
}
