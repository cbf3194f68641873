package com.smurthy.ai.chatrouter.classifier;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of classifying one utterance.
 *
 * @param label          winning routing label
 * @param confidence     how decisively the label won, in [0,1]
 * @param matchedSignals names of the detectors that voted, in evaluation order
 */
public record ClassificationResult(
        QueryLabel label,
        double confidence,
        Set<String> matchedSignals
) {
    public static final double CONFIDENT_THRESHOLD = 0.6;

    public ClassificationResult {
        Objects.requireNonNull(label, "label");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
        matchedSignals = matchedSignals == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(matchedSignals));
    }

    public boolean isConfident() {
        return confidence >= CONFIDENT_THRESHOLD;
    }

    public boolean hasSignal(String signal) {
        return matchedSignals.contains(signal);
    }
}
