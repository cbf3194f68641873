package com.smurthy.ai.chatrouter.classifier;

/**
 * A single detector's weighted vote toward a label.
 */
public record SignalVote(String signal, QueryLabel label, double weight) {

    public SignalVote {
        if (weight <= 0.0) {
            throw new IllegalArgumentException("vote weight must be positive: " + weight);
        }
    }
}
