package com.smurthy.ai.chatrouter.generation;

import com.smurthy.ai.chatrouter.classifier.NormalizedUtterance;

/**
 * Fixed replies that need no model call.
 */
public final class CannedReplies {

    public static final String FALLBACK_APOLOGY =
            "I'm sorry, I'm having trouble answering right now. Please try again in a moment.";

    static final String HELLO = "Hello! How can I help you today?";
    static final String HI = "Hi there! What can I do for you?";
    static final String THANKS = "You're welcome! Is there anything else I can help with?";
    static final String BYE = "Goodbye! Have a great day!";

    private CannedReplies() {
    }

    public static String greetingReply(String utterance) {
        NormalizedUtterance normalized = NormalizedUtterance.of(utterance);
        if (normalized.startsWithPhrase("thank") || normalized.startsWithPhrase("thanks")
                || normalized.startsWithPhrase("thx") || normalized.containsPhrase("thank you")) {
            return THANKS;
        }
        if (normalized.containsPhrase("bye") || normalized.containsPhrase("goodbye")
                || normalized.containsPhrase("see you")) {
            return BYE;
        }
        if (normalized.startsWithPhrase("hi")) {
            return HI;
        }
        return HELLO;
    }
}
