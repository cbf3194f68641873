package com.smurthy.ai.chatrouter.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cased, punctuation-free view of an utterance used by every detector.
 *
 * Apostrophes are dropped ("what's" becomes "whats"); any other punctuation becomes a space.
 */
public record NormalizedUtterance(
        String raw,
        String text,
        List<String> tokens,
        boolean endsWithQuestionMark
) {
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static NormalizedUtterance of(String utterance) {
        String raw = utterance == null ? "" : utterance;
        String text = raw.toLowerCase(Locale.ROOT);
        text = APOSTROPHES.matcher(text).replaceAll("");
        text = NON_WORD.matcher(text).replaceAll(" ");
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();

        List<String> tokens = text.isEmpty() ? List.of() : Arrays.asList(text.split(" "));
        return new NormalizedUtterance(raw, text, List.copyOf(tokens), raw.trim().endsWith("?"));
    }

    public String firstToken() {
        return tokens.isEmpty() ? "" : tokens.get(0);
    }

    public int tokenCount() {
        return tokens.size();
    }

    /**
     * True when the phrase appears on whole-word boundaries.
     */
    public boolean containsPhrase(String phrase) {
        return (" " + text + " ").contains(" " + phrase + " ");
    }

    /**
     * True when the text is the phrase or opens with it followed by a word boundary.
     */
    public boolean startsWithPhrase(String phrase) {
        return text.equals(phrase) || text.startsWith(phrase + " ");
    }
}
