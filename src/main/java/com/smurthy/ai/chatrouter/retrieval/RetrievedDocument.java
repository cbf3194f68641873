package com.smurthy.ai.chatrouter.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A passage returned by the vector store for the current cycle. Never persisted.
 *
 * @param score similarity in [0, 1], higher is closer
 */
public record RetrievedDocument(String id, String text, Map<String, Object> metadata, double score) {

    public RetrievedDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(text, "text");
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be within [0, 1], was " + score);
        }
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Metadata value rendered as text, or {@code null} when absent or blank.
     */
    public String metadataText(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
