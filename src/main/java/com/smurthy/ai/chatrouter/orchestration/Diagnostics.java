package com.smurthy.ai.chatrouter.orchestration;

/**
 * Keys of the diagnostics map attached to every cycle result.
 */
public final class Diagnostics {

    private Diagnostics() {
    }

    public static final String SESSION_ID = "session_id";
    public static final String LABEL = "label";
    public static final String CONFIDENCE = "confidence";
    public static final String CONFIDENT = "confident";
    public static final String MATCHED_SIGNALS = "matched_signals";
    public static final String PATH = "path";
    public static final String STAGES = "stages";
    public static final String RETRIEVAL_COUNT = "retrieval_count";
    public static final String RETRIEVAL_BACKEND = "retrieval_backend";
    public static final String GENERATION_BACKEND = "generation_backend";
    public static final String ELAPSED_MS = "elapsed_ms";
    public static final String RETRIEVAL_ERROR = "retrieval_error";
    public static final String FORMAT_ERROR = "format_error";
    public static final String GENERATION_ERROR = "generation_error";
    public static final String ERROR_STAGE = "error_stage";
    public static final String HISTORY_SIZE = "history_size";

    // generation_error values
    public static final String TIMEOUT = "timeout";
    public static final String UNAVAILABLE = "unavailable";

    // generation_backend value when no model was called
    public static final String CANNED_BACKEND = "canned";
}
