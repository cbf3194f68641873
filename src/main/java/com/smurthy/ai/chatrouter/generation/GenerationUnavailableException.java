package com.smurthy.ai.chatrouter.generation;

/**
 * The chat model failed to produce a usable completion.
 */
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
