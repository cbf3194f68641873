package com.smurthy.ai.chatrouter.generation;

/**
 * The chat model did not answer within the generation deadline.
 */
public class GenerationTimeoutException extends GenerationUnavailableException {

    public GenerationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
