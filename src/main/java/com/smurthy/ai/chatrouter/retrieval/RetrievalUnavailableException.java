package com.smurthy.ai.chatrouter.retrieval;

/**
 * The vector store could not serve a search: unreachable, failed, or past its deadline.
 */
public class RetrievalUnavailableException extends RuntimeException {

    private final boolean timedOut;

    public RetrievalUnavailableException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
