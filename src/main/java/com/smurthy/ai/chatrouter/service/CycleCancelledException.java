package com.smurthy.ai.chatrouter.service;

/**
 * Thrown when the thread running a routing cycle is interrupted while waiting on a backend.
 * The pending backend call has been cancelled and the interrupt flag restored.
 */
public class CycleCancelledException extends RuntimeException {

    public CycleCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
