package com.edwardjones.personnelsync.service.dispatch;

/**
 * Thrown when a thread is interrupted while waiting for the batch timer to admit it.
 */
public class DispatchInterruptedException extends RuntimeException {

    public DispatchInterruptedException(String message) {
        super(message);
    }
}
