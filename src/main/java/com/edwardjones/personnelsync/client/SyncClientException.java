package com.edwardjones.personnelsync.client;

/**
 * Raised by an adapter when it cannot retrieve a listing from its remote system.
 */
public class SyncClientException extends RuntimeException {

    public SyncClientException(String message) {
        super(message);
    }

    public SyncClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
