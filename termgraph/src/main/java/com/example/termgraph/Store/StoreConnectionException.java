package com.example.termgraph.Store;

/**
 * The backing store could not be reached. Never retried.
 */
public class StoreConnectionException extends StoreException {

    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
