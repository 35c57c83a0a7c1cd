package com.example.termgraph.Store;

/**
 * Base type for failures raised by a {@link GraphStore}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
