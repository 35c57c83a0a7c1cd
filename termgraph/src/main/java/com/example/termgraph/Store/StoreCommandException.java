package com.example.termgraph.Store;

import lombok.Getter;

/**
 * A single store command failed. Surfaced to the caller that issued it.
 */
@Getter
public class StoreCommandException extends StoreException {

    private final String command;
    private final String key;

    public StoreCommandException(String command, String key, Throwable cause) {
        super("Store command " + command + " failed on key '" + key + "': " + cause.getMessage(), cause);
        this.command = command;
        this.key = key;
    }
}
