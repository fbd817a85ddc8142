package com.keyhive.core.error;

/**
 * Base type for every failure raised by the keyspace subsystem.
 */
public class KeyspaceException extends RuntimeException {

    public KeyspaceException(String message) {
        super(message);
    }

    public KeyspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
