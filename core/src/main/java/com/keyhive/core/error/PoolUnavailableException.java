package com.keyhive.core.error;

/**
 * The remote pool could not be reached or answered with a server error.
 */
public class PoolUnavailableException extends KeyspaceException {

    public PoolUnavailableException(String message) {
        super(message);
    }

    public PoolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
