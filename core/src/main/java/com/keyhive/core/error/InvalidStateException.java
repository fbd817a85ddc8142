package com.keyhive.core.error;

/**
 * The operation is well-formed but not allowed in the current lifecycle
 * state, e.g. updating or splitting a completed range.
 */
public class InvalidStateException extends KeyspaceException {

    public InvalidStateException(String message) {
        super(message);
    }
}
