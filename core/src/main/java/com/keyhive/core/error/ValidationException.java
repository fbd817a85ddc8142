package com.keyhive.core.error;

/**
 * Input was rejected before any state was touched: unknown range id,
 * out-of-bounds percentage, malformed bounds, non-monotonic or over-total
 * counters, bad split count.
 */
public class ValidationException extends KeyspaceException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
