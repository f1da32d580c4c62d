package com.billing.leakdetector.exception;

/**
 * A single row could not be scored. Recoverable: the engine skips the row and counts it.
 */
public class InvalidRowException extends RuntimeException {

    public InvalidRowException(String message) {
        super(message);
    }

    public InvalidRowException(String message, Throwable cause) {
        super(message, cause);
    }
}
