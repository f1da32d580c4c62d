package com.billing.leakdetector.exception;

/**
 * The inference backend cannot serve requests. Fatal to the job that hit it.
 */
public class AdapterUnavailableException extends RuntimeException {

    public AdapterUnavailableException(String message) {
        super(message);
    }

    public AdapterUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
