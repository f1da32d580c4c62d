package com.billing.leakdetector.exception;

public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String subject, Object from, Object to) {
        super("Illegal transition for " + subject + ": " + from + " -> " + to);
    }
}
