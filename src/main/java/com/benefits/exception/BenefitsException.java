package com.benefits.exception;

/**
 * Base exception for the benefits engine.
 */
public class BenefitsException extends RuntimeException {

    public BenefitsException(String message) {
        super(message);
    }

    public BenefitsException(String message, Throwable cause) {
        super(message, cause);
    }
}
