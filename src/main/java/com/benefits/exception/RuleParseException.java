package com.benefits.exception;

/**
 * Exception thrown when a rule document is not a well-formed rule tree.
 */
public class RuleParseException extends BenefitsException {

    private final String pointer;

    public RuleParseException(String pointer, String message) {
        super(message + " at '" + (pointer.isEmpty() ? "/" : pointer) + "'");
        this.pointer = pointer;
    }

    /**
     * JSON pointer of the offending node ("" for the root).
     */
    public String getPointer() {
        return pointer;
    }
}
