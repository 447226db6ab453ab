package com.benefits.exception;

/**
 * Exception thrown when a rule tree cannot be evaluated against a data context.
 */
public class RuleEvaluationException extends BenefitsException {

    private final EvaluationErrorCode code;
    private final String operator;

    public RuleEvaluationException(EvaluationErrorCode code, String message) {
        this(code, null, message, null);
    }

    public RuleEvaluationException(EvaluationErrorCode code, String operator, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.operator = operator;
    }

    public static RuleEvaluationException unknownOperator(String operator) {
        return new RuleEvaluationException(EvaluationErrorCode.UNKNOWN_OPERATOR, operator,
                "Unrecognized operation " + operator, null);
    }

    public EvaluationErrorCode getCode() {
        return code;
    }

    /**
     * Operator being applied when the failure happened, or null.
     */
    public String getOperator() {
        return operator;
    }
}
