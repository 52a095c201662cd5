package com.bireporting.anomaly.exception;

/**
 * A business-rule condition could not be compiled.
 */
public class ConditionSyntaxException extends RuntimeException {

    private final String condition;
    private final int position;

    public ConditionSyntaxException(String message, String condition, int position) {
        super(message + " at position " + position + " in '" + condition + "'");
        this.condition = condition;
        this.position = position;
    }

    public String getCondition() {
        return condition;
    }

    public int getPosition() {
        return position;
    }
}
