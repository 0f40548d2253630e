package com.manifoldplatform.common.exception;

/**
 * Input is shorter than the minimum number of samples an operation needs.
 */
public class InsufficientDataException extends ManifoldException {
    private final int required;
    private final int actual;

    public InsufficientDataException(String operation, int required, int actual) {
        super(operation, "requires at least " + required + " samples but got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
