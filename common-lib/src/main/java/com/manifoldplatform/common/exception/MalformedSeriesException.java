package com.manifoldplatform.common.exception;

/**
 * Parallel arrays disagree in length, timestamps go backwards, a volume is
 * negative or a price is not finite.
 */
public class MalformedSeriesException extends ManifoldException {

    public MalformedSeriesException(String operation, String message) {
        super(operation, message);
    }
}
