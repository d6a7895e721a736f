package com.sqljudge.exception;

/**
 * Base class for failures raised while judging a query. The message is the
 * store's diagnostic text, passed through unmodified.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
