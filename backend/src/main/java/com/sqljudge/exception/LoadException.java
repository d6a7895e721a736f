package com.sqljudge.exception;

/**
 * A fixture's input rows were rejected by the store.
 */
public class LoadException extends EvaluationException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
