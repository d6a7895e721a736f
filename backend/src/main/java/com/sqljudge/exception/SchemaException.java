package com.sqljudge.exception;

/**
 * The declared schema could not be materialized. Aborts the whole batch.
 */
public class SchemaException extends EvaluationException {

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
