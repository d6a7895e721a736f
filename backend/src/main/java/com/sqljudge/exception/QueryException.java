package com.sqljudge.exception;

public class QueryException extends EvaluationException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
