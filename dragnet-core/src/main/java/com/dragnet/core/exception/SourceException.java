package com.dragnet.core.exception;

/** Failure reading raw records or enumerating source files. */
public class SourceException extends DragnetException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
