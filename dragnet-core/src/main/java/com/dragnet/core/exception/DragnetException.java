package com.dragnet.core.exception;

/** Root of the unchecked exceptions raised by dragnet. */
public class DragnetException extends RuntimeException {

    public DragnetException(String message) {
        super(message);
    }

    public DragnetException(String message, Throwable cause) {
        super(message, cause);
    }
}
