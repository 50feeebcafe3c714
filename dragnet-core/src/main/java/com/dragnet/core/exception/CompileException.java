package com.dragnet.core.exception;

/** A filter could not be translated into the restricted SQL grammar. */
public class CompileException extends DragnetException {

    public CompileException(String message) {
        super(message);
    }
}
