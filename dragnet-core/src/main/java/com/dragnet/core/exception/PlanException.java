package com.dragnet.core.exception;

/** No index metric can answer the query. */
public class PlanException extends DragnetException {

    public PlanException(String message) {
        super(message);
    }
}
