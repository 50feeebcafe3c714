package com.dragnet.core.exception;

/**
 * A predicate could not be evaluated against one record. Counted and logged by the filtering stage, never fatal.
 */
public class FilterEvaluationException extends DragnetException {

    public FilterEvaluationException(String message) {
        super(message);
    }
}
