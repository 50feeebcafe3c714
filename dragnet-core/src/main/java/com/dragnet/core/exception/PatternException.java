package com.dragnet.core.exception;

public class PatternException extends ConfigException {

    public PatternException(String message) {
        super(message);
    }
}
