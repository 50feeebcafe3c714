package com.dragnet.core.exception;

/** Invalid user-supplied configuration: queries, breakdowns, patterns, datasource settings. */
public class ConfigException extends DragnetException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
