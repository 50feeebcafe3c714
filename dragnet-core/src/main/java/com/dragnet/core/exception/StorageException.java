package com.dragnet.core.exception;

public class StorageException extends DragnetException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
