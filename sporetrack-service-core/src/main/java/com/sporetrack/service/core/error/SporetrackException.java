package com.sporetrack.service.core.error;

/** Root of the store's unchecked failures. */
public class SporetrackException extends RuntimeException {

    public SporetrackException(String message) {
        super(message);
    }

    public SporetrackException(String message, Throwable cause) {
        super(message, cause);
    }
}
