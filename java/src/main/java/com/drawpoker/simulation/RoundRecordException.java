package com.drawpoker.simulation;

/**
 * Exception thrown when a recorded round cannot be loaded.
 */
public class RoundRecordException extends Exception {
    public RoundRecordException(String message) {
        super(message);
    }

    public RoundRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
