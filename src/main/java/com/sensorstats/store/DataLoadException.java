package com.sensorstats.store;

/**
 * The dataset source is missing, unreadable, or lacks the required columns.
 * Fatal when raised during startup.
 */
public class DataLoadException extends RuntimeException {

    public DataLoadException(String message) {
        super(message);
    }

    public DataLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
