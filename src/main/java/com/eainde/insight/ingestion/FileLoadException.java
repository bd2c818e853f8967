package com.eainde.insight.ingestion;

/**
 * A whole file could not be read or parsed.
 */
public class FileLoadException extends Exception {

    public FileLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public FileLoadException(String message) {
        super(message);
    }
}
