package com.eainde.insight.ingestion;

/**
 * One row or entry could not be turned into a record. The row is dropped and counted.
 */
public class RowExtractionException extends Exception {

    public RowExtractionException(String message) {
        super(message);
    }
}
