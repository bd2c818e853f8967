package com.eainde.insight.ingestion;

/**
 * Ingestion cannot produce anything at all, e.g. no files were discovered in any family.
 */
public class PipelineFatalException extends Exception {

    public PipelineFatalException(String message) {
        super(message);
    }
}
