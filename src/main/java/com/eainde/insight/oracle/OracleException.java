package com.eainde.insight.oracle;

/**
 * Base type for failures of the external language-model capability.
 */
public abstract class OracleException extends Exception {

    protected OracleException(String message) {
        super(message);
    }

    protected OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
