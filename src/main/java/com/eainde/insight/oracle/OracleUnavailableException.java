package com.eainde.insight.oracle;

/**
 * The capability is not configured, timed out, or failed at transport level.
 */
public class OracleUnavailableException extends OracleException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
