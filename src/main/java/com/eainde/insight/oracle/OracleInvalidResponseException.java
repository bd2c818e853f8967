package com.eainde.insight.oracle;

/**
 * The capability answered, but the answer could not be parsed or repaired.
 */
public class OracleInvalidResponseException extends OracleException {

    public OracleInvalidResponseException(String message) {
        super(message);
    }

    public OracleInvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
