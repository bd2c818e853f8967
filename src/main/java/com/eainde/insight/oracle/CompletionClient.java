package com.eainde.insight.oracle;

/**
 * Text-completion capability behind which the concrete model vendor is hidden.
 */
public interface CompletionClient {

    /**
     * Runs one completion, honouring the request's timeout.
     *
     * @throws OracleUnavailableException when the capability is not configured, the call timed
     *                                    out or failed at transport level
     */
    Completion complete(CompletionRequest request) throws OracleUnavailableException;
}
