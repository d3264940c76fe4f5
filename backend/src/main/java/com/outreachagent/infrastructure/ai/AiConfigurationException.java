package com.outreachagent.infrastructure.ai;

/**
 * AI mode requested without credentials. Fails immediately; never retried.
 */
public class AiConfigurationException extends AiClientException {

    public AiConfigurationException(String message) {
        super(message);
    }
}
