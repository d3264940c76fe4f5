package com.outreachagent.infrastructure.ai;

/**
 * Upstream kept throttling after every backoff retry was spent.
 */
public class AiRateLimitedException extends AiClientException {

    public AiRateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
