package com.outreachagent.infrastructure.delivery;

/**
 * A single send attempt failed; the guard may retry it.
 */
public class TransientDeliveryException extends RuntimeException {

    public TransientDeliveryException(String message) {
        super(message);
    }

    public TransientDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
