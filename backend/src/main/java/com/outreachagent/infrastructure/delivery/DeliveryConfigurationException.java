package com.outreachagent.infrastructure.delivery;

/**
 * Delivery cannot work at all (missing credential or sender). Never retried.
 */
public class DeliveryConfigurationException extends RuntimeException {

    public DeliveryConfigurationException(String message) {
        super(message);
    }
}
