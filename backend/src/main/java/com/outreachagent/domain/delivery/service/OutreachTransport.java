package com.outreachagent.domain.delivery.service;

/**
 * Live email transport used by the delivery stage.
 */
public interface OutreachTransport {

    void send(String subject, String body, String destination);
}
