package com.outreachagent.domain.delivery.service;

/**
 * Secondary delivery channel for social direct messages.
 */
public interface DirectMessageChannel {

    void send(String body, String profileUrl);
}
