package com.outreachagent.infrastructure.delivery;

import com.outreachagent.domain.delivery.service.DirectMessageChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * LinkedIn DMs are never sent for real; the channel only logs the message.
 */
@Slf4j
@Component
public class SimulatedDirectMessageChannel implements DirectMessageChannel {

    private static final int PREVIEW_LENGTH = 120;

    @Override
    public void send(String body, String profileUrl) {
        String text = body == null ? "" : body;
        String preview = text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) : text;
        log.info("Simulated LinkedIn DM to {}: {}", profileUrl, preview);
    }
}
