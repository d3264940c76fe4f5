package com.outreachagent.infrastructure.delivery.transport;

import com.outreachagent.domain.delivery.service.OutreachTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

@Service
@Profile("!ses & !resend")
@Slf4j
public class ConsoleOutreachTransport implements OutreachTransport {

    @Override
    public void send(String subject, String body, String destination) {
        log.info("""
                ========================================
                [DEV] Outreach email
                To: {}
                Subject: {}
                {}
                ========================================""", destination, subject, body);
    }
}
