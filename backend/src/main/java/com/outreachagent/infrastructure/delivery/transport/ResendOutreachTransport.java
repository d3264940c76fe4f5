package com.outreachagent.infrastructure.delivery.transport;

import com.outreachagent.domain.delivery.service.OutreachTransport;
import com.outreachagent.infrastructure.delivery.DeliveryConfigurationException;
import com.outreachagent.infrastructure.delivery.TransientDeliveryException;
import com.resend.Resend;
import com.resend.core.exception.ResendException;
import com.resend.services.emails.model.CreateEmailOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

@Service
@Profile("resend")
@RequiredArgsConstructor
@Slf4j
public class ResendOutreachTransport implements OutreachTransport {

    private final Resend resend;

    @Value("${outreach.delivery.sender:}")
    private String senderEmail;

    @Override
    public void send(String subject, String body, String destination) {
        if (senderEmail == null || senderEmail.isBlank()) {
            throw new DeliveryConfigurationException("outreach.delivery.sender is not set");
        }

        CreateEmailOptions options = CreateEmailOptions.builder()
                .from(senderEmail)
                .to(destination)
                .subject(subject)
                .text(body)
                .build();

        try {
            resend.emails().send(options);
            log.info("Outreach email sent to {} via Resend", destination);
        } catch (ResendException e) {
            log.error("Failed to send outreach email to {}: {}", destination, e.getMessage());
            throw new TransientDeliveryException("Resend send failed: " + e.getMessage(), e);
        }
    }
}
