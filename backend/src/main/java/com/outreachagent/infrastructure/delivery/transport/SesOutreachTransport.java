package com.outreachagent.infrastructure.delivery.transport;

import com.outreachagent.domain.delivery.service.OutreachTransport;
import com.outreachagent.infrastructure.delivery.DeliveryConfigurationException;
import com.outreachagent.infrastructure.delivery.TransientDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;

@Service
@Profile("ses")
@RequiredArgsConstructor
@Slf4j
public class SesOutreachTransport implements OutreachTransport {

    private final SesClient sesClient;

    @Value("${outreach.delivery.sender:}")
    private String senderEmail;

    @Override
    public void send(String subject, String body, String destination) {
        if (senderEmail == null || senderEmail.isBlank()) {
            throw new DeliveryConfigurationException("outreach.delivery.sender is not set");
        }

        SendEmailRequest request = SendEmailRequest.builder()
                .source(senderEmail)
                .destination(Destination.builder().toAddresses(destination).build())
                .message(Message.builder()
                        .subject(Content.builder().data(subject).charset("UTF-8").build())
                        .body(Body.builder()
                                .text(Content.builder().data(body).charset("UTF-8").build())
                                .build())
                        .build())
                .build();

        try {
            sesClient.sendEmail(request);
        } catch (SdkException e) {
            throw new TransientDeliveryException("SES send failed: " + e.getMessage(), e);
        }
        log.info("Outreach email sent to {} via SES", destination);
    }
}
