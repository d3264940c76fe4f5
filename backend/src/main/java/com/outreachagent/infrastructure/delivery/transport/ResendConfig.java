package com.outreachagent.infrastructure.delivery.transport;

import com.outreachagent.infrastructure.delivery.DeliveryConfigurationException;
import com.resend.Resend;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("resend")
public class ResendConfig {

    @Value("${resend.api-key:}")
    private String apiKey;

    @Bean
    public Resend resend() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new DeliveryConfigurationException("resend.api-key is not set");
        }
        return new Resend(apiKey);
    }
}
