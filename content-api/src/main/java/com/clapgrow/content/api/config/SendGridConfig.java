package com.clapgrow.content.api.config;

import com.sendgrid.SendGrid;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SendGrid client used by the email alert channel.
 * An empty key still builds a client; EmailAlertChannel skips delivery when no key is configured.
 */
@Configuration
public class SendGridConfig {

    @Bean
    public SendGrid sendGrid(@Value("${sendgrid.api.key:}") String apiKey) {
        return new SendGrid(apiKey);
    }
}
