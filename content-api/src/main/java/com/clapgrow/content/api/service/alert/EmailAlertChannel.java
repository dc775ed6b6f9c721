package com.clapgrow.content.api.service.alert;

import com.clapgrow.content.api.config.AlertingProperties;
import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.enums.AlertChannelType;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Sends alerts by email through SendGrid. All recipients share one message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmailAlertChannel implements AlertChannel {

    private final SendGrid sendGrid;
    private final AlertingProperties alertingProperties;

    @Value("${sendgrid.api.key:}")
    private String apiKey;

    @Value("${sendgrid.from.email:alerts@example.com}")
    private String fromEmail;

    @Value("${sendgrid.from.name:Content Automation Alerts}")
    private String fromName;

    @Override
    public AlertChannelType getType() {
        return AlertChannelType.EMAIL;
    }

    @Override
    public boolean isEnabled() {
        return alertingProperties.getEmail().isEnabled()
            && apiKey != null && !apiKey.trim().isEmpty()
            && !recipients().isEmpty();
    }

    @Override
    public ChannelDeliveryResult send(Alert alert, int escalationLevel) {
        List<String> recipients = recipients();
        try {
            String subject = escalationLevel > 0
                ? String.format("[ESCALATION %d] %s", escalationLevel, alert.getTitle())
                : alert.getTitle();

            Personalization personalization = new Personalization();
            recipients.forEach(recipient -> personalization.addTo(new Email(recipient)));

            Mail mail = new Mail();
            mail.setFrom(new Email(fromEmail, fromName));
            mail.setSubject(subject);
            mail.addPersonalization(personalization);
            mail.addContent(new Content("text/plain", alert.getMessage()));

            Request request = new Request();
            request.setMethod(Method.POST);
            request.setEndpoint("mail/send");
            request.setBody(mail.build());

            Response response = sendGrid.api(request);

            if (response.getStatusCode() >= 200 && response.getStatusCode() < 300) {
                log.info("Alert {} emailed to {} recipients (status {})", alert.getId(), recipients.size(), response.getStatusCode());
                return ChannelDeliveryResult.sent("Emailed " + recipients.size() + " recipients");
            }
            String errorMessage = String.format("SendGrid API error: Status %d", response.getStatusCode());
            log.error("Failed to email alert {}: {} - {}", alert.getId(), errorMessage, response.getBody());
            return ChannelDeliveryResult.failed(errorMessage);

        } catch (IOException e) {
            log.error("Error emailing alert {} via SendGrid", alert.getId(), e);
            return ChannelDeliveryResult.failed("SendGrid API IOException: " + e.getMessage());
        }
    }

    private List<String> recipients() {
        List<String> configured = alertingProperties.getEmail().getRecipients();
        if (configured == null) {
            return List.of();
        }
        return configured.stream()
            .filter(recipient -> recipient != null && !recipient.trim().isEmpty())
            .map(String::trim)
            .toList();
    }
}
