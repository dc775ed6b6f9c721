package com.clapgrow.content.api.service.alert;

import com.clapgrow.content.api.config.AlertingProperties;
import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.enums.AlertChannelType;
import com.clapgrow.content.api.enums.AlertSeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts alerts to a chat incoming-webhook (Slack-compatible attachment payload).
 * 
 * ⚠️ BLOCKING: Uses WebClient.block(). Alerts are rare and dispatched from scheduled tasks
 * or admin-driven evaluations, never from the job attempt path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatAlertChannel implements AlertChannel {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder webClientBuilder;
    private final AlertingProperties alertingProperties;

    @Override
    public AlertChannelType getType() {
        return AlertChannelType.CHAT;
    }

    @Override
    public boolean isEnabled() {
        AlertingProperties.Chat chat = alertingProperties.getChat();
        return chat.isEnabled() && chat.getWebhookUrl() != null && !chat.getWebhookUrl().trim().isEmpty();
    }

    @Override
    public ChannelDeliveryResult send(Alert alert, int escalationLevel) {
        AlertingProperties.Chat chat = alertingProperties.getChat();
        try {
            webClientBuilder.build()
                .post()
                .uri(chat.getWebhookUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildPayload(alert, escalationLevel, chat.getChannel()))
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .block();
            log.info("Alert {} posted to chat channel {}", alert.getId(), chat.getChannel());
            return ChannelDeliveryResult.sent("Posted to " + chat.getChannel());
        } catch (WebClientResponseException e) {
            log.error("Chat webhook rejected alert {}: Status={}", alert.getId(), e.getStatusCode());
            return ChannelDeliveryResult.failed("Chat webhook returned " + e.getStatusCode().value());
        } catch (WebClientException e) {
            log.error("Error posting alert {} to chat webhook", alert.getId(), e);
            return ChannelDeliveryResult.failed("Chat webhook error: " + e.getMessage());
        }
    }

    Map<String, Object> buildPayload(Alert alert, int escalationLevel, String channel) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", colorFor(alert.getSeverity()));
        attachment.put("title", escalationLevel > 0
            ? String.format("[ESCALATION %d] %s", escalationLevel, alert.getTitle())
            : alert.getTitle());
        attachment.put("text", alert.getMessage());
        attachment.put("fields", List.of(
            Map.of("title", "Failure Rate", "value", String.format("%.1f%%", alert.getMetricValue() * 100), "short", true),
            Map.of("title", "Time Window", "value", alert.getTimeWindow().name().toLowerCase(), "short", true),
            Map.of("title", "Failed / Total", "value", alert.getFailedJobs() + " / " + alert.getTotalJobs(), "short", true)
        ));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel", channel);
        payload.put("text", alert.getSeverity().name() + " alert: " + alert.getTitle());
        payload.put("attachments", List.of(attachment));
        return payload;
    }

    private static String colorFor(AlertSeverity severity) {
        return switch (severity) {
            case WARNING -> "warning";
            case CRITICAL -> "danger";
            case EMERGENCY -> "#8B0000";
        };
    }
}
