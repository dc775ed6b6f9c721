package com.clapgrow.content.api.service.alert;

import com.clapgrow.content.api.config.AlertingProperties;
import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.enums.AlertChannelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts the alert as JSON to a generic webhook (paging or incident tooling).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookAlertChannel implements AlertChannel {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder webClientBuilder;
    private final AlertingProperties alertingProperties;

    @Override
    public AlertChannelType getType() {
        return AlertChannelType.WEBHOOK;
    }

    @Override
    public boolean isEnabled() {
        AlertingProperties.Webhook webhook = alertingProperties.getWebhook();
        return webhook.isEnabled() && webhook.getUrl() != null && !webhook.getUrl().trim().isEmpty();
    }

    @Override
    public ChannelDeliveryResult send(Alert alert, int escalationLevel) {
        String url = alertingProperties.getWebhook().getUrl();
        try {
            webClientBuilder.build()
                .post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildPayload(alert, escalationLevel))
                .retrieve()
                .toBodilessEntity()
                .timeout(TIMEOUT)
                .block();
            log.info("Alert {} posted to webhook", alert.getId());
            return ChannelDeliveryResult.sent("Posted to webhook");
        } catch (WebClientResponseException e) {
            log.error("Webhook rejected alert {}: Status={}", alert.getId(), e.getStatusCode());
            return ChannelDeliveryResult.failed("Webhook returned " + e.getStatusCode().value());
        } catch (WebClientException e) {
            log.error("Error posting alert {} to webhook", alert.getId(), e);
            return ChannelDeliveryResult.failed("Webhook error: " + e.getMessage());
        }
    }

    private Map<String, Object> buildPayload(Alert alert, int escalationLevel) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId() != null ? alert.getId().toString() : null);
        payload.put("alertType", alert.getAlertType());
        payload.put("severity", alert.getSeverity().name());
        payload.put("title", alert.getTitle());
        payload.put("message", alert.getMessage());
        payload.put("sourceMetric", alert.getSourceMetric());
        payload.put("metricValue", alert.getMetricValue());
        payload.put("thresholdCrossed", alert.getThresholdCrossed());
        payload.put("timeWindow", alert.getTimeWindow().name());
        payload.put("totalJobs", alert.getTotalJobs());
        payload.put("failedJobs", alert.getFailedJobs());
        payload.put("trend", alert.getTrend() != null ? alert.getTrend().name() : null);
        payload.put("escalationLevel", escalationLevel);
        payload.put("createdAt", alert.getCreatedAt() != null ? alert.getCreatedAt().toString() : null);
        return payload;
    }
}
