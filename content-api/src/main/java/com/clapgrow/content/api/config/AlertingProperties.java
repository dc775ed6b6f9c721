package com.clapgrow.content.api.config;

import com.clapgrow.content.api.enums.AlertSeverity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Failure-rate alerting configuration.
 * 
 * Thresholds are inclusive lower bounds of each severity band.
 */
@Configuration
@ConfigurationProperties(prefix = "alerting")
@Data
public class AlertingProperties {

    private double warningThreshold = 0.15;

    private double criticalThreshold = 0.20;

    private double emergencyThreshold = 0.30;

    private Cooldown cooldownMinutes = new Cooldown();

    /**
     * Delay before escalating from level N to N+1 (index N). Its size is the max escalation level.
     */
    private List<Integer> escalationDelaysMinutes = new ArrayList<>(List.of(30, 60, 120, 240));

    private Email email = new Email();

    private Chat chat = new Chat();

    private Webhook webhook = new Webhook();

    public Duration cooldownFor(AlertSeverity severity) {
        return switch (severity) {
            case WARNING -> Duration.ofMinutes(cooldownMinutes.getWarning());
            case CRITICAL -> Duration.ofMinutes(cooldownMinutes.getCritical());
            case EMERGENCY -> Duration.ofMinutes(cooldownMinutes.getEmergency());
        };
    }

    public int getMaxEscalationLevel() {
        return escalationDelaysMinutes.size();
    }

    @Data
    public static class Cooldown {
        private int warning = 60;
        private int critical = 30;
        private int emergency = 15;
    }

    @Data
    public static class Email {
        private boolean enabled = true;
        private List<String> recipients = new ArrayList<>();
    }

    @Data
    public static class Chat {
        private boolean enabled = false;
        private String webhookUrl;
        private String channel = "#alerts";
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
    }
}
