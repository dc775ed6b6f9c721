package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.AlertingProperties;
import com.clapgrow.content.api.dto.AlertEvaluationResult;
import com.clapgrow.content.api.dto.AlertNotificationResponse;
import com.clapgrow.content.api.dto.AlertResponse;
import com.clapgrow.content.api.dto.AlertSimulation;
import com.clapgrow.content.api.dto.AlertThresholds;
import com.clapgrow.content.api.dto.FailureRateSample;
import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.enums.AlertChannelType;
import com.clapgrow.content.api.enums.AlertSeverity;
import com.clapgrow.content.api.enums.AlertTrend;
import com.clapgrow.content.api.enums.TimeWindow;
import com.clapgrow.content.api.exception.ResourceNotFoundException;
import com.clapgrow.content.api.repository.AlertNotificationRepository;
import com.clapgrow.content.api.repository.AlertRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Failure-rate alerting.
 * 
 * Severity bands (lower bound inclusive):
 * - rate < warning → no alert (open alerts of the window are resolved)
 * - [warning, critical) → WARNING (email)
 * - [critical, emergency) → CRITICAL (email + chat, escalating)
 * - rate ≥ emergency → EMERGENCY (email + chat + webhook, escalating)
 * 
 * Alerts of one severity and window are rate limited by a per-severity cooldown.
 * A new CRITICAL/EMERGENCY alert also escalates the oldest unresolved alert of the same severity,
 * and {@link #sweepEscalations()} escalates alerts left unresolved past their escalation delay.
 * 
 * ⚠️ Not transactional as a whole: each alert is saved before its notifications are sent, so a
 * slow or failing channel never rolls back the alert record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertingEngine {

    static final String SOURCE_METRIC = "job_failure_rate";

    private static final Set<AlertSeverity> ESCALATING_SEVERITIES = EnumSet.of(AlertSeverity.CRITICAL, AlertSeverity.EMERGENCY);

    private final AlertRepository alertRepository;
    private final AlertNotificationRepository notificationRepository;
    private final AlertNotificationDispatcher dispatcher;
    private final FailureRateService failureRateService;
    private final AlertingProperties properties;
    private final ResilienceMetricsService metricsService;
    private final Clock clock;

    /**
     * Evaluate one failure-rate sample. Produces at most one new alert.
     */
    public AlertEvaluationResult evaluate(FailureRateSample sample) {
        LocalDateTime now = LocalDateTime.now(clock);
        AlertSeverity severity = classify(sample.failureRate());

        if (severity == null) {
            int resolved = resolveOpenAlerts(sample.timeWindow(), now);
            return new AlertEvaluationResult(sample, null, 0, List.of(), 0, resolved, false,
                "Failure rate below warning threshold");
        }

        Optional<Alert> recent = alertRepository.findFirstBySeverityAndTimeWindowAndCreatedAtAfterOrderByCreatedAtDesc(
            severity, sample.timeWindow(), now.minus(properties.cooldownFor(severity)));
        if (recent.isPresent()) {
            LocalDateTime until = recent.get().getCreatedAt().plus(properties.cooldownFor(severity));
            log.info("{} alert for {} window suppressed, cooldown active until {}", severity, sample.timeWindow(), until);
            return new AlertEvaluationResult(sample, severity, 0, List.of(), 0, 0, true,
                "Alert suppressed: " + severity + " cooldown active until " + until);
        }

        int escalated = 0;
        if (severity.isEscalating()) {
            Optional<Alert> oldest = alertRepository.findByResolvedFalseAndSeverityOrderByCreatedAtAsc(severity).stream()
                .filter(alert -> alert.getEscalationLevel() < properties.getMaxEscalationLevel())
                .findFirst();
            if (oldest.isPresent()) {
                escalate(oldest.get(), now);
                escalated = 1;
            }
        }

        AlertTrend trend = failureRateService.trend(sample.failureRate(),
            failureRateService.calculatePrevious(sample.timeWindow()).failureRate());

        Alert alert = new Alert();
        alert.setAlertType(Alert.TYPE_FAILURE_RATE);
        alert.setSeverity(severity);
        alert.setTitle(buildTitle(severity, sample));
        alert.setMessage(buildMessage(severity, sample, trend));
        alert.setSourceMetric(SOURCE_METRIC);
        alert.setMetricValue(sample.failureRate());
        alert.setThresholdCrossed(thresholdFor(severity));
        alert.setTimeWindow(sample.timeWindow());
        alert.setTotalJobs(sample.totalJobs());
        alert.setFailedJobs(sample.failedJobs());
        alert.setTrend(trend);
        alert.setResolved(false);
        alert.setEscalationLevel(0);
        alert.setCreatedAt(now);
        Alert saved = alertRepository.save(alert);

        metricsService.recordAlert(severity);
        log.warn("Raised {} alert {}: {}", severity, saved.getId(), saved.getTitle());
        dispatcher.dispatch(saved, 0);

        return new AlertEvaluationResult(sample, severity, 1, List.of(AlertResponse.from(saved)), escalated, 0, false,
            "Alert raised");
    }

    /**
     * Evaluate the daily failure rate computed from job records.
     */
    public AlertEvaluationResult checkScheduledFailureRate() {
        FailureRateSample sample = failureRateService.calculate(TimeWindow.DAILY);
        log.debug("Scheduled failure-rate check: {}/{} jobs failed ({})",
            sample.failedJobs(), sample.totalJobs(), sample.failureRate());
        return evaluate(sample);
    }

    /**
     * Escalate unresolved CRITICAL/EMERGENCY alerts whose escalation delay has elapsed.
     * 
     * @return number of alerts escalated
     */
    public int sweepEscalations() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Integer> delays = properties.getEscalationDelaysMinutes();
        int escalated = 0;
        for (Alert alert : alertRepository.findByResolvedFalseAndSeverityInAndEscalationLevelLessThan(
                ESCALATING_SEVERITIES, properties.getMaxEscalationLevel())) {
            LocalDateTime reference = alert.getLastEscalatedAt() != null ? alert.getLastEscalatedAt() : alert.getCreatedAt();
            Duration delay = Duration.ofMinutes(delays.get(alert.getEscalationLevel()));
            if (!now.isBefore(reference.plus(delay))) {
                escalate(alert, now);
                escalated++;
            }
        }
        if (escalated > 0) {
            log.info("Escalation sweep escalated {} alerts", escalated);
        }
        return escalated;
    }

    private void escalate(Alert alert, LocalDateTime now) {
        int level = alert.getEscalationLevel() + 1;
        alert.setEscalationLevel(level);
        alert.setLastEscalatedAt(now);
        Alert saved = alertRepository.save(alert);
        log.warn("Escalated {} alert {} to level {}", saved.getSeverity(), saved.getId(), level);
        dispatcher.dispatch(saved, level);
    }

    private int resolveOpenAlerts(TimeWindow window, LocalDateTime now) {
        List<Alert> open = alertRepository.findByResolvedFalseAndTimeWindow(window);
        for (Alert alert : open) {
            alert.setResolved(true);
            alert.setResolvedAt(now);
            alertRepository.save(alert);
        }
        if (!open.isEmpty()) {
            log.info("Resolved {} open alerts for {} window after a healthy sample", open.size(), window);
        }
        return open.size();
    }

    public AlertResponse resolveAlert(UUID alertId) {
        Alert alert = alertRepository.findById(alertId)
            .orElseThrow(() -> new ResourceNotFoundException("Alert not found: " + alertId));
        if (Boolean.TRUE.equals(alert.getResolved())) {
            return AlertResponse.from(alert);
        }
        alert.setResolved(true);
        alert.setResolvedAt(LocalDateTime.now(clock));
        Alert saved = alertRepository.save(alert);
        log.info("Alert {} resolved manually", alertId);
        return AlertResponse.from(saved);
    }

    /**
     * Dry-run classification. Nothing is persisted or sent.
     */
    public AlertSimulation simulate(double failureRate, TimeWindow window) {
        if (failureRate < 0 || failureRate > 1 || Double.isNaN(failureRate)) {
            throw new BadRequestException("Failure rate must be between 0 and 1");
        }
        AlertSeverity severity = classify(failureRate);
        if (severity == null) {
            return new AlertSimulation(failureRate, window, null, null, Set.of(), false, false, null);
        }
        boolean suppressed = alertRepository.findFirstBySeverityAndTimeWindowAndCreatedAtAfterOrderByCreatedAtDesc(
            severity, window, LocalDateTime.now(clock).minus(properties.cooldownFor(severity))).isPresent();
        FailureRateSample sample = new FailureRateSample(window, 0, 0, failureRate);
        return new AlertSimulation(failureRate, window, severity, thresholdFor(severity), severity.getChannels(),
            severity.isEscalating(), suppressed, buildTitle(severity, sample));
    }

    /**
     * @return severity band of the rate, null below the warning threshold
     */
    public AlertSeverity classify(double failureRate) {
        if (failureRate >= properties.getEmergencyThreshold()) {
            return AlertSeverity.EMERGENCY;
        }
        if (failureRate >= properties.getCriticalThreshold()) {
            return AlertSeverity.CRITICAL;
        }
        if (failureRate >= properties.getWarningThreshold()) {
            return AlertSeverity.WARNING;
        }
        return null;
    }

    private double thresholdFor(AlertSeverity severity) {
        return switch (severity) {
            case WARNING -> properties.getWarningThreshold();
            case CRITICAL -> properties.getCriticalThreshold();
            case EMERGENCY -> properties.getEmergencyThreshold();
        };
    }

    public AlertThresholds getThresholds() {
        List<AlertThresholds.Band> bands = new ArrayList<>();
        bands.add(band(AlertSeverity.WARNING, properties.getWarningThreshold(), properties.getCriticalThreshold()));
        bands.add(band(AlertSeverity.CRITICAL, properties.getCriticalThreshold(), properties.getEmergencyThreshold()));
        bands.add(band(AlertSeverity.EMERGENCY, properties.getEmergencyThreshold(), null));
        return new AlertThresholds(bands);
    }

    private AlertThresholds.Band band(AlertSeverity severity, double lower, Double upper) {
        return new AlertThresholds.Band(severity, lower, upper, severity.getChannels(), severity.isEscalating(),
            properties.cooldownFor(severity).toMinutes());
    }

    public Map<String, Object> getConfig() {
        Map<AlertChannelType, Boolean> channels = new LinkedHashMap<>();
        for (AlertChannelType type : AlertChannelType.values()) {
            channels.put(type, dispatcher.isChannelEnabled(type));
        }
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("thresholds", getThresholds());
        config.put("escalationDelaysMinutes", properties.getEscalationDelaysMinutes());
        config.put("maxEscalationLevel", properties.getMaxEscalationLevel());
        config.put("channelsEnabled", channels);
        config.put("emailRecipientCount", properties.getEmail().getRecipients().size());
        return config;
    }

    public List<AlertResponse> getActiveAlerts() {
        return alertRepository.findByResolvedFalseOrderByCreatedAtDesc().stream()
            .map(AlertResponse::from)
            .toList();
    }

    public List<AlertResponse> getRecentAlerts() {
        return alertRepository.findTop50ByOrderByCreatedAtDesc().stream()
            .map(AlertResponse::from)
            .toList();
    }

    public List<AlertNotificationResponse> getRecentNotifications() {
        return notificationRepository.findTop100ByOrderByCreatedAtDesc().stream()
            .map(AlertNotificationResponse::from)
            .toList();
    }

    public List<AlertNotificationResponse> getNotificationsForAlert(UUID alertId) {
        return notificationRepository.findByAlertIdOrderByCreatedAtAsc(alertId).stream()
            .map(AlertNotificationResponse::from)
            .toList();
    }

    static String buildTitle(AlertSeverity severity, FailureRateSample sample) {
        return String.format(Locale.ROOT, "%s: %.1f%% Failure Rate (%s)",
            severity.name(), sample.failureRate() * 100, sample.timeWindow().name().toLowerCase(Locale.ROOT));
    }

    private String buildMessage(AlertSeverity severity, FailureRateSample sample, AlertTrend trend) {
        StringBuilder message = new StringBuilder();
        message.append(String.format(Locale.ROOT, "The %s job failure rate has reached %.1f%%, crossing the %s threshold of %.1f%%.%n%n",
            sample.timeWindow().name().toLowerCase(Locale.ROOT), sample.failureRate() * 100,
            severity.name().toLowerCase(Locale.ROOT), thresholdFor(severity) * 100));

        message.append("Details:\n");
        message.append(String.format(Locale.ROOT, "- Failed jobs: %d of %d%n", sample.failedJobs(), sample.totalJobs()));
        message.append(String.format(Locale.ROOT, "- Trend: %s%n", trend.name().toLowerCase(Locale.ROOT)));
        message.append(String.format(Locale.ROOT, "- Time window: %s%n%n", sample.timeWindow().name().toLowerCase(Locale.ROOT)));

        if (severity.isEscalating()) {
            message.append("Immediate Action Required:\n");
            message.append("- Check the circuit breakers of the generation API and publishing API\n");
            message.append("- Check rate-limit utilization of both services\n");
            message.append("- Review the error categories of recent failed attempts\n\n");
        }

        message.append("Next Steps:\n");
        message.append("1. Review failed jobs and their last error category\n");
        message.append("2. Requeue retryable jobs once the dependency has recovered\n");
        message.append("3. Resolve this alert when the failure rate is back below the warning threshold\n");
        return message.toString();
    }
}
