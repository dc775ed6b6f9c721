package com.clapgrow.content.api.entity;

import com.clapgrow.content.api.enums.AlertSeverity;
import com.clapgrow.content.api.enums.AlertTrend;
import com.clapgrow.content.api.enums.TimeWindow;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "alerts", indexes = {
    @Index(name = "idx_alerts_severity_resolved", columnList = "severity, resolved"),
    @Index(name = "idx_alerts_created_at", columnList = "created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    public static final String TYPE_FAILURE_RATE = "failure_rate_alert";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "alert_type", nullable = false, length = 50)
    private String alertType = TYPE_FAILURE_RATE;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private AlertSeverity severity;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "source_metric", nullable = false, length = 50)
    private String sourceMetric;

    @Column(name = "metric_value", nullable = false)
    private Double metricValue;

    @Column(name = "threshold_crossed", nullable = false)
    private Double thresholdCrossed;

    @Enumerated(EnumType.STRING)
    @Column(name = "time_window", nullable = false, length = 20)
    private TimeWindow timeWindow;

    @Column(name = "total_jobs", nullable = false)
    private Long totalJobs;

    @Column(name = "failed_jobs", nullable = false)
    private Long failedJobs;

    @Enumerated(EnumType.STRING)
    @Column(name = "trend", length = 20)
    private AlertTrend trend;

    @Column(name = "resolved", nullable = false)
    private Boolean resolved = false;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "escalation_level", nullable = false)
    private Integer escalationLevel = 0;

    @Column(name = "last_escalated_at")
    private LocalDateTime lastEscalatedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
