package com.clapgrow.content.api.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "rate_limit_request_log", indexes = {
    @Index(name = "idx_rate_limit_request_log_service_ts", columnList = "service_name, timestamp")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitRequestLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "service_name", nullable = false, length = 50)
    private String serviceName;

    @Column(name = "tokens", nullable = false)
    private Integer tokens = 0;

    @Column(name = "response_time_ms", nullable = false)
    private Long responseTimeMs = 0L;

    @Column(name = "success", nullable = false)
    private Boolean success;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;
}
