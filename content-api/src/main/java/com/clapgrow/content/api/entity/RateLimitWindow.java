package com.clapgrow.content.api.entity;

import com.clapgrow.content.api.enums.RateLimitWindowType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Fixed rate-limit window for one service. Reset in place when stale rather than accumulated.
 */
@Entity
@Table(name = "rate_limit_windows",
    uniqueConstraints = @UniqueConstraint(name = "uk_rate_limit_windows_service_type", columnNames = {"service_name", "window_type"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "service_name", nullable = false, length = 50)
    private String serviceName;

    @Enumerated(EnumType.STRING)
    @Column(name = "window_type", nullable = false, length = 20)
    private RateLimitWindowType windowType;

    @Column(name = "window_start", nullable = false)
    private LocalDateTime windowStart;

    @Column(name = "request_count", nullable = false)
    private Integer requestCount = 0;

    /**
     * Estimated then reconciled token volume (generation API only).
     */
    @Column(name = "token_count", nullable = false)
    private Long tokenCount = 0L;

    public RateLimitWindow(String serviceName, RateLimitWindowType windowType, LocalDateTime windowStart) {
        this.serviceName = serviceName;
        this.windowType = windowType;
        this.windowStart = windowStart;
        this.requestCount = 0;
        this.tokenCount = 0L;
    }
}
