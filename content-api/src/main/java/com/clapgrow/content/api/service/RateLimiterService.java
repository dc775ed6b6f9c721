package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.RateLimitProperties;
import com.clapgrow.content.api.config.RateLimitProperties.ServiceLimits;
import com.clapgrow.content.api.dto.CleanupResult;
import com.clapgrow.content.api.dto.RateLimitDecision;
import com.clapgrow.content.api.dto.RateLimitInfo;
import com.clapgrow.content.api.dto.RateLimitStats;
import com.clapgrow.content.api.entity.RateLimitRequestLog;
import com.clapgrow.content.api.entity.RateLimitWindow;
import com.clapgrow.content.api.enums.RateLimitWindowType;
import com.clapgrow.content.api.repository.RateLimitRequestLogRepository;
import com.clapgrow.content.api.repository.RateLimitWindowRepository;
import com.clapgrow.content.common.service.ExternalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fixed-window rate limiter shared by every process calling an external service.
 * 
 * Each service has three windows (burst, minute, hour). A request is allowed only if every
 * window has room for it; the generation API is additionally metered by estimated tokens
 * against its minute and hour windows. A window whose length has elapsed is reset in place.
 * 
 * Flow:
 * 1. {@link #canMakeRequest} checks all windows and, when allowed, reserves the request and its
 *    estimated tokens
 * 2. The caller makes the call
 * 3. {@link #recordRequest} reconciles the estimate with the real token usage and logs the call
 * 
 * ⚠️ CONCURRENCY: The check and the reservation run under a pessimistic lock on the service's
 * window rows, so concurrent callers cannot overshoot the quota.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RateLimiterService {

    private static final int WINDOW_COUNT = RateLimitWindowType.values().length;

    private final RateLimitWindowRepository windowRepository;
    private final RateLimitRequestLogRepository requestLogRepository;
    private final ResilienceStateInitializer stateInitializer;
    private final RateLimitProperties properties;
    private final ResilienceMetricsService metricsService;
    private final Clock clock;

    /**
     * Check the quota and reserve capacity for one request.
     * 
     * @param estimatedTokens expected token volume, ignored for services that aren't token metered
     */
    @Transactional
    public RateLimitDecision canMakeRequest(ExternalService service, Long estimatedTokens) {
        ServiceLimits limits = properties.forService(service);
        LocalDateTime now = LocalDateTime.now(clock);
        List<RateLimitWindow> windows = lockWindows(service, now);
        long tokens = service.isTokenMetered() && estimatedTokens != null ? Math.max(0, estimatedTokens) : 0;

        long waitTimeMs = 0;
        List<String> violations = new ArrayList<>();
        for (RateLimitWindow window : windows) {
            Duration length = lengthOf(window.getWindowType(), limits);
            rollIfStale(window, length, now);

            int requestLimit = requestLimitOf(window.getWindowType(), limits);
            Long tokenLimit = tokenLimitOf(service, window.getWindowType(), limits);
            boolean requestsExceeded = window.getRequestCount() + 1 > requestLimit;
            boolean tokensExceeded = tokenLimit != null
                && (window.getTokenCount() >= tokenLimit || window.getTokenCount() + tokens > tokenLimit);

            if (requestsExceeded || tokensExceeded) {
                LocalDateTime resetsAt = window.getWindowStart().plus(length);
                waitTimeMs = Math.max(waitTimeMs, Duration.between(now, resetsAt).toMillis());
                violations.add(String.format("%s %s limit reached (%s)",
                    window.getWindowType(),
                    requestsExceeded ? "request" : "token",
                    requestsExceeded
                        ? window.getRequestCount() + "/" + requestLimit
                        : window.getTokenCount() + "+" + tokens + "/" + tokenLimit));
            }
        }

        if (!violations.isEmpty()) {
            windowRepository.saveAll(windows);
            metricsService.recordRateLimitDenied(service);
            String reason = "Rate limit exceeded for " + service.getKey() + ": " + String.join("; ", violations);
            log.warn("{} (wait {} ms)", reason, waitTimeMs);
            return RateLimitDecision.deny(waitTimeMs, reason);
        }

        for (RateLimitWindow window : windows) {
            window.setRequestCount(window.getRequestCount() + 1);
            if (tokenLimitOf(service, window.getWindowType(), limits) != null) {
                window.setTokenCount(window.getTokenCount() + tokens);
            }
        }
        windowRepository.saveAll(windows);
        log.debug("Rate limit reservation for {}: 1 request, {} tokens", service.getKey(), tokens);
        return RateLimitDecision.allow(tokens);
    }

    /**
     * Commit the real usage of a completed call.
     * 
     * @param actualTokens   tokens really consumed, null when unknown (the reservation stands)
     * @param reservedTokens tokens reserved by canMakeRequest for this call
     */
    @Transactional
    public void recordRequest(ExternalService service, Long actualTokens, Long reservedTokens,
                              long responseTimeMs, boolean success) {
        LocalDateTime now = LocalDateTime.now(clock);
        long reserved = reservedTokens != null ? reservedTokens : 0;

        if (service.isTokenMetered() && actualTokens != null && actualTokens != reserved) {
            ServiceLimits limits = properties.forService(service);
            long delta = actualTokens - reserved;
            for (RateLimitWindow window : lockWindows(service, now)) {
                if (tokenLimitOf(service, window.getWindowType(), limits) != null) {
                    window.setTokenCount(Math.max(0, window.getTokenCount() + delta));
                }
            }
            log.debug("Reconciled {} tokens for {} (estimate {}, actual {})", delta, service.getKey(), reserved, actualTokens);
        }

        long loggedTokens = service.isTokenMetered() ? (actualTokens != null ? actualTokens : reserved) : 0;
        RateLimitRequestLog entry = new RateLimitRequestLog();
        entry.setServiceName(service.getKey());
        entry.setTokens((int) Math.min(loggedTokens, Integer.MAX_VALUE));
        entry.setResponseTimeMs(Math.max(0, responseTimeMs));
        entry.setSuccess(success);
        entry.setTimestamp(now);
        requestLogRepository.save(entry);
    }

    /**
     * Time until a request without tokens would be admitted. Read-only, reserves nothing.
     */
    @Transactional(readOnly = true)
    public long peekWaitTimeMs(ExternalService service) {
        ServiceLimits limits = properties.forService(service);
        LocalDateTime now = LocalDateTime.now(clock);
        long waitTimeMs = 0;
        for (RateLimitWindow window : windowRepository.findByServiceName(service.getKey())) {
            Duration length = lengthOf(window.getWindowType(), limits);
            LocalDateTime resetsAt = window.getWindowStart().plus(length);
            if (!now.isBefore(resetsAt)) {
                continue;
            }
            Long tokenLimit = tokenLimitOf(service, window.getWindowType(), limits);
            boolean full = window.getRequestCount() >= requestLimitOf(window.getWindowType(), limits)
                || (tokenLimit != null && window.getTokenCount() >= tokenLimit);
            if (full) {
                waitTimeMs = Math.max(waitTimeMs, Duration.between(now, resetsAt).toMillis());
            }
        }
        return waitTimeMs;
    }

    @Transactional(readOnly = true)
    public RateLimitStats getStats(ExternalService service) {
        ServiceLimits limits = properties.forService(service);
        LocalDateTime now = LocalDateTime.now(clock);
        RateLimitRequestLogRepository.UsageSummary lastMinute =
            requestLogRepository.summarizeSince(service.getKey(), now.minusMinutes(1));
        RateLimitRequestLogRepository.UsageSummary lastHour =
            requestLogRepository.summarizeSince(service.getKey(), now.minusHours(1));

        long hourRequests = valueOf(lastHour.getRequestCount());
        double successRate = hourRequests > 0 ? (double) valueOf(lastHour.getSuccessCount()) / hourRequests : 1.0;
        double averageResponseTime = lastHour.getAverageResponseTimeMs() != null ? lastHour.getAverageResponseTimeMs() : 0.0;

        double minuteUtilization = 0;
        double hourUtilization = 0;
        Double tokenMinuteUtilization = service.isTokenMetered() ? 0.0 : null;
        Double tokenHourUtilization = service.isTokenMetered() ? 0.0 : null;
        for (RateLimitWindow window : windowRepository.findByServiceName(service.getKey())) {
            if (isStale(window, lengthOf(window.getWindowType(), limits), now)) {
                continue;
            }
            double requestUtilization = ratio(window.getRequestCount(), requestLimitOf(window.getWindowType(), limits));
            Long tokenLimit = tokenLimitOf(service, window.getWindowType(), limits);
            Double tokenUtilization = tokenLimit != null ? ratio(window.getTokenCount(), tokenLimit) : null;
            if (window.getWindowType() == RateLimitWindowType.MINUTE) {
                minuteUtilization = requestUtilization;
                tokenMinuteUtilization = tokenUtilization != null ? tokenUtilization : tokenMinuteUtilization;
            } else if (window.getWindowType() == RateLimitWindowType.HOUR) {
                hourUtilization = requestUtilization;
                tokenHourUtilization = tokenUtilization != null ? tokenUtilization : tokenHourUtilization;
            }
        }

        return new RateLimitStats(
            service.getKey(),
            valueOf(lastMinute.getRequestCount()),
            hourRequests,
            service.isTokenMetered() ? valueOf(lastMinute.getTokenCount()) : null,
            service.isTokenMetered() ? valueOf(lastHour.getTokenCount()) : null,
            successRate,
            averageResponseTime,
            minuteUtilization,
            hourUtilization,
            tokenMinuteUtilization,
            tokenHourUtilization
        );
    }

    /**
     * Limits, remaining capacity and reset time of each window.
     */
    @Transactional(readOnly = true)
    public RateLimitInfo getRateLimitInfo(ExternalService service) {
        ServiceLimits limits = properties.forService(service);
        LocalDateTime now = LocalDateTime.now(clock);
        List<RateLimitWindow> stored = windowRepository.findByServiceName(service.getKey());

        List<RateLimitInfo.WindowInfo> windows = new ArrayList<>();
        for (RateLimitWindowType type : RateLimitWindowType.values()) {
            Duration length = lengthOf(type, limits);
            RateLimitWindow window = stored.stream()
                .filter(w -> w.getWindowType() == type)
                .findFirst()
                .filter(w -> !isStale(w, length, now))
                .orElseGet(() -> new RateLimitWindow(service.getKey(), type, now));

            int requestLimit = requestLimitOf(type, limits);
            Long tokenLimit = tokenLimitOf(service, type, limits);
            windows.add(new RateLimitInfo.WindowInfo(
                type,
                length.toMillis(),
                window.getWindowStart(),
                window.getWindowStart().plus(length),
                window.getRequestCount(),
                requestLimit,
                Math.max(0, requestLimit - window.getRequestCount()),
                tokenLimit != null ? window.getTokenCount() : null,
                tokenLimit,
                tokenLimit != null ? Math.max(0, tokenLimit - window.getTokenCount()) : null
            ));
        }
        windows.sort(Comparator.comparing(RateLimitInfo.WindowInfo::type));
        return new RateLimitInfo(service.getKey(), service.isTokenMetered(), windows);
    }

    /**
     * Highest request or token utilization across the live windows (0..1).
     */
    @Transactional(readOnly = true)
    public double getUtilization(ExternalService service) {
        ServiceLimits limits = properties.forService(service);
        LocalDateTime now = LocalDateTime.now(clock);
        double max = 0;
        for (RateLimitWindow window : windowRepository.findByServiceName(service.getKey())) {
            if (isStale(window, lengthOf(window.getWindowType(), limits), now)) {
                continue;
            }
            max = Math.max(max, ratio(window.getRequestCount(), requestLimitOf(window.getWindowType(), limits)));
            Long tokenLimit = tokenLimitOf(service, window.getWindowType(), limits);
            if (tokenLimit != null) {
                max = Math.max(max, ratio(window.getTokenCount(), tokenLimit));
            }
        }
        return max;
    }

    @Transactional
    public RateLimitInfo reset(ExternalService service) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<RateLimitWindow> windows = lockWindows(service, now);
        for (RateLimitWindow window : windows) {
            window.setWindowStart(now);
            window.setRequestCount(0);
            window.setTokenCount(0L);
        }
        windowRepository.saveAll(windows);
        log.info("Rate limit windows reset for {}", service.getKey());
        return getRateLimitInfo(service);
    }

    @Transactional
    public CleanupResult cleanupRequestLog() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(properties.getRequestLogRetentionHours());
        int deleted = requestLogRepository.deleteOlderThan(cutoff);
        log.info("Deleted {} rate limit request log rows older than {}", deleted, cutoff);
        return new CleanupResult("rate_limit_request_log", deleted, cutoff);
    }

    private List<RateLimitWindow> lockWindows(ExternalService service, LocalDateTime now) {
        String name = service.getKey();
        List<RateLimitWindow> windows = windowRepository.findForUpdate(name);
        if (windows.size() >= WINDOW_COUNT) {
            return windows;
        }
        try {
            stateInitializer.ensureRateLimitWindows(name, now);
        } catch (DataIntegrityViolationException e) {
            log.debug("Rate limit windows for {} were created concurrently", name);
        }
        windows = windowRepository.findForUpdate(name);
        if (windows.size() < WINDOW_COUNT) {
            throw new IllegalStateException("Rate limit windows missing for " + name);
        }
        return windows;
    }

    private static void rollIfStale(RateLimitWindow window, Duration length, LocalDateTime now) {
        if (isStale(window, length, now)) {
            window.setWindowStart(now);
            window.setRequestCount(0);
            window.setTokenCount(0L);
        }
    }

    private static boolean isStale(RateLimitWindow window, Duration length, LocalDateTime now) {
        return !now.isBefore(window.getWindowStart().plus(length));
    }

    static Duration lengthOf(RateLimitWindowType type, ServiceLimits limits) {
        return type == RateLimitWindowType.BURST
            ? Duration.ofMillis(limits.getBurstWindowMs())
            : type.getFixedLength();
    }

    static int requestLimitOf(RateLimitWindowType type, ServiceLimits limits) {
        return switch (type) {
            case BURST -> limits.getBurstLimit();
            case MINUTE -> limits.getRequestsPerMinute();
            case HOUR -> limits.getRequestsPerHour();
        };
    }

    static Long tokenLimitOf(ExternalService service, RateLimitWindowType type, ServiceLimits limits) {
        if (!service.isTokenMetered()) {
            return null;
        }
        return switch (type) {
            case BURST -> null;
            case MINUTE -> limits.getTokensPerMinute();
            case HOUR -> limits.getTokensPerHour();
        };
    }

    private static double ratio(long used, long limit) {
        return limit > 0 ? (double) used / limit : 0.0;
    }

    private static long valueOf(Long value) {
        return value != null ? value : 0L;
    }
}
