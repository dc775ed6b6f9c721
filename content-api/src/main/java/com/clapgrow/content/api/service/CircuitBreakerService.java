package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.CircuitBreakerProperties;
import com.clapgrow.content.api.dto.CircuitBreakerStatus;
import com.clapgrow.content.api.dto.CircuitDecision;
import com.clapgrow.content.api.entity.CircuitBreakerState;
import com.clapgrow.content.api.enums.CircuitState;
import com.clapgrow.content.api.repository.CircuitBreakerStateRepository;
import com.clapgrow.content.common.retry.ClassifiedError;
import com.clapgrow.content.common.service.ExternalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Persisted circuit breaker, one row per external dependency.
 * 
 * States:
 * - CLOSED: calls proceed. Qualifying failures within failure-window-ms are counted and the
 *   breaker trips once they reach failure-threshold
 * - OPEN: calls are short-circuited until cool-down-ms has elapsed since the trip
 * - HALF_OPEN: exactly one probe call is admitted; its success closes the breaker,
 *   its failure re-opens it and restarts the cool-down
 * 
 * Only NETWORK, TIMEOUT and SERVER failures count (ErrorCategory#countsTowardsBreaker).
 * Any success resets consecutive_failures to 0.
 * 
 * ⚠️ CONCURRENCY: Every mutation reads the row with a pessimistic write lock scoped to the
 * dependency, so the counter increment and the state flip are one atomic step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CircuitBreakerService {

    private final CircuitBreakerStateRepository stateRepository;
    private final ResilienceStateInitializer stateInitializer;
    private final CircuitBreakerProperties properties;
    private final ResilienceMetricsService metricsService;
    private final Clock clock;

    /**
     * Decide whether a call to the dependency may be attempted now.
     * An OPEN breaker whose cool-down has elapsed moves to HALF_OPEN and hands the probe to this caller.
     */
    @Transactional
    public CircuitDecision allowRequest(ExternalService service) {
        CircuitBreakerState state = lockState(service);
        LocalDateTime now = LocalDateTime.now(clock);

        switch (state.getState()) {
            case CLOSED:
                return CircuitDecision.allow(CircuitState.CLOSED, false, "Circuit closed");

            case OPEN:
                if (state.getNextProbeAt() == null || !now.isBefore(state.getNextProbeAt())) {
                    state.setState(CircuitState.HALF_OPEN);
                    state.setProbeStartedAt(now);
                    state.setUpdatedAt(now);
                    stateRepository.save(state);
                    metricsService.recordBreakerStateChange(service, CircuitState.HALF_OPEN);
                    log.info("Circuit breaker for {} is HALF_OPEN, probe request allowed", service.getKey());
                    return CircuitDecision.allow(CircuitState.HALF_OPEN, true, "Cool-down elapsed, probe request allowed");
                }
                long retryAfterMs = millisBetween(now, state.getNextProbeAt());
                metricsService.recordShortCircuit(service);
                log.warn("Circuit breaker for {} is OPEN, short-circuiting call (retry in {} ms)",
                    service.getKey(), retryAfterMs);
                return CircuitDecision.reject(CircuitState.OPEN, retryAfterMs,
                    "Circuit open for " + service.getKey() + ", no request made");

            case HALF_OPEN:
            default:
                LocalDateTime probeDeadline = state.getProbeStartedAt() != null
                    ? state.getProbeStartedAt().plus(Duration.ofMillis(properties.getProbeTimeoutMs()))
                    : null;
                if (probeDeadline == null) {
                    state.setProbeStartedAt(now);
                    state.setUpdatedAt(now);
                    stateRepository.save(state);
                    return CircuitDecision.allow(CircuitState.HALF_OPEN, true, "No probe in flight, probe request allowed");
                }
                if (!now.isBefore(probeDeadline)) {
                    state.setProbeStartedAt(now);
                    state.setUpdatedAt(now);
                    stateRepository.save(state);
                    log.info("Circuit breaker for {} reclaimed a timed-out probe", service.getKey());
                    return CircuitDecision.allow(CircuitState.HALF_OPEN, true, "Previous probe timed out, probe request allowed");
                }
                metricsService.recordShortCircuit(service);
                log.warn("Circuit breaker for {} is HALF_OPEN with a probe in flight, short-circuiting call",
                    service.getKey());
                return CircuitDecision.reject(CircuitState.HALF_OPEN, millisBetween(now, probeDeadline),
                    "Probe already in flight for " + service.getKey() + ", no request made");
        }
    }

    @Transactional
    public CircuitBreakerStatus recordSuccess(ExternalService service) {
        CircuitBreakerState state = lockState(service);
        LocalDateTime now = LocalDateTime.now(clock);

        state.setConsecutiveFailures(0);
        state.setWindowFailureCount(0);
        state.setWindowStartedAt(null);
        state.setLastSuccessAt(now);

        if (state.getState() == CircuitState.HALF_OPEN) {
            state.setState(CircuitState.CLOSED);
            state.setOpenedAt(null);
            state.setNextProbeAt(null);
            state.setProbeStartedAt(null);
            metricsService.recordBreakerStateChange(service, CircuitState.CLOSED);
            log.info("Circuit breaker for {} CLOSED after successful probe", service.getKey());
        }
        // A success reported while OPEN comes from a call admitted before the trip; the breaker stays open

        state.setUpdatedAt(now);
        stateRepository.save(state);
        return toStatus(state, now);
    }

    /**
     * Count a failure against the breaker. Failures whose category doesn't indicate
     * dependency unavailability leave the counters untouched.
     * 
     * ⚠️ A probe that ends in such a failure (AUTH, VALIDATION...) says nothing about the dependency,
     * so the probe slot is released and the next caller may probe right away.
     */
    @Transactional
    public CircuitBreakerStatus recordFailure(ExternalService service, ClassifiedError error) {
        if (error == null || !error.countsTowardsBreaker()) {
            log.debug("Failure for {} not counted by circuit breaker (category={})",
                service.getKey(), error != null ? error.category() : null);
            CircuitBreakerStatus current = getState(service);
            return current.state() == CircuitState.HALF_OPEN && current.probeStartedAt() != null
                ? releaseProbe(service)
                : current;
        }

        CircuitBreakerState state = lockState(service);
        LocalDateTime now = LocalDateTime.now(clock);
        state.setLastFailureAt(now);
        state.setConsecutiveFailures(state.getConsecutiveFailures() + 1);

        switch (state.getState()) {
            case HALF_OPEN -> {
                open(state, now);
                metricsService.recordBreakerStateChange(service, CircuitState.OPEN);
                log.warn("Circuit breaker for {} re-OPENED after failed probe ({})", service.getKey(), error.category());
            }
            case OPEN -> log.debug("Late failure for {} while circuit is OPEN", service.getKey());
            case CLOSED -> {
                Duration window = Duration.ofMillis(properties.getFailureWindowMs());
                if (state.getWindowStartedAt() == null || !now.isBefore(state.getWindowStartedAt().plus(window))) {
                    state.setWindowStartedAt(now);
                    state.setWindowFailureCount(0);
                }
                state.setWindowFailureCount(state.getWindowFailureCount() + 1);
                if (state.getWindowFailureCount() >= properties.getFailureThreshold()) {
                    open(state, now);
                    metricsService.recordBreakerStateChange(service, CircuitState.OPEN);
                    log.warn("Circuit breaker for {} OPENED after {} failures within {} ms",
                        service.getKey(), state.getWindowFailureCount(), properties.getFailureWindowMs());
                }
            }
        }

        state.setUpdatedAt(now);
        stateRepository.save(state);
        return toStatus(state, now);
    }

    private CircuitBreakerStatus releaseProbe(ExternalService service) {
        CircuitBreakerState state = lockState(service);
        LocalDateTime now = LocalDateTime.now(clock);
        if (state.getState() == CircuitState.HALF_OPEN && state.getProbeStartedAt() != null) {
            state.setProbeStartedAt(null);
            state.setUpdatedAt(now);
            stateRepository.save(state);
            log.info("Circuit breaker for {} released probe after an uncounted failure", service.getKey());
        }
        return toStatus(state, now);
    }

    private void open(CircuitBreakerState state, LocalDateTime now) {
        state.setState(CircuitState.OPEN);
        state.setOpenedAt(now);
        state.setNextProbeAt(now.plus(Duration.ofMillis(properties.getCoolDownMs())));
        state.setProbeStartedAt(null);
    }

    /**
     * Force the breaker CLOSED and clear all counters.
     */
    @Transactional
    public CircuitBreakerStatus reset(ExternalService service) {
        CircuitBreakerState state = lockState(service);
        LocalDateTime now = LocalDateTime.now(clock);
        CircuitState previous = state.getState();

        state.setState(CircuitState.CLOSED);
        state.setConsecutiveFailures(0);
        state.setWindowFailureCount(0);
        state.setWindowStartedAt(null);
        state.setOpenedAt(null);
        state.setNextProbeAt(null);
        state.setProbeStartedAt(null);
        state.setUpdatedAt(now);
        stateRepository.save(state);

        if (previous != CircuitState.CLOSED) {
            metricsService.recordBreakerStateChange(service, CircuitState.CLOSED);
        }
        log.info("Circuit breaker for {} manually reset ({} → CLOSED)", service.getKey(), previous);
        return toStatus(state, now);
    }

    /**
     * Read-only view. A dependency without a row is reported CLOSED.
     */
    @Transactional(readOnly = true)
    public CircuitBreakerStatus getState(ExternalService service) {
        CircuitBreakerState state = stateRepository.findById(service.getKey())
            .orElseGet(() -> new CircuitBreakerState(service.getKey()));
        return toStatus(state, LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public List<CircuitBreakerStatus> getAllStates() {
        return Arrays.stream(ExternalService.values())
            .map(this::getState)
            .toList();
    }

    /**
     * Time until the breaker may admit a call, 0 when it would admit one now.
     */
    @Transactional(readOnly = true)
    public long getRetryAfterMs(ExternalService service) {
        return getState(service).retryAfterMs();
    }

    private CircuitBreakerState lockState(ExternalService service) {
        String name = service.getKey();
        return stateRepository.findForUpdate(name).orElseGet(() -> {
            try {
                stateInitializer.ensureCircuitBreakerState(name);
            } catch (DataIntegrityViolationException e) {
                log.debug("Circuit breaker state for {} was created concurrently", name);
            }
            return stateRepository.findForUpdate(name)
                .orElseThrow(() -> new IllegalStateException("Circuit breaker state missing for " + name));
        });
    }

    private CircuitBreakerStatus toStatus(CircuitBreakerState state, LocalDateTime now) {
        long retryAfterMs = 0;
        if (state.getState() == CircuitState.OPEN && state.getNextProbeAt() != null) {
            retryAfterMs = millisBetween(now, state.getNextProbeAt());
        } else if (state.getState() == CircuitState.HALF_OPEN && state.getProbeStartedAt() != null) {
            retryAfterMs = millisBetween(now,
                state.getProbeStartedAt().plus(Duration.ofMillis(properties.getProbeTimeoutMs())));
        }
        return new CircuitBreakerStatus(
            state.getDependencyName(),
            state.getState(),
            state.getConsecutiveFailures(),
            state.getWindowFailureCount(),
            state.getWindowStartedAt(),
            state.getOpenedAt(),
            state.getNextProbeAt(),
            state.getProbeStartedAt(),
            state.getLastFailureAt(),
            state.getLastSuccessAt(),
            retryAfterMs
        );
    }

    private static long millisBetween(LocalDateTime from, LocalDateTime to) {
        return Math.max(0, Duration.between(from, to).toMillis());
    }
}
