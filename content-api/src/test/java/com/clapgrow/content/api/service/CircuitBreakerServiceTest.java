package com.clapgrow.content.api.service;

import com.clapgrow.content.api.config.CircuitBreakerProperties;
import com.clapgrow.content.api.dto.CircuitBreakerStatus;
import com.clapgrow.content.api.dto.CircuitDecision;
import com.clapgrow.content.api.entity.CircuitBreakerState;
import com.clapgrow.content.api.enums.CircuitState;
import com.clapgrow.content.api.repository.CircuitBreakerStateRepository;
import com.clapgrow.content.common.retry.ClassifiedError;
import com.clapgrow.content.common.retry.ErrorCategory;
import com.clapgrow.content.common.service.ExternalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CircuitBreakerServiceTest {

    private static final ExternalService SERVICE = ExternalService.GENERATION_API;

    @Mock
    private CircuitBreakerStateRepository stateRepository;

    @Mock
    private ResilienceStateInitializer stateInitializer;

    @Mock
    private ResilienceMetricsService metricsService;

    private MutableClock clock;
    private CircuitBreakerService circuitBreakerService;
    private CircuitBreakerState state;

    @BeforeEach
    void setUp() {
        CircuitBreakerProperties properties = new CircuitBreakerProperties();
        properties.setFailureThreshold(3);
        properties.setFailureWindowMs(60_000);
        properties.setCoolDownMs(30_000);
        properties.setProbeTimeoutMs(10_000);

        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        circuitBreakerService = new CircuitBreakerService(stateRepository, stateInitializer, properties, metricsService, clock);
        state = new CircuitBreakerState(SERVICE.getKey());
    }

    private void stubLockedState() {
        when(stateRepository.findForUpdate(SERVICE.getKey())).thenReturn(Optional.of(state));
    }

    private static ClassifiedError serverError() {
        return new ClassifiedError(ErrorCategory.SERVER, 503, null, null, "Service Unavailable");
    }

    @Test
    void testRecordFailure_WhenThresholdReachedWithinWindow_OpensBreaker() {
        stubLockedState();

        circuitBreakerService.recordFailure(SERVICE, serverError());
        circuitBreakerService.recordFailure(SERVICE, serverError());
        assertEquals(CircuitState.CLOSED, state.getState());

        CircuitBreakerStatus status = circuitBreakerService.recordFailure(SERVICE, serverError());

        assertEquals(CircuitState.OPEN, status.state());
        assertEquals(3, status.consecutiveFailures());
        assertEquals(30_000, status.retryAfterMs());
        verify(metricsService).recordBreakerStateChange(SERVICE, CircuitState.OPEN);
    }

    @Test
    void testRecordFailure_WhenWindowExpires_RestartsCount() {
        stubLockedState();

        circuitBreakerService.recordFailure(SERVICE, serverError());
        circuitBreakerService.recordFailure(SERVICE, serverError());
        clock.advance(Duration.ofSeconds(61));
        CircuitBreakerStatus status = circuitBreakerService.recordFailure(SERVICE, serverError());

        assertEquals(CircuitState.CLOSED, status.state());
        assertEquals(1, status.windowFailureCount());
        assertEquals(3, status.consecutiveFailures());
    }

    @Test
    void testRecordFailure_WhenCategoryDoesNotCount_LeavesStateUntouched() {
        when(stateRepository.findById(SERVICE.getKey())).thenReturn(Optional.of(state));

        for (int i = 0; i < 5; i++) {
            circuitBreakerService.recordFailure(SERVICE, ClassifiedError.of(ErrorCategory.AUTH, "401 Unauthorized"));
        }

        assertEquals(CircuitState.CLOSED, state.getState());
        assertEquals(0, state.getConsecutiveFailures());
        verify(stateRepository, never()).findForUpdate(any());
        verify(stateRepository, never()).save(any());
    }

    @Test
    void testAllowRequest_WhenOpen_ShortCircuitsUntilCoolDownElapses() {
        stubLockedState();
        for (int i = 0; i < 3; i++) {
            circuitBreakerService.recordFailure(SERVICE, serverError());
        }

        clock.advance(Duration.ofSeconds(10));
        CircuitDecision rejected = circuitBreakerService.allowRequest(SERVICE);
        assertFalse(rejected.allowed());
        assertEquals(CircuitState.OPEN, rejected.state());
        assertEquals(20_000, rejected.retryAfterMs());
        verify(metricsService).recordShortCircuit(SERVICE);

        clock.advance(Duration.ofSeconds(20));
        CircuitDecision probe = circuitBreakerService.allowRequest(SERVICE);
        assertTrue(probe.allowed());
        assertTrue(probe.probe());
        assertEquals(CircuitState.HALF_OPEN, state.getState());
    }

    @Test
    void testAllowRequest_WhenHalfOpen_AdmitsExactlyOneProbe() {
        stubLockedState();
        state.setState(CircuitState.OPEN);
        state.setNextProbeAt(LocalDateTime.now(clock));

        assertTrue(circuitBreakerService.allowRequest(SERVICE).probe());
        CircuitDecision second = circuitBreakerService.allowRequest(SERVICE);

        assertFalse(second.allowed());
        assertEquals(CircuitState.HALF_OPEN, second.state());
        assertEquals(10_000, second.retryAfterMs());
    }

    @Test
    void testAllowRequest_WhenProbeTimedOut_ReclaimsProbe() {
        stubLockedState();
        state.setState(CircuitState.HALF_OPEN);
        state.setProbeStartedAt(LocalDateTime.now(clock));

        clock.advance(Duration.ofSeconds(11));
        CircuitDecision decision = circuitBreakerService.allowRequest(SERVICE);

        assertTrue(decision.allowed());
        assertTrue(decision.probe());
        assertEquals(LocalDateTime.now(clock), state.getProbeStartedAt());
    }

    @Test
    void testProbeSuccess_ClosesBreaker() {
        stubLockedState();
        state.setState(CircuitState.HALF_OPEN);
        state.setConsecutiveFailures(3);
        state.setProbeStartedAt(LocalDateTime.now(clock));

        CircuitBreakerStatus status = circuitBreakerService.recordSuccess(SERVICE);

        assertEquals(CircuitState.CLOSED, status.state());
        assertEquals(0, status.consecutiveFailures());
        assertNull(status.probeStartedAt());
        verify(metricsService).recordBreakerStateChange(SERVICE, CircuitState.CLOSED);
    }

    @Test
    void testProbeFailure_ReopensBreakerAndRestartsCoolDown() {
        stubLockedState();
        state.setState(CircuitState.HALF_OPEN);
        state.setProbeStartedAt(LocalDateTime.now(clock));

        CircuitBreakerStatus status = circuitBreakerService.recordFailure(SERVICE,
            ClassifiedError.of(ErrorCategory.TIMEOUT, "Read timed out"));

        assertEquals(CircuitState.OPEN, status.state());
        assertEquals(LocalDateTime.now(clock).plusSeconds(30), status.nextProbeAt());
    }

    @Test
    void testProbeFailure_WhenCategoryDoesNotCount_ReleasesProbe() {
        state.setState(CircuitState.HALF_OPEN);
        state.setConsecutiveFailures(3);
        state.setProbeStartedAt(LocalDateTime.now(clock));
        when(stateRepository.findById(SERVICE.getKey())).thenReturn(Optional.of(state));
        stubLockedState();

        CircuitBreakerStatus status = circuitBreakerService.recordFailure(SERVICE,
            ClassifiedError.of(ErrorCategory.VALIDATION, "400 Bad Request"));

        assertEquals(CircuitState.HALF_OPEN, status.state());
        assertNull(status.probeStartedAt());
        assertEquals(3, state.getConsecutiveFailures());
        verify(stateRepository).save(state);
        verifyNoInteractions(metricsService);

        CircuitDecision next = circuitBreakerService.allowRequest(SERVICE);
        assertTrue(next.allowed());
        assertTrue(next.probe());
    }

    @Test
    void testRecordSuccess_WhileOpen_KeepsBreakerOpen() {
        stubLockedState();
        state.setState(CircuitState.OPEN);
        state.setConsecutiveFailures(4);
        state.setNextProbeAt(LocalDateTime.now(clock).plusSeconds(30));

        CircuitBreakerStatus status = circuitBreakerService.recordSuccess(SERVICE);

        assertEquals(CircuitState.OPEN, status.state());
        assertEquals(0, status.consecutiveFailures());
    }

    @Test
    void testReset_ForcesClosed() {
        stubLockedState();
        state.setState(CircuitState.OPEN);
        state.setConsecutiveFailures(7);

        CircuitBreakerStatus status = circuitBreakerService.reset(SERVICE);

        assertEquals(CircuitState.CLOSED, status.state());
        assertEquals(0, status.consecutiveFailures());
        assertEquals(0, status.retryAfterMs());
        verify(metricsService).recordBreakerStateChange(SERVICE, CircuitState.CLOSED);
    }

    @Test
    void testGetState_WhenNoRowExists_ReportsClosed() {
        when(stateRepository.findById(SERVICE.getKey())).thenReturn(Optional.empty());

        CircuitBreakerStatus status = circuitBreakerService.getState(SERVICE);

        assertEquals(CircuitState.CLOSED, status.state());
        assertEquals("generation-api", status.dependency());
    }

    @Test
    void testAllowRequest_WhenRowMissing_CreatesItThenLocks() {
        when(stateRepository.findForUpdate(SERVICE.getKey()))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(state));

        assertTrue(circuitBreakerService.allowRequest(SERVICE).allowed());
        verify(stateInitializer).ensureCircuitBreakerState(SERVICE.getKey());
    }
}
