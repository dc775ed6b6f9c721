package com.clapgrow.content.api.service;

import com.clapgrow.content.api.entity.CircuitBreakerState;
import com.clapgrow.content.api.entity.RateLimitWindow;
import com.clapgrow.content.api.enums.RateLimitWindowType;
import com.clapgrow.content.api.repository.CircuitBreakerStateRepository;
import com.clapgrow.content.api.repository.RateLimitWindowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Lazily creates the shared state rows of breakers and rate limiters.
 * 
 * ⚠️ Each method commits in its own transaction. Two processes racing on the first insert
 * make one of them fail with a unique-key violation; that exception is left to the caller,
 * which simply re-reads the row. Catching it here would mark the caller's transaction rollback-only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResilienceStateInitializer {

    private final CircuitBreakerStateRepository circuitBreakerStateRepository;
    private final RateLimitWindowRepository rateLimitWindowRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureCircuitBreakerState(String dependencyName) {
        if (circuitBreakerStateRepository.existsById(dependencyName)) {
            return;
        }
        circuitBreakerStateRepository.saveAndFlush(new CircuitBreakerState(dependencyName));
        log.info("Created circuit breaker state for {}", dependencyName);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureRateLimitWindows(String serviceName, LocalDateTime now) {
        List<RateLimitWindow> existing = rateLimitWindowRepository.findByServiceName(serviceName);
        Set<RateLimitWindowType> missing = EnumSet.allOf(RateLimitWindowType.class);
        existing.forEach(window -> missing.remove(window.getWindowType()));
        if (missing.isEmpty()) {
            return;
        }
        for (RateLimitWindowType type : missing) {
            rateLimitWindowRepository.save(new RateLimitWindow(serviceName, type, now));
        }
        rateLimitWindowRepository.flush();
        log.info("Created rate limit windows {} for {}", missing, serviceName);
    }
}
