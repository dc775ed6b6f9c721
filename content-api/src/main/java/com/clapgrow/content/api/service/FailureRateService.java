package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.FailureRateSample;
import com.clapgrow.content.api.enums.AlertTrend;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.enums.TimeWindow;
import com.clapgrow.content.api.repository.ContentJobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Failure rate of jobs created within a time window.
 */
@Service
@RequiredArgsConstructor
public class FailureRateService {

    static final double TREND_THRESHOLD = 0.1;

    private final ContentJobRepository jobRepository;
    private final Clock clock;

    /**
     * Jobs created in [now - window, now].
     */
    @Transactional(readOnly = true)
    public FailureRateSample calculate(TimeWindow window) {
        LocalDateTime end = LocalDateTime.now(clock);
        return sample(window, end.minus(window.getLength()), end);
    }

    /**
     * The window immediately before the current one, used for the trend.
     */
    @Transactional(readOnly = true)
    public FailureRateSample calculatePrevious(TimeWindow window) {
        LocalDateTime end = LocalDateTime.now(clock).minus(window.getLength());
        return sample(window, end.minus(window.getLength()), end);
    }

    private FailureRateSample sample(TimeWindow window, LocalDateTime start, LocalDateTime end) {
        long total = jobRepository.countByCreatedAtBetween(start, end);
        long failed = jobRepository.countByStatusAndCreatedAtBetween(JobStatus.FAILED, start, end);
        return FailureRateSample.of(window, total, Math.min(failed, total));
    }

    /**
     * Relative change of more than 10 % in either direction is a trend.
     */
    public AlertTrend trend(double currentRate, double previousRate) {
        if (previousRate == 0) {
            return currentRate > 0 ? AlertTrend.DEGRADING : AlertTrend.STABLE;
        }
        double change = (currentRate - previousRate) / previousRate;
        if (change > TREND_THRESHOLD) {
            return AlertTrend.DEGRADING;
        }
        if (change < -TREND_THRESHOLD) {
            return AlertTrend.IMPROVING;
        }
        return AlertTrend.STABLE;
    }
}
