package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.Alert;
import com.clapgrow.content.api.enums.AlertSeverity;
import com.clapgrow.content.api.enums.TimeWindow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AlertRepository extends JpaRepository<Alert, UUID> {

    /**
     * Most recent alert of a severity/window raised after the given time (cooldown check).
     */
    Optional<Alert> findFirstBySeverityAndTimeWindowAndCreatedAtAfterOrderByCreatedAtDesc(
        AlertSeverity severity, TimeWindow timeWindow, LocalDateTime since);

    List<Alert> findByResolvedFalseAndSeverityOrderByCreatedAtAsc(AlertSeverity severity);

    List<Alert> findByResolvedFalseAndTimeWindow(TimeWindow timeWindow);

    List<Alert> findByResolvedFalseOrderByCreatedAtDesc();

    List<Alert> findByResolvedFalseAndSeverityInAndEscalationLevelLessThan(
        Collection<AlertSeverity> severities, int escalationLevel);

    List<Alert> findTop50ByOrderByCreatedAtDesc();
}
