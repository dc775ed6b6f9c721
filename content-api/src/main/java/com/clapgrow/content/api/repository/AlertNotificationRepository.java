package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.AlertNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AlertNotificationRepository extends JpaRepository<AlertNotification, UUID> {

    List<AlertNotification> findTop100ByOrderByCreatedAtDesc();

    List<AlertNotification> findByAlertIdOrderByCreatedAtAsc(UUID alertId);
}
