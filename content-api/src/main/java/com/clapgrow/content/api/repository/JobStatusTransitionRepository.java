package com.clapgrow.content.api.repository;

import com.clapgrow.content.api.entity.JobStatusTransition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JobStatusTransitionRepository extends JpaRepository<JobStatusTransition, Long> {

    /**
     * Full audit trail for a job in insertion order.
     */
    List<JobStatusTransition> findByJobIdOrderByIdAsc(UUID jobId);

    JobStatusTransition findFirstByJobIdOrderByIdDesc(UUID jobId);

    boolean existsByJobIdAndForceOverrideTrue(UUID jobId);
}
