package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.InvalidTransition;
import com.clapgrow.content.api.enums.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates job status transitions.
 * 
 * ⚠️ CRITICAL INFRASTRUCTURE: This validator must remain deterministic.
 * 
 * Requirements:
 * - NO environment flags
 * - NO database calls
 * - NO time-based logic
 * - Pure enum-map based validation
 * 
 * Valid transitions:
 * - PENDING → PROCESSING, CANCELLED
 * - PROCESSING → COMPLETED, FAILED, CANCELLED
 * - FAILED → PENDING (retry requeue)
 * - COMPLETED → (terminal, no transitions)
 * - CANCELLED → (terminal, no transitions)
 * 
 * Re-entering a non-terminal status is valid (an admin requeue of a PENDING job). A terminal status
 * is never re-entered, so a late COMPLETED or CANCELLED cannot overwrite a finished job.
 * Only an admin force override may execute anything else.
 */
@Component
@Slf4j
public class JobStatusTransitionValidator {

    private static final Set<JobStatus> TERMINAL_STATES = EnumSet.of(
        JobStatus.COMPLETED,
        JobStatus.CANCELLED
    );

    private static final Map<JobStatus, Set<JobStatus>> VALID_TRANSITIONS;

    static {
        Map<JobStatus, Set<JobStatus>> transitions = new EnumMap<>(JobStatus.class);
        transitions.put(JobStatus.PENDING, EnumSet.of(JobStatus.PROCESSING, JobStatus.CANCELLED));
        transitions.put(JobStatus.PROCESSING, EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED));
        transitions.put(JobStatus.FAILED, EnumSet.of(JobStatus.PENDING));
        transitions.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        transitions.put(JobStatus.CANCELLED, EnumSet.noneOf(JobStatus.class));
        VALID_TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    /**
     * @param fromStatus Current status
     * @param toStatus Desired new status
     * @return true if transition is valid, false otherwise
     */
    public boolean isValidTransition(JobStatus fromStatus, JobStatus toStatus) {
        if (TERMINAL_STATES.contains(fromStatus)) {
            log.debug("Status transition {} → {} rejected ({} is a terminal state)", fromStatus, toStatus, fromStatus);
            return false;
        }

        if (fromStatus == toStatus) {
            return true;
        }

        Set<JobStatus> allowed = VALID_TRANSITIONS.get(fromStatus);
        return allowed != null && allowed.contains(toStatus);
    }

    public boolean isTerminal(JobStatus status) {
        return TERMINAL_STATES.contains(status);
    }

    public Set<JobStatus> getAllowedTransitions(JobStatus fromStatus) {
        return Set.copyOf(VALID_TRANSITIONS.get(fromStatus));
    }

    /**
     * Every illegal (from, to) pair with the reason it is rejected.
     */
    public List<InvalidTransition> getInvalidTransitions() {
        List<InvalidTransition> invalid = new ArrayList<>();
        for (JobStatus from : JobStatus.values()) {
            for (JobStatus to : JobStatus.values()) {
                if (isValidTransition(from, to)) {
                    continue;
                }
                String reason = TERMINAL_STATES.contains(from)
                    ? from + " is a terminal state"
                    : "Not an allowed transition from " + from;
                invalid.add(new InvalidTransition(from, to, reason));
            }
        }
        return invalid;
    }
}
