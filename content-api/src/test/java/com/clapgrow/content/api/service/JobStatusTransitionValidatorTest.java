package com.clapgrow.content.api.service;

import com.clapgrow.content.api.dto.InvalidTransition;
import com.clapgrow.content.api.enums.JobStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobStatusTransitionValidatorTest {

    private final JobStatusTransitionValidator validator = new JobStatusTransitionValidator();

    @ParameterizedTest
    @CsvSource({
        "PENDING, PROCESSING",
        "PENDING, CANCELLED",
        "PROCESSING, COMPLETED",
        "PROCESSING, FAILED",
        "PROCESSING, CANCELLED",
        "FAILED, PENDING"
    })
    void testAllowedTransitions(JobStatus from, JobStatus to) {
        assertTrue(validator.isValidTransition(from, to));
    }

    @ParameterizedTest
    @CsvSource({
        "PENDING, COMPLETED",
        "PENDING, FAILED",
        "PROCESSING, PENDING",
        "FAILED, PROCESSING",
        "FAILED, COMPLETED",
        "COMPLETED, PENDING",
        "COMPLETED, FAILED",
        "CANCELLED, PENDING"
    })
    void testRejectedTransitions(JobStatus from, JobStatus to) {
        assertFalse(validator.isValidTransition(from, to));
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"PENDING", "PROCESSING", "FAILED"})
    void testSameStatusIsValidForNonTerminalStates(JobStatus status) {
        assertTrue(validator.isValidTransition(status, status));
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "CANCELLED"})
    void testTerminalStateCannotBeReentered(JobStatus status) {
        assertFalse(validator.isValidTransition(status, status));
    }

    @Test
    void testTerminalStates() {
        assertTrue(validator.isTerminal(JobStatus.COMPLETED));
        assertTrue(validator.isTerminal(JobStatus.CANCELLED));
        assertFalse(validator.isTerminal(JobStatus.FAILED));
        assertEquals(Set.of(), validator.getAllowedTransitions(JobStatus.COMPLETED));
        assertEquals(Set.of(JobStatus.PENDING), validator.getAllowedTransitions(JobStatus.FAILED));
    }

    @Test
    void testInvalidTransitionsListsEveryIllegalPair() {
        List<InvalidTransition> invalid = validator.getInvalidTransitions();

        // 5 statuses, 3 non-terminal same-status pairs and 6 legal moves
        assertEquals(25 - 3 - 6, invalid.size());
        assertTrue(invalid.stream()
            .anyMatch(t -> t.fromStatus() == JobStatus.COMPLETED && t.toStatus() == JobStatus.COMPLETED));
        assertTrue(invalid.stream().noneMatch(t -> validator.isValidTransition(t.fromStatus(), t.toStatus())));
        InvalidTransition fromCompleted = invalid.stream()
            .filter(t -> t.fromStatus() == JobStatus.COMPLETED)
            .findFirst()
            .orElseThrow();
        assertEquals("COMPLETED is a terminal state", fromCompleted.reason());
    }
}
