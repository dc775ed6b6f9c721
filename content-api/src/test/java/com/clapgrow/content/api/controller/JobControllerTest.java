package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.dto.AttemptOutcomeResult;
import com.clapgrow.content.api.dto.AttemptPermit;
import com.clapgrow.content.api.dto.AttemptSuccessRequest;
import com.clapgrow.content.api.dto.CreateJobRequest;
import com.clapgrow.content.api.dto.JobResponse;
import com.clapgrow.content.api.enums.JobStatus;
import com.clapgrow.content.api.exception.JobNotFoundException;
import com.clapgrow.content.api.service.JobAttemptService;
import com.clapgrow.content.api.service.JobService;
import com.clapgrow.content.common.service.ExternalService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private JobService jobService;

    @MockBean
    private JobAttemptService jobAttemptService;

    private final UUID jobId = UUID.randomUUID();

    private JobResponse pendingJob() {
        return new JobResponse(jobId, "Spring retry patterns", JobStatus.PENDING, 0, 3, false,
                null, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    void testCreateJob_Success() throws Exception {
        CreateJobRequest request = new CreateJobRequest();
        request.setTopic("Spring retry patterns");
        when(jobService.createJob(any(CreateJobRequest.class))).thenReturn(pendingJob());

        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.jobId").value(jobId.toString()))
                .andExpect(jsonPath("$.result.status").value("PENDING"))
                .andExpect(jsonPath("$.result.maxRetries").value(3));
    }

    @Test
    void testCreateJob_BlankTopic_ReturnsBadRequest() throws Exception {
        CreateJobRequest request = new CreateJobRequest();
        request.setTopic(" ");

        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error").value("Validation failed: topic: Topic is required"));

        verifyNoInteractions(jobService);
    }

    @Test
    void testGetJob_NotFound() throws Exception {
        when(jobService.getJob(jobId)).thenThrow(new JobNotFoundException(jobId));

        mockMvc.perform(get("/api/jobs/{jobId}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error").value("Job not found: " + jobId));
    }

    @Test
    void testStartAttempt_Granted() throws Exception {
        when(jobAttemptService.beginAttempt(jobId, ExternalService.GENERATION_API, 800L))
                .thenReturn(AttemptPermit.granted(jobId, false, 800, JobStatus.PROCESSING));

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"openai\", \"estimatedTokens\": 800}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.allowed").value(true))
                .andExpect(jsonPath("$.result.reservedTokens").value(800))
                .andExpect(jsonPath("$.result.jobStatus").value("PROCESSING"));
    }

    @Test
    void testStartAttempt_ShortCircuited_ReturnsServiceUnavailableWithRetryAfter() throws Exception {
        when(jobAttemptService.beginAttempt(eq(jobId), eq(ExternalService.PUBLISHING_API), any()))
                .thenReturn(AttemptPermit.shortCircuited(jobId, 11500, JobStatus.PENDING,
                        "Circuit breaker OPEN for publishing-api"));

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"publishing-api\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "12"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.result.shortCircuited").value(true))
                .andExpect(jsonPath("$.error").value("Circuit breaker OPEN for publishing-api"));
    }

    @Test
    void testStartAttempt_RateLimited_ReturnsTooManyRequests() throws Exception {
        when(jobAttemptService.beginAttempt(eq(jobId), eq(ExternalService.GENERATION_API), any()))
                .thenReturn(AttemptPermit.rateLimited(jobId, 3000, JobStatus.PENDING,
                        "BURST request limit reached (3/3)"));

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"generation-api\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "3"))
                .andExpect(jsonPath("$.result.rateLimited").value(true));
    }

    @Test
    void testStartAttempt_TerminalJob_ReturnsConflict() throws Exception {
        when(jobAttemptService.beginAttempt(eq(jobId), eq(ExternalService.GENERATION_API), any()))
                .thenReturn(AttemptPermit.refused(jobId, JobStatus.COMPLETED, "Job is COMPLETED"));

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"generation-api\"}"))
                .andExpect(status().isConflict())
                .andExpect(header().doesNotExist("Retry-After"));
    }

    @Test
    void testStartAttempt_UnknownService_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"mailchimp\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        verifyNoInteractions(jobAttemptService);
    }

    @Test
    void testRecordSuccess_Completed() throws Exception {
        when(jobAttemptService.recordAttemptSuccess(eq(jobId), any(AttemptSuccessRequest.class)))
                .thenReturn(new AttemptOutcomeResult(jobId, false, JobStatus.COMPLETED, null, null));

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "success")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"wordpress\", \"postId\": \"wp-991\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("success"))
                .andExpect(jsonPath("$.result.jobStatus").value("COMPLETED"));

        verify(jobAttemptService).recordAttemptSuccess(eq(jobId), argThat(r ->
                "wp-991".equals(r.getPostId()) && r.isFinalStep()));
    }

    @Test
    void testAttempts_UnknownAction_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "pause"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown action: pause"));
    }
}
