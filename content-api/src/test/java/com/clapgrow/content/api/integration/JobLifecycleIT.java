package com.clapgrow.content.api.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end job lifecycle against PostgreSQL: attempt, retryable failure, requeue, success.
 * Not transactional: every request commits, as it would in production.
 */
@AutoConfigureMockMvc
@DisplayName("Job Lifecycle Integration Tests")
class JobLifecycleIT extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String createJob(int maxRetries) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"topic\": \"Lifecycle test\", \"maxRetries\": " + maxRetries + "}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.result.status").value("PENDING"))
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.path("jobId").asText();
    }

    private void startAttempt(String jobId) throws Exception {
        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"generation-api\", \"estimatedTokens\": 500}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.allowed").value(true))
            .andExpect(jsonPath("$.result.jobStatus").value("PROCESSING"));
    }

    @Test
    @DisplayName("Retryable failure requeues the job and a later success completes it")
    void testRetryableFailureThenSuccess() throws Exception {
        String jobId = createJob(3);
        startAttempt(jobId);

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "failure")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"generation-api\", \"httpStatus\": 503, " +
                        "\"message\": \"Service Unavailable\", \"reservedTokens\": 500}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.jobStatus").value("PENDING"))
            .andExpect(jsonPath("$.result.retry.errorCategory").value("SERVER"))
            .andExpect(jsonPath("$.result.retry.retryCount").value(1))
            .andExpect(jsonPath("$.result.retry.eligibleForFurtherRetry").value(true));

        startAttempt(jobId);

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "success")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"generation-api\", \"title\": \"Done\", " +
                        "\"actualTokens\": 420, \"reservedTokens\": 500}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.jobStatus").value("COMPLETED"));

        mockMvc.perform(get("/api/job-status")
                .param("action", "history")
                .param("jobId", jobId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.length()").value(5))
            .andExpect(jsonPath("$.result[1].toStatus").value("FAILED"))
            .andExpect(jsonPath("$.result[2].toStatus").value("PENDING"))
            .andExpect(jsonPath("$.result[4].toStatus").value("COMPLETED"));

        mockMvc.perform(get("/api/job-status")
                .param("action", "consistency")
                .param("jobId", jobId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.consistent").value(true))
            .andExpect(jsonPath("$.result.currentStatus").value("COMPLETED"));
    }

    @Test
    @DisplayName("Authentication failure is not retried and leaves the job FAILED")
    void testNonRetryableFailureStaysFailed() throws Exception {
        String jobId = createJob(3);
        startAttempt(jobId);

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "failure")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"generation-api\", \"httpStatus\": 401, " +
                        "\"message\": \"Incorrect API key provided\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.jobStatus").value("FAILED"))
            .andExpect(jsonPath("$.result.retry.eligibleForFurtherRetry").value(false));

        mockMvc.perform(post("/api/jobs/{jobId}/attempts", jobId)
                .param("action", "start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"service\": \"generation-api\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Completed jobs reject further transitions")
    void testCompletedJobRejectsTransition() throws Exception {
        String jobId = createJob(3);

        mockMvc.perform(post("/api/job-status")
                .param("action", "test")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobId\": \"" + jobId + "\", \"toStatus\": \"COMPLETED\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid status transition: PENDING → COMPLETED"));

        mockMvc.perform(post("/api/job-status")
                .param("action", "test")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobId\": \"" + jobId + "\", \"toStatus\": \"CANCELLED\"}"))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/job-status")
                .param("action", "test")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobId\": \"" + jobId + "\", \"toStatus\": \"PENDING\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.result.fromStatus").value("CANCELLED"));
    }
}
