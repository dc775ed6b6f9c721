package com.clapgrow.content.api.integration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests to enforce authentication requirements.
 * These tests ensure that:
 * 1. /admin/api/** endpoints fail without a valid X-Admin-Key header
 * 2. Admin-only operations outside /admin/api (rate limiter reset) are guarded the same way
 * 3. Read-only pipeline endpoints stay open
 */
@AutoConfigureMockMvc
@Transactional
@DisplayName("Authentication Enforcement Integration Tests")
class AuthenticationEnforcementIT extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("/admin/api/** should fail with 401 without X-Admin-Key")
    void testAdminApiFailsWithoutAdminKey() throws Exception {
        mockMvc.perform(get("/admin/api/retry").param("action", "statistics"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Authentication required"));

        mockMvc.perform(post("/admin/api/circuit-breaker/reset").param("service", "generation-api"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("Authentication required"));
    }

    @Test
    @DisplayName("/admin/api/** should fail with 401 with invalid X-Admin-Key")
    void testAdminApiFailsWithInvalidAdminKey() throws Exception {
        mockMvc.perform(get("/admin/api/retry")
                .param("action", "permissions")
                .header("X-Admin-Key", "invalid-key"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("/admin/api/** should succeed with valid X-Admin-Key")
    void testAdminApiSucceedsWithValidAdminKey() throws Exception {
        mockMvc.perform(get("/admin/api/retry")
                .param("action", "permissions")
                .param("role", "super_admin")
                .header("X-Admin-Key", ADMIN_API_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.role").value("SUPER_ADMIN"))
            .andExpect(jsonPath("$.result.canForceOverride").value(true));
    }

    @Test
    @DisplayName("Rate limiter reset requires X-Admin-Key")
    void testRateLimiterResetRequiresAdminKey() throws Exception {
        mockMvc.perform(post("/api/rate-limiter")
                .param("action", "reset")
                .param("service", "publishing-api"))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/rate-limiter")
                .param("action", "reset")
                .param("service", "publishing-api")
                .header("X-Admin-Key", ADMIN_API_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.service").value("publishing-api"));
    }

    @Test
    @DisplayName("Pipeline read endpoints do not require X-Admin-Key")
    void testPipelineEndpointsAreOpen() throws Exception {
        mockMvc.perform(get("/api/circuit-breaker"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/job-status").param("action", "invalid"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result.length()").value(16));
    }
}
