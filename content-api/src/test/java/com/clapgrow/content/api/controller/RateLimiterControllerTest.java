package com.clapgrow.content.api.controller;

import com.clapgrow.content.api.aspect.AdminAuthAspect;
import com.clapgrow.content.api.dto.RateLimitDecision;
import com.clapgrow.content.api.dto.RateLimitInfo;
import com.clapgrow.content.api.service.AdminAuthService;
import com.clapgrow.content.api.service.RateLimiterService;
import com.clapgrow.content.common.service.ExternalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.aop.AopAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RateLimiterController.class)
@Import(AdminAuthAspect.class)
@ImportAutoConfiguration(AopAutoConfiguration.class)
class RateLimiterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RateLimiterService rateLimiterService;

    @MockBean
    private AdminAuthService adminAuthService;

    @Test
    void testTest_Allowed() throws Exception {
        when(rateLimiterService.canMakeRequest(ExternalService.GENERATION_API, 500L))
                .thenReturn(RateLimitDecision.allow(500));

        mockMvc.perform(post("/api/rate-limiter")
                .param("action", "test")
                .param("service", "generation-api")
                .param("estimatedTokens", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("generation-api"))
                .andExpect(jsonPath("$.result.allowed").value(true))
                .andExpect(jsonPath("$.result.reservedTokens").value(500));
    }

    @Test
    void testTest_Denied_ReturnsTooManyRequestsWithRetryAfter() throws Exception {
        when(rateLimiterService.canMakeRequest(ExternalService.PUBLISHING_API, null))
                .thenReturn(RateLimitDecision.deny(4200, "MINUTE request limit reached (30/30)"));

        mockMvc.perform(post("/api/rate-limiter")
                .param("action", "test")
                .param("service", "wordpress"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.service").value("publishing-api"))
                .andExpect(jsonPath("$.result.reason").value("MINUTE request limit reached (30/30)"));
    }

    @Test
    void testInfo_UnknownService_ReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/rate-limiter")
                .param("action", "info")
                .param("service", "twitter"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        verifyNoInteractions(rateLimiterService);
    }

    @Test
    void testInfo_MissingService_ReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/rate-limiter").param("action", "info"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing required parameter: service"));
    }

    @Test
    void testReset_RequiresAdminKey() throws Exception {
        doThrow(new SecurityException("Admin API key is required"))
                .when(adminAuthService).validateAdminKey(null);

        mockMvc.perform(post("/api/rate-limiter")
                .param("action", "reset")
                .param("service", "generation-api"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Authentication required"));

        verify(rateLimiterService, never()).reset(any());
    }

    @Test
    void testReset_WithAdminKey() throws Exception {
        when(rateLimiterService.reset(ExternalService.GENERATION_API))
                .thenReturn(new RateLimitInfo("generation-api", true, List.of()));

        mockMvc.perform(post("/api/rate-limiter")
                .param("action", "reset")
                .param("service", "generation-api")
                .header("X-Admin-Key", "test-admin-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("reset"))
                .andExpect(jsonPath("$.result.tokenMetered").value(true));

        verify(adminAuthService).validateAdminKey("test-admin-key");
        verify(rateLimiterService).reset(ExternalService.GENERATION_API);
    }
}
