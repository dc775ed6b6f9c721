package com.clapgrow.content.api.aspect;

import com.clapgrow.content.api.dto.ApiResponse;
import com.clapgrow.content.api.service.AdminAuthService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;

/**
 * Aspect to enforce admin authentication for methods annotated with @RequireAdminAuth.
 * 
 * This aspect:
 * - Reads the X-Admin-Key header from the current request (via RequestContextHolder)
 * - Validates it against the configured admin key
 * - Returns a standardized 401 envelope if authentication fails
 * 
 * ⚠️ Only @RequireAdminAuth is intercepted (not @AdminApi). ArchUnit enforces that every
 * @AdminApi method also carries @RequireAdminAuth.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminAuthAspect {

    static final String ADMIN_KEY_HEADER = "X-Admin-Key";

    private final AdminAuthService adminAuthService;

    @Around("@annotation(com.clapgrow.content.api.annotation.RequireAdminAuth)")
    public Object enforceAdminAuth(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            log.warn("No request attributes found for method: {}.{}",
                method.getDeclaringClass().getSimpleName(), method.getName());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("Internal server error: request context not available"));
        }

        HttpServletRequest request = attributes.getRequest();
        String adminKey = request.getHeader(ADMIN_KEY_HEADER);

        try {
            adminAuthService.validateAdminKey(adminKey);
        } catch (SecurityException e) {
            log.warn("Admin authentication failed for {}.{}: {}",
                method.getDeclaringClass().getSimpleName(), method.getName(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ApiResponse.error("Authentication required"));
        }

        return joinPoint.proceed();
    }
}
