package com.clapgrow.content.api.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to require admin authentication via aspect.
 * 
 * Methods annotated with @RequireAdminAuth have the X-Admin-Key header validated
 * by AdminAuthAspect before the method body runs. A missing or wrong key yields a 401
 * envelope and the method is never invoked.
 * 
 * Example:
 * <pre>
 * {@code
 * @PostMapping
 * @AdminApi
 * @RequireAdminAuth
 * public ResponseEntity<ApiResponse<AdminRetryResult>> executeRetry(@RequestBody AdminRetryRequest request) {
 *     // Method body - auth already validated by aspect
 * }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireAdminAuth {
}
