package com.clapgrow.content.api.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marker annotation for admin API endpoints.
 * 
 * Can be applied at class or method level:
 * - Class-level: All methods in the controller are treated as admin APIs
 * - Method-level: Only the annotated method is treated as an admin API
 * 
 * Every method carrying @AdminApi must also carry @RequireAdminAuth (enforced by ArchUnit),
 * so the X-Admin-Key check cannot be forgotten on a new privileged endpoint.
 * 
 * Example:
 * <pre>
 * {@code
 * @RestController
 * @RequestMapping("/admin/api/retry")
 * @AdminApi
 * public class AdminRetryController {
 *     // All methods in this controller are admin APIs
 * }
 * }
 * </pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface AdminApi {
}
