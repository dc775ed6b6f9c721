package com.clapgrow.content.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${cors.allowed-methods:GET,POST,PUT,DELETE,PATCH,OPTIONS}")
    private String[] allowedMethods;

    @Value("${cors.allowed-headers:*}")
    private String[] allowedHeaders;

    @Value("${cors.max-age:3600}")
    private long maxAge;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        boolean hasWildcard = Arrays.stream(allowedOrigins)
                .anyMatch(origin -> "*".equals(origin));

        CorsRegistration apiMapping = registry.addMapping("/api/**")
                .allowedMethods(allowedMethods)
                .allowedHeaders(allowedHeaders)
                .allowCredentials(true)
                .maxAge(maxAge);
        applyOrigins(apiMapping, hasWildcard);

        CorsRegistration adminMapping = registry.addMapping("/admin/api/**")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("Content-Type", "Authorization", "X-Admin-Key")
                .allowCredentials(true)
                .maxAge(maxAge);
        applyOrigins(adminMapping, hasWildcard);
    }

    private void applyOrigins(CorsRegistration registration, boolean hasWildcard) {
        if (hasWildcard) {
            // Use allowedOriginPatterns for wildcard with credentials
            registration.allowedOriginPatterns("*");
        } else {
            registration.allowedOrigins(allowedOrigins);
        }
    }
}
