package com.clapgrow.content.api.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    static final String ADMIN_KEY_SCHEME = "AdminKey";

    @Bean
    public OpenAPI contentApiOpenAPI(@Value("${server.port:8080}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Content Automation API")
                        .description("Job lifecycle and resilience endpoints of the content automation pipeline: " +
                                "retry tracking, circuit breakers, rate limits, failure-rate alerting and admin retries. " +
                                "Endpoints under /admin/api require the X-Admin-Key header.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local Development Server")
                ))
                .components(new Components()
                        .addSecuritySchemes(ADMIN_KEY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Admin-Key")));
    }
}
