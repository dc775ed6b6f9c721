package com.clapgrow.content.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = {
    WebFluxAutoConfiguration.class  // WebClient only, no reactive server
})
@EnableScheduling
public class ContentAutomationApplication {
    public static void main(String[] args) {
        SpringApplication.run(ContentAutomationApplication.class, args);
    }
}
