package io.contextrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ContextRunr: session and long-term memory engine for AI agents, powered by Spring Boot and JobRunr.
 * Keeps a token-budgeted session log per conversation and a scored, consolidated memory store per user.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextRunrApplication.class, args);
    }
}
