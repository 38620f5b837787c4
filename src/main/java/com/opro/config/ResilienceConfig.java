package com.opro.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

    public static final String PROPOSER_RETRY = "proposer";
    public static final String GRADER_RETRY = "grader";

    @Bean
    public Retry proposerRetry(OproProperties properties) {
        return modelCallRetry(PROPOSER_RETRY, properties.getProposer());
    }

    @Bean
    public Retry graderRetry(OproProperties properties) {
        return modelCallRetry(GRADER_RETRY, properties.getGrader());
    }

    /**
     * Retry with a wait of {@code baseDelay * attempt^2} after each failed attempt.
     */
    public static Retry modelCallRetry(String name, OproProperties.RetryConfig settings) {
        long baseMillis = Math.max(1L, settings.getBaseDelay().toMillis());
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                .intervalFunction(attempt -> baseMillis * attempt * attempt)
                .retryExceptions(Exception.class)
                .build();
        return Retry.of(name, config);
    }
}
