package com.royal.kotracker.application.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Retries for reading hand history files that may still be written by the poker client
 */
@Configuration
public class ResiliencyConfig {
    
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }
    
    @Bean("fileReadRetry")
    public Retry fileReadRetry(RetryRegistry registry,
                               @Value("${app.input.read-attempts:3}") int maxAttempts,
                               @Value("${app.input.read-backoff-ms:200}") long backoffMillis) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(backoffMillis))
                .retryExceptions(IOException.class, UncheckedIOException.class)
                .build();
        
        return registry.retry("fileRead", config);
    }
}
