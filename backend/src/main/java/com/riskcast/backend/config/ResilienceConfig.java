package com.riskcast.backend.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public Retry historyStoreRetry(
            @Value("${riskcast.persistence.retry.max-attempts:3}") int maxAttempts,
            @Value("${riskcast.persistence.retry.base-delay-ms:200}") long baseDelayMs,
            @Value("${riskcast.persistence.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(TransientDataAccessException.class, RecoverableDataAccessException.class,
                        DataAccessResourceFailureException.class)
                .build();
        return Retry.of("validation-history", config);
    }
}
