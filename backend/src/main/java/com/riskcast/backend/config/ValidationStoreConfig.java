package com.riskcast.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcast.backend.repository.ValidationRunRepository;
import com.riskcast.backend.service.validation.InMemoryValidationHistoryStore;
import com.riskcast.backend.service.validation.JpaValidationHistoryStore;
import com.riskcast.backend.service.validation.ValidationHistoryStore;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ValidationStoreConfig {

    @Bean
    public ValidationHistoryStore validationHistoryStore(ObjectProvider<ValidationRunRepository> repository,
                                                         ObjectMapper objectMapper,
                                                         Retry historyStoreRetry,
                                                         @Value("${riskcast.validation.in-memory-history-size:100}") int capacity) {
        ValidationRunRepository runRepository = repository.getIfAvailable();
        if (runRepository != null) {
            return new JpaValidationHistoryStore(runRepository, objectMapper, historyStoreRetry);
        }
        log.warn("No datasource configured; validation history is kept in memory (last {} runs)", capacity);
        return new InMemoryValidationHistoryStore(capacity);
    }
}
