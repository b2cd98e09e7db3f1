package com.flagship.statement_importer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Importer settings and the clock used for dates, timestamps and elapsed times.
 */
@Configuration
@Slf4j
public class ImporterConfig {

    @Bean
    public ImporterSettings importerSettings(
            @Value("${importer.application.name:statement-importer}") String applicationName,
            @Value("${importer.application.version:dev}") String applicationVersion,
            @Value("${importer.job-id:n/a}") String jobId,
            @Value("${importer.ledger.default-bank-code:}") String defaultBankCode,
            @Value("${importer.ledger.target-account-code:}") String targetAccountCode) {

        ImporterSettings settings = ImporterSettings.builder()
                .applicationName(applicationName)
                .applicationVersion(applicationVersion)
                .jobId(jobId.isBlank() ? "n/a" : jobId)
                .defaultBankCode(defaultBankCode)
                .targetAccountCode(targetAccountCode.isBlank() ? null : targetAccountCode)
                .build();

        log.debug("Importer settings: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
