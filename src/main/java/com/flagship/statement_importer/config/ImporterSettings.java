package com.flagship.statement_importer.config;

import lombok.Builder;
import lombok.Value;

/**
 * Resolved importer configuration.
 *
 * targetAccountCode is null when no ledger bank account is configured.
 */
@Value
@Builder
public class ImporterSettings {
    String applicationName;
    String applicationVersion;
    @Builder.Default
    String jobId = "n/a";
    @Builder.Default
    String defaultBankCode = "";
    String targetAccountCode;
}
