package com.flagship.statement_importer.importer;

/**
 * Overall status of an import, for one file or a whole batch.
 */
public enum ImportStatus {
    /**
     * Nothing failed. Skipped duplicates do not count as failures.
     */
    SUCCESS("success"),

    /**
     * Some parts failed, others went through.
     */
    WARNING("warning"),

    /**
     * Nothing went through and at least one failure was recorded,
     * or the input could not be processed at all.
     */
    ERROR("error");

    private final String reportName;

    ImportStatus(String reportName) {
        this.reportName = reportName;
    }

    public String getReportName() {
        return reportName;
    }

    /**
     * Status of a single file from its transaction counts.
     */
    public static ImportStatus classify(int importedCount, int errorCount) {
        if (errorCount > 0 && importedCount == 0) {
            return ERROR;
        }
        if (errorCount > 0) {
            return WARNING;
        }
        return SUCCESS;
    }

    /**
     * Status of a batch from its file counts. A batch without files is an error.
     */
    public static ImportStatus classifyBatch(int totalFiles, int failedFiles) {
        if (failedFiles == totalFiles) {
            return ERROR;
        }
        if (failedFiles > 0) {
            return WARNING;
        }
        return SUCCESS;
    }
}
