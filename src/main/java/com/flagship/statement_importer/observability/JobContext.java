package com.flagship.statement_importer.observability;

import org.slf4j.MDC;

/**
 * MDC keys for import logging.
 *
 * The job id is set once per invocation, the statement file while a file is
 * being imported. Both show up in the console log pattern.
 */
public final class JobContext {

    public static final String JOB_ID_MDC_KEY = "jobId";
    public static final String STATEMENT_FILE_MDC_KEY = "statementFile";

    private JobContext() {
        // Utility class
    }

    public static void setJobId(String jobId) {
        MDC.put(JOB_ID_MDC_KEY, jobId == null || jobId.isBlank() ? "n/a" : jobId);
    }

    public static void setStatementFile(String file) {
        MDC.put(STATEMENT_FILE_MDC_KEY, file);
    }

    public static void clearStatementFile() {
        MDC.remove(STATEMENT_FILE_MDC_KEY);
    }

    /**
     * Clears everything this class put in the MDC.
     */
    public static void clear() {
        MDC.remove(JOB_ID_MDC_KEY);
        MDC.remove(STATEMENT_FILE_MDC_KEY);
    }
}
