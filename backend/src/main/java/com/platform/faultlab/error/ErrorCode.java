package com.platform.faultlab.error;

/**
 * Standardized error codes for the fault lab.
 * Each error has a unique code that clients can use to take specific actions.
 *
 * Format: FL-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 3xx: Resource errors (not found, busy)
 * - 4xx: System errors (orchestrator, report files)
 * - 5xx: Scenario errors (resolution, injection, restoration)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("FL-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("FL-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("FL-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("FL-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    UNKNOWN_FAILURE_TYPE("FL-105", "Unknown failure type", ErrorCategory.RECOVERABLE),

    // ==================== Resource Errors (3xx) ====================

    REPORT_NOT_FOUND("FL-301", "Report not found", ErrorCategory.RECOVERABLE),
    NODE_BUSY("FL-310", "Node is already part of a running scenario", ErrorCategory.RECOVERABLE),

    // ==================== System Errors (4xx) ====================

    ORCHESTRATOR_ERROR("FL-401", "Orchestrator request failed", ErrorCategory.RECOVERABLE),
    REPORT_WRITE_FAILED("FL-420", "Report could not be written", ErrorCategory.RECOVERABLE),

    // ==================== Scenario Errors (5xx - Domain) ====================

    TARGET_UNRESOLVED("FL-500", "Target node could not be resolved", ErrorCategory.FATAL),
    NETWORK_UNRESOLVED("FL-501", "Network resolution failed", ErrorCategory.FATAL),
    INJECTION_FAILED("FL-510", "Fault injection failed", ErrorCategory.FATAL),
    PARTITION_VERIFICATION_FAILED("FL-511", "Partition verification failed", ErrorCategory.FATAL),
    RESTORATION_FAILED("FL-520", "Restoration failed", ErrorCategory.RECOVERABLE),
    RECOVERY_TIMEOUT("FL-530", "Recovery not observed within ceiling", ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    INTERNAL_ERROR("FL-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("FL-901", "Unexpected error occurred", ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,

        /**
         * Fatal errors - the scenario cannot continue.
         */
        FATAL
    }
}
