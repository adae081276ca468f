package com.platform.faultlab.error;

import java.nio.file.Path;

/**
 * Exception for report files that could not be written or read.
 */
public class ReportPersistenceException extends FaultLabException {

    public ReportPersistenceException(Path path, Throwable cause) {
        super(ErrorCode.REPORT_WRITE_FAILED,
            String.format("Failed to write report %s: %s", path, cause.getMessage()), cause);
    }
}
