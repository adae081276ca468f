package com.platform.faultlab.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends FaultLabException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException report(String reportId) {
        return new ResourceNotFoundException(ErrorCode.REPORT_NOT_FOUND, "Report", reportId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
