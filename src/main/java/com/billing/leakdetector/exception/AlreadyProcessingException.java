package com.billing.leakdetector.exception;

/**
 * Raised when a job is requested for an upload that already has a queued or running job.
 */
public class AlreadyProcessingException extends RuntimeException {

    private final String uploadId;
    private final String activeJobId;

    public AlreadyProcessingException(String uploadId, String activeJobId) {
        super("Upload " + uploadId + " is already being processed by job " + activeJobId);
        this.uploadId = uploadId;
        this.activeJobId = activeJobId;
    }

    public String getUploadId() {
        return uploadId;
    }

    public String getActiveJobId() {
        return activeJobId;
    }
}
