package com.billing.leakdetector.exception;

/**
 * A row of an upload was written twice.
 */
public class DuplicateRowException extends RuntimeException {

    private final String uploadId;
    private final int rowIndex;

    public DuplicateRowException(String uploadId, int rowIndex) {
        super("Row " + rowIndex + " of upload " + uploadId + " has already been scored");
        this.uploadId = uploadId;
        this.rowIndex = rowIndex;
    }

    public String getUploadId() {
        return uploadId;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
