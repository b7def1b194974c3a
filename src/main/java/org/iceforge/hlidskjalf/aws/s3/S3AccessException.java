package org.iceforge.hlidskjalf.aws.s3;

/**
 * Storage-level failure. {@code statusCode} is the HTTP status reported by the store, or 0 when unknown.
 */
public class S3AccessException extends RuntimeException {
    private final int statusCode;

    public S3AccessException(String message, Throwable cause) { this(message, 0, cause); }
    public S3AccessException(String message) { this(message, 0, null); }

    public S3AccessException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() { return statusCode; }

    public boolean isAccessDenied() { return statusCode == 401 || statusCode == 403; }
}
