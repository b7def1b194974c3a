package org.iceforge.hlidskjalf.aws.s3;

public class S3ObjectNotFoundException extends S3AccessException {
    public S3ObjectNotFoundException(String message, Throwable cause) {
        super(message, 404, cause);
    }
}
