package org.iceforge.hlidskjalf.upload;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

import java.util.List;

/**
 * A multi-file upload stopped after some files were stored. Retrying the same upload is safe:
 * files already stored with identical content are skipped.
 */
public class PartialUploadException extends GatewayException {
    private final List<String> uploadedKeys;
    private final String failedKey;

    public PartialUploadException(List<String> uploadedKeys, String failedKey, Throwable cause) {
        super(ErrorKind.PARTIAL_UPLOAD, "Upload stopped at " + failedKey + " after " + uploadedKeys.size()
                + " file(s): " + cause.getMessage(), cause);
        this.uploadedKeys = List.copyOf(uploadedKeys);
        this.failedKey = failedKey;
    }

    public List<String> uploadedKeys() {
        return uploadedKeys;
    }

    public String failedKey() {
        return failedKey;
    }
}
