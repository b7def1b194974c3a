package org.iceforge.hlidskjalf.upload;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class UploadDeniedException extends GatewayException {
    public UploadDeniedException(String message, Throwable cause) {
        super(ErrorKind.UPLOAD_DENIED, message, cause);
    }
}
