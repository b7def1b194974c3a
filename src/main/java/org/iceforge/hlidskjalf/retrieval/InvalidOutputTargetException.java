package org.iceforge.hlidskjalf.retrieval;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class InvalidOutputTargetException extends GatewayException {
    public InvalidOutputTargetException(String message) {
        super(ErrorKind.INVALID_OUTPUT_TARGET, message);
    }

    public InvalidOutputTargetException(String message, Throwable cause) {
        super(ErrorKind.INVALID_OUTPUT_TARGET, message, cause);
    }
}
