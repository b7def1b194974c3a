package org.iceforge.hlidskjalf.product;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class InvalidProductIdException extends GatewayException {
    public InvalidProductIdException(String message) {
        super(ErrorKind.INVALID_PRODUCT_ID, message);
    }

    public InvalidProductIdException(String message, Throwable cause) {
        super(ErrorKind.INVALID_PRODUCT_ID, message, cause);
    }
}
