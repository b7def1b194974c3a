package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class UnknownProviderException extends GatewayException {
    public UnknownProviderException(String message) {
        super(ErrorKind.UNKNOWN_PROVIDER, message);
    }
}
