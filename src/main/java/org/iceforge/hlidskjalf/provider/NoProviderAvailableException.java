package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class NoProviderAvailableException extends GatewayException {
    public NoProviderAvailableException(String message) {
        super(ErrorKind.NO_PROVIDER_AVAILABLE, message);
    }
}
