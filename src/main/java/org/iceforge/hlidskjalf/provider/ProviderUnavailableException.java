package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.ErrorKind;

public class ProviderUnavailableException extends ProviderException {
    public ProviderUnavailableException(String message) {
        super(ErrorKind.PROVIDER_UNAVAILABLE, message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(ErrorKind.PROVIDER_UNAVAILABLE, message, cause);
    }
}
