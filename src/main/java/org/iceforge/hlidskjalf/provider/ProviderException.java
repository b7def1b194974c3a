package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

/**
 * Failure local to one provider attempt. The orchestrator records it and moves on to the next candidate.
 */
public abstract class ProviderException extends GatewayException {
    protected ProviderException(ErrorKind kind, String message) {
        super(kind, message);
    }

    protected ProviderException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
