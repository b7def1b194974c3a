package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.ErrorKind;

public class ObjectNotFoundException extends ProviderException {
    public ObjectNotFoundException(String message) {
        super(ErrorKind.OBJECT_NOT_FOUND, message);
    }

    public ObjectNotFoundException(String message, Throwable cause) {
        super(ErrorKind.OBJECT_NOT_FOUND, message, cause);
    }
}
