package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.ErrorKind;

public class InvalidKeyPatternException extends ProviderException {
    public InvalidKeyPatternException(String message) {
        super(ErrorKind.INVALID_KEY_PATTERN, message);
    }

    public InvalidKeyPatternException(String message, Throwable cause) {
        super(ErrorKind.INVALID_KEY_PATTERN, message, cause);
    }
}
