package org.iceforge.hlidskjalf;

/**
 * Base of every error the gateway reports to its callers.
 */
public class GatewayException extends RuntimeException {
    private final ErrorKind kind;

    public GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
