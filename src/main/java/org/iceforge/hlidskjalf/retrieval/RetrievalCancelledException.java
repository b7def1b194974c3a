package org.iceforge.hlidskjalf.retrieval;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class RetrievalCancelledException extends GatewayException {
    public RetrievalCancelledException(String message) {
        super(ErrorKind.RETRIEVAL_CANCELLED, message);
    }

    public RetrievalCancelledException(String message, Throwable cause) {
        super(ErrorKind.RETRIEVAL_CANCELLED, message, cause);
    }
}
