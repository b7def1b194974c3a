package org.iceforge.hlidskjalf.tile;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class EmptyFootprintException extends GatewayException {
    public EmptyFootprintException(String message) {
        super(ErrorKind.EMPTY_FOOTPRINT, message);
    }
}
