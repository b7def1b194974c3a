package org.iceforge.hlidskjalf.tile;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

public class InvalidTileIdException extends GatewayException {
    public InvalidTileIdException(String message) {
        super(ErrorKind.INVALID_TILE_ID, message);
    }
}
