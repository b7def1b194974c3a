package org.iceforge.hlidskjalf;

/**
 * Error taxonomy surfaced to callers and echoed by the CLI.
 */
public enum ErrorKind {
    INVALID_TILE_ID("InvalidTileID"),
    EMPTY_FOOTPRINT("EmptyFootprint"),
    INVALID_PRODUCT_ID("InvalidProductId"),
    UNKNOWN_PROVIDER("UnknownProvider"),
    NO_PROVIDER_AVAILABLE("NoProviderAvailable"),
    OBJECT_NOT_FOUND("ObjectNotFound"),
    INVALID_KEY_PATTERN("InvalidKeyPattern"),
    PROVIDER_UNAVAILABLE("ProviderUnavailable"),
    RETRIEVAL_EXHAUSTED("RetrievalExhausted"),
    RETRIEVAL_CANCELLED("RetrievalCancelled"),
    INVALID_OUTPUT_TARGET("InvalidOutputTarget"),
    UPLOAD_DENIED("UploadDenied"),
    PARTIAL_UPLOAD("PartialUpload");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
