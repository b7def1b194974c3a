package org.iceforge.hlidskjalf.s3.spi;

import software.amazon.awssdk.services.s3.S3Client;

/**
 * Pluggable source of S3 clients, so the gateway never knows how endpoints, credentials or proxies
 * are set up for a given bucket family. It just asks for a client configured for a context.
 * <br>
 * Implementations are discovered through {@link java.util.ServiceLoader}
 * ({@code META-INF/services/org.iceforge.hlidskjalf.s3.spi.S3ClientProvider}) and as Spring beans.
 */
public interface S3ClientProvider {

    /** A stable ID for logging/diagnostics (e.g., "default", "cloudferro"). */
    String id();

    /** Return true if this provider should be used for the given context. */
    boolean supports(S3ClientContext context);

    /** Create or return an S3Client. Provider owns its caching/lifecycle strategy. */
    S3Client s3Client(S3ClientContext context);
}
