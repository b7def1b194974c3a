package org.iceforge.hlidskjalf.bucket;

import org.iceforge.hlidskjalf.aws.s3.S3AccessLayer;

import java.util.EnumMap;
import java.util.Map;

/** The storage access layer serving each bucket family. */
public final class BucketClients {
    private final Map<BucketFamily, S3AccessLayer> layers;

    public BucketClients(Map<BucketFamily, S3AccessLayer> layers) {
        this.layers = new EnumMap<>(layers);
    }

    /** Same layer for every family; the local store uses this. */
    public static BucketClients shared(S3AccessLayer layer) {
        Map<BucketFamily, S3AccessLayer> m = new EnumMap<>(BucketFamily.class);
        for (BucketFamily f : BucketFamily.values()) m.put(f, layer);
        return new BucketClients(m);
    }

    public S3AccessLayer layer(BucketFamily family) {
        S3AccessLayer l = layers.get(family);
        if (l == null) throw new IllegalStateException("No storage client configured for " + family);
        return l;
    }
}
