package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.bucket.BucketAccessAdapter;
import org.iceforge.hlidskjalf.bucket.BucketFamily;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.springframework.stereotype.Component;

/** EWoC auxiliary bucket, serving the CGIAR SRTM 3s tiles. */
@Component
public class EwocProvider extends BucketBackedProvider {

    public EwocProvider(BucketAccessAdapter buckets, TileResolver tileResolver) {
        super(buckets, tileResolver, BucketFamily.EWOC);
    }

    @Override
    public String name() {
        return ProviderNames.EWOC;
    }
}
