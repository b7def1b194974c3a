package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.bucket.BucketAccessAdapter;
import org.iceforge.hlidskjalf.bucket.BucketFamily;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.springframework.stereotype.Component;

/** The CREODIAS DIAS bucket. Only reachable from inside CREODIAS. */
@Component
public class CreodiasProvider extends BucketBackedProvider {

    public CreodiasProvider(BucketAccessAdapter buckets, TileResolver tileResolver) {
        super(buckets, tileResolver, BucketFamily.CREODIAS_DIAS);
    }

    @Override
    public String name() {
        return ProviderNames.CREODIAS;
    }
}
