package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.bucket.BucketAccessAdapter;
import org.iceforge.hlidskjalf.bucket.BucketFamily;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.springframework.stereotype.Component;

/** AWS open-data buckets: Sentinel-1, Sentinel-2 (JP2 and L2A COGs), Landsat Collection 2 and the Copernicus DEM. */
@Component
public class AwsPublicProvider extends BucketBackedProvider {

    public AwsPublicProvider(BucketAccessAdapter buckets, TileResolver tileResolver) {
        super(buckets, tileResolver, BucketFamily.AWS_PUBLIC);
    }

    @Override
    public String name() {
        return ProviderNames.AWS;
    }
}
