package org.iceforge.hlidskjalf.bucket;

import java.util.Locale;

public enum BucketFamily {
    /** Private EWoC buckets: auxiliary data and the ARD/product archives. */
    EWOC,
    /** AWS open-data buckets, several of them requester-pays. */
    AWS_PUBLIC,
    /** The CREODIAS "DIAS" bucket, reachable from inside CREODIAS. */
    CREODIAS_DIAS;

    public String tag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
