package org.iceforge.hlidskjalf.upload;

/**
 * Production or development partition of the archives. Keys are laid out identically in both;
 * only the bucket differs.
 */
public enum ArchiveNamespace {
    PROD(""),
    DEV("-dev");

    private final String bucketSuffix;

    ArchiveNamespace(String bucketSuffix) {
        this.bucketSuffix = bucketSuffix;
    }

    public static ArchiveNamespace fromDevMode(boolean devMode) {
        return devMode ? DEV : PROD;
    }

    public String bucket(String baseBucket) {
        return baseBucket + bucketSuffix;
    }
}
