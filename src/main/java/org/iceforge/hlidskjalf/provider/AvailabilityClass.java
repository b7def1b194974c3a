package org.iceforge.hlidskjalf.provider;

/**
 * Static availability note attached to a provider. Informational only, never probed at runtime.
 */
public enum AvailabilityClass {
    ALWAYS_ON,
    /** Reachable only from inside a given cloud region (e.g. the DIAS network). */
    REGION_RESTRICTED,
    /** Keeps a sliding window of recent acquisitions. */
    ROLLING_ARCHIVE
}
