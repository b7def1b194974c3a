package org.iceforge.hlidskjalf.upload;

import org.iceforge.hlidskjalf.config.GatewayProperties;

import java.util.Locale;

public enum Archive {
    /** Analysis-ready data produced by the pre-processing chain. */
    ARD,
    /** Final products. */
    PRD;

    public String baseBucket(GatewayProperties.Ewoc ewoc) {
        return this == ARD ? ewoc.getArdBucket() : ewoc.getProductBucket();
    }

    public static Archive parse(String value) {
        try {
            return Archive.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown archive '" + value + "', expected ard or prd");
        }
    }
}
