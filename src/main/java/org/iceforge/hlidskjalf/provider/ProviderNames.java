package org.iceforge.hlidskjalf.provider;

public final class ProviderNames {
    private ProviderNames() {}

    public static final String EWOC = "ewoc";
    public static final String AWS = "aws";
    public static final String ESA = "esa";
    public static final String CREODIAS = "creodias";
    public static final String SEARCH = "search";
}
