package org.iceforge.hlidskjalf.s3.spi;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Client settings for one bucket family, bound under {@code hlidskjalf.<family>.s3}.
 */
public class S3ProviderConfig {
    /**
     * Optional explicit client provider id. If set, only that provider is used (or startup fails).
     * Example: "cloudferro"
     */
    private String provider;

    private String region;
    private URI endpointOverride;
    private boolean pathStyleAccess;
    private Duration apiTimeout;

    /** Follow redirects to the bucket's own region. AWS endpoints only. */
    private boolean crossRegionAccess;

    /** Arbitrary selector tags passed to providers. */
    private Map<String, String> tags = new HashMap<>();

    public S3ProviderConfig() {}

    public S3ProviderConfig(String region, URI endpointOverride, boolean pathStyleAccess) {
        this.region = region;
        this.endpointOverride = endpointOverride;
        this.pathStyleAccess = pathStyleAccess;
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public URI getEndpointOverride() { return endpointOverride; }
    public void setEndpointOverride(URI endpointOverride) { this.endpointOverride = endpointOverride; }

    public boolean isPathStyleAccess() { return pathStyleAccess; }
    public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }

    public Duration getApiTimeout() { return apiTimeout; }
    public void setApiTimeout(Duration apiTimeout) { this.apiTimeout = apiTimeout; }

    public boolean isCrossRegionAccess() { return crossRegionAccess; }
    public void setCrossRegionAccess(boolean crossRegionAccess) { this.crossRegionAccess = crossRegionAccess; }

    public Map<String, String> getTags() { return tags; }
    public void setTags(Map<String, String> tags) { this.tags = tags; }
}
