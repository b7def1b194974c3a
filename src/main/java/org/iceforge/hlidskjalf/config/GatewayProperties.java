package org.iceforge.hlidskjalf.config;

import org.iceforge.hlidskjalf.provider.DataKind;
import org.iceforge.hlidskjalf.provider.ProviderNames;
import org.iceforge.hlidskjalf.s3.spi.S3ProviderConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration, bound from {@code application.yml} and the environment.
 * <p>
 * Defaults match the public endpoints and bucket names of each provider.
 */
@ConfigurationProperties(prefix = "hlidskjalf")
public class GatewayProperties {

    /** Deployment context ("aws", "creodias"). Its provider goes first whenever it serves the kind. */
    private String cloudContext;

    /** Selects the "-dev" archive namespace for uploads and archive downloads. */
    private boolean devMode;

    /**
     * Upper bound on one provider attempt, counted from when the attempt starts running. Time spent
     * queued behind other retrievals does not count. A timed-out attempt counts as a provider failure.
     */
    private Duration attemptTimeout = Duration.ofMinutes(30);

    /** Threads available for provider attempts. Attempts of one request always run one at a time. */
    private int maxConcurrentRetrievals = 4;

    /** "s3" for real object stores, "local" for a filesystem store under {@link #localStoreDir}. */
    private String store = "s3";

    private String localStoreDir = "./local-store";

    /** Credential pairs merged over the process environment. */
    private Map<String, String> credentials = new HashMap<>();

    private Selection selection = new Selection();
    private Aws aws = new Aws();
    private Creodias creodias = new Creodias();
    private Ewoc ewoc = new Ewoc();
    private Esa esa = new Esa();
    private Search search = new Search();

    public boolean isLocalStore() {
        return "local".equalsIgnoreCase(store);
    }

    public static class Selection {
        private Map<DataKind, String> force = new EnumMap<>(DataKind.class);
        private Map<DataKind, String> preferred = defaultPreferences();
        private String demSource;

        private static Map<DataKind, String> defaultPreferences() {
            Map<DataKind, String> m = new EnumMap<>(DataKind.class);
            m.put(DataKind.SENTINEL1, ProviderNames.SEARCH);
            m.put(DataKind.SENTINEL2_L1C, ProviderNames.SEARCH);
            m.put(DataKind.SENTINEL2_L2A, ProviderNames.SEARCH);
            m.put(DataKind.LANDSAT8, ProviderNames.AWS);
            m.put(DataKind.DEM_COP_1S, ProviderNames.AWS);
            m.put(DataKind.DEM_COP_3S, ProviderNames.AWS);
            return m;
        }

        public Map<DataKind, String> getForce() { return force; }
        public void setForce(Map<DataKind, String> force) { this.force = force; }

        public Map<DataKind, String> getPreferred() { return preferred; }
        public void setPreferred(Map<DataKind, String> preferred) { this.preferred = preferred; }

        public String getDemSource() { return demSource; }
        public void setDemSource(String demSource) { this.demSource = demSource; }
    }

    public static class Aws {
        private S3ProviderConfig s3 = crossRegion(new S3ProviderConfig("eu-central-1", null, false));
        private boolean requesterPays = true;
        private String sentinel1Bucket = "sentinel-s1-l1c";
        private String sentinel2L1cBucket = "sentinel-s2-l1c";
        private String sentinel2L2aBucket = "sentinel-s2-l2a";
        private String sentinel2CogsBucket = "sentinel-cogs";
        private String landsatBucket = "usgs-landsat";
        private String copDem30Bucket = "copernicus-dem-30m";
        private String copDem90Bucket = "copernicus-dem-90m";

        public S3ProviderConfig getS3() { return s3; }
        public void setS3(S3ProviderConfig s3) { this.s3 = s3; }

        public boolean isRequesterPays() { return requesterPays; }
        public void setRequesterPays(boolean requesterPays) { this.requesterPays = requesterPays; }

        public String getSentinel1Bucket() { return sentinel1Bucket; }
        public void setSentinel1Bucket(String sentinel1Bucket) { this.sentinel1Bucket = sentinel1Bucket; }

        public String getSentinel2L1cBucket() { return sentinel2L1cBucket; }
        public void setSentinel2L1cBucket(String sentinel2L1cBucket) { this.sentinel2L1cBucket = sentinel2L1cBucket; }

        public String getSentinel2L2aBucket() { return sentinel2L2aBucket; }
        public void setSentinel2L2aBucket(String sentinel2L2aBucket) { this.sentinel2L2aBucket = sentinel2L2aBucket; }

        public String getSentinel2CogsBucket() { return sentinel2CogsBucket; }
        public void setSentinel2CogsBucket(String sentinel2CogsBucket) { this.sentinel2CogsBucket = sentinel2CogsBucket; }

        public String getLandsatBucket() { return landsatBucket; }
        public void setLandsatBucket(String landsatBucket) { this.landsatBucket = landsatBucket; }

        public String getCopDem30Bucket() { return copDem30Bucket; }
        public void setCopDem30Bucket(String copDem30Bucket) { this.copDem30Bucket = copDem30Bucket; }

        public String getCopDem90Bucket() { return copDem90Bucket; }
        public void setCopDem90Bucket(String copDem90Bucket) { this.copDem90Bucket = copDem90Bucket; }
    }

    public static class Creodias {
        private S3ProviderConfig s3 = new S3ProviderConfig(null, URI.create("http://data.cloudferro.com"), true);
        private String bucket = "DIAS";

        public S3ProviderConfig getS3() { return s3; }
        public void setS3(S3ProviderConfig s3) { this.s3 = s3; }

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }
    }

    public static class Ewoc {
        /** Used outside the CREODIAS context. */
        private S3ProviderConfig s3 = new S3ProviderConfig("eu-central-1", null, false);
        /** Endpoint of the EWoC buckets when running in the CREODIAS context. */
        private URI creodiasEndpoint = URI.create("https://s3.waw2-1.cloudferro.com");
        private String auxBucket = "ewoc-aux-data";
        private String srtm3sPrefix = "srtm90";
        private String ardBucket = "ewoc-ard";
        private String productBucket = "ewoc-prd";

        public S3ProviderConfig getS3() { return s3; }
        public void setS3(S3ProviderConfig s3) { this.s3 = s3; }

        public URI getCreodiasEndpoint() { return creodiasEndpoint; }
        public void setCreodiasEndpoint(URI creodiasEndpoint) { this.creodiasEndpoint = creodiasEndpoint; }

        public String getAuxBucket() { return auxBucket; }
        public void setAuxBucket(String auxBucket) { this.auxBucket = auxBucket; }

        public String getSrtm3sPrefix() { return srtm3sPrefix; }
        public void setSrtm3sPrefix(String srtm3sPrefix) { this.srtm3sPrefix = srtm3sPrefix; }

        public String getArdBucket() { return ardBucket; }
        public void setArdBucket(String ardBucket) { this.ardBucket = ardBucket; }

        public String getProductBucket() { return productBucket; }
        public void setProductBucket(String productBucket) { this.productBucket = productBucket; }
    }

    public static class Esa {
        private String baseUrl = "http://step.esa.int/auxdata/dem/SRTMGL1";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class Search {
        /** Base URL of a STAC API search endpoint. */
        private String url = "https://earth-search.aws.element84.com/v1";
        private int limit = 100;
        private Map<DataKind, String> collections = defaultCollections();
        private List<String> skipAssets = new ArrayList<>(List.of("thumbnail", "overview", "rendered_preview"));

        private static Map<DataKind, String> defaultCollections() {
            Map<DataKind, String> m = new EnumMap<>(DataKind.class);
            m.put(DataKind.SENTINEL1, "sentinel-1-grd");
            m.put(DataKind.SENTINEL2_L1C, "sentinel-2-l1c");
            m.put(DataKind.SENTINEL2_L2A, "sentinel-2-l2a");
            m.put(DataKind.LANDSAT8, "landsat-c2-l2");
            return m;
        }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }

        public Map<DataKind, String> getCollections() { return collections; }
        public void setCollections(Map<DataKind, String> collections) { this.collections = collections; }

        public List<String> getSkipAssets() { return skipAssets; }
        public void setSkipAssets(List<String> skipAssets) { this.skipAssets = skipAssets; }
    }

    public String getCloudContext() { return cloudContext; }
    public void setCloudContext(String cloudContext) { this.cloudContext = cloudContext; }

    public boolean isDevMode() { return devMode; }
    public void setDevMode(boolean devMode) { this.devMode = devMode; }

    public Duration getAttemptTimeout() { return attemptTimeout; }
    public void setAttemptTimeout(Duration attemptTimeout) { this.attemptTimeout = attemptTimeout; }

    public int getMaxConcurrentRetrievals() { return maxConcurrentRetrievals; }
    public void setMaxConcurrentRetrievals(int maxConcurrentRetrievals) { this.maxConcurrentRetrievals = maxConcurrentRetrievals; }

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public String getLocalStoreDir() { return localStoreDir; }
    public void setLocalStoreDir(String localStoreDir) { this.localStoreDir = localStoreDir; }

    public Map<String, String> getCredentials() { return credentials; }
    public void setCredentials(Map<String, String> credentials) { this.credentials = credentials; }

    public Selection getSelection() { return selection; }
    public void setSelection(Selection selection) { this.selection = selection; }

    public Aws getAws() { return aws; }
    public void setAws(Aws aws) { this.aws = aws; }

    public Creodias getCreodias() { return creodias; }
    public void setCreodias(Creodias creodias) { this.creodias = creodias; }

    public Ewoc getEwoc() { return ewoc; }
    public void setEwoc(Ewoc ewoc) { this.ewoc = ewoc; }

    public Esa getEsa() { return esa; }
    public void setEsa(Esa esa) { this.esa = esa; }

    public Search getSearch() { return search; }
    public void setSearch(Search search) { this.search = search; }

    private static S3ProviderConfig crossRegion(S3ProviderConfig cfg) {
        cfg.setCrossRegionAccess(true);
        return cfg;
    }
}
