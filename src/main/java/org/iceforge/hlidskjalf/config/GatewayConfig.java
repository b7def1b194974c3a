package org.iceforge.hlidskjalf.config;

import org.iceforge.hlidskjalf.aws.s3.AwsSdkS3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.LocalFsS3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.S3AccessLayer;
import org.iceforge.hlidskjalf.bucket.BucketClients;
import org.iceforge.hlidskjalf.bucket.BucketFamily;
import org.iceforge.hlidskjalf.provider.CredentialSet;
import org.iceforge.hlidskjalf.provider.EoProvider;
import org.iceforge.hlidskjalf.provider.ProviderCapabilityRegistry;
import org.iceforge.hlidskjalf.provider.ProviderNames;
import org.iceforge.hlidskjalf.provider.SelectionConfig;
import org.iceforge.hlidskjalf.provider.SourceSelector;
import org.iceforge.hlidskjalf.retrieval.RetrievalOrchestrator;
import org.iceforge.hlidskjalf.s3.spi.S3ClientFactory;
import org.iceforge.hlidskjalf.s3.spi.S3ClientProvider;
import org.iceforge.hlidskjalf.s3.spi.S3ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public CredentialSet credentialSet(GatewayProperties props) {
        CredentialSet credentials = CredentialSet.fromEnvironment(System.getenv(), props.getCredentials());
        log.info("Credentials available: {}", credentials);
        return credentials;
    }

    @Bean
    public SelectionConfig selectionConfig(GatewayProperties props, CredentialSet credentials) {
        GatewayProperties.Selection s = props.getSelection();
        return new SelectionConfig(
                Optional.ofNullable(props.getCloudContext()),
                s.getForce(),
                s.getPreferred(),
                Optional.ofNullable(s.getDemSource()),
                credentials);
    }

    /** Fails startup with UnknownProvider when the configuration names a provider that does not exist. */
    @Bean
    public ProviderCapabilityRegistry providerCapabilityRegistry(SelectionConfig selectionConfig) {
        ProviderCapabilityRegistry registry = ProviderCapabilityRegistry.standard();
        registry.requireKnown(selectionConfig.referencedProviders());
        return registry;
    }

    @Bean
    public ExecutorService retrievalExecutor(GatewayProperties props) {
        int threads = Math.max(1, props.getMaxConcurrentRetrievals());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "hlidskjalf-retrieval");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public RetrievalOrchestrator retrievalOrchestrator(SourceSelector selector,
                                                       SelectionConfig selectionConfig,
                                                       List<EoProvider> providers,
                                                       ExecutorService retrievalExecutor,
                                                       GatewayProperties props) {
        return new RetrievalOrchestrator(selector, selectionConfig, providers, retrievalExecutor,
                props.getAttemptTimeout());
    }

    @Bean
    public S3ClientFactory s3ClientFactory(ObjectProvider<S3ClientProvider> springProviders) {
        return new S3ClientFactory(springProviders.orderedStream().toList());
    }

    @Bean
    public BucketClients bucketClients(GatewayProperties props, S3ClientFactory factory, CredentialSet credentials) {
        if (props.isLocalStore()) {
            return BucketClients.shared(new LocalFsS3AccessLayer(Path.of(props.getLocalStoreDir())));
        }
        Map<BucketFamily, S3AccessLayer> layers = new EnumMap<>(BucketFamily.class);

        layers.put(BucketFamily.AWS_PUBLIC, new AwsSdkS3AccessLayer(
                factory.clientFor(BucketFamily.AWS_PUBLIC.tag(), props.getAws().getS3(),
                        staticCredentials(credentials, CredentialSet.AWS_ACCESS_KEY_ID, CredentialSet.AWS_SECRET_ACCESS_KEY)).s3(),
                props.getAws().isRequesterPays()));

        layers.put(BucketFamily.CREODIAS_DIAS, new AwsSdkS3AccessLayer(
                factory.clientFor(BucketFamily.CREODIAS_DIAS.tag(), props.getCreodias().getS3(), Optional.empty()).s3(),
                false));

        layers.put(BucketFamily.EWOC, new AwsSdkS3AccessLayer(
                factory.clientFor(BucketFamily.EWOC.tag(), ewocClientConfig(props),
                        staticCredentials(credentials, CredentialSet.EWOC_ACCESS_KEY_ID, CredentialSet.EWOC_SECRET_ACCESS_KEY)).s3(),
                false));
        return new BucketClients(layers);
    }

    /** In the CREODIAS context the EWoC buckets are served from the CloudFerro endpoint. */
    static S3ProviderConfig ewocClientConfig(GatewayProperties props) {
        S3ProviderConfig base = props.getEwoc().getS3();
        if (!ProviderNames.CREODIAS.equalsIgnoreCase(props.getCloudContext())) {
            return base;
        }
        S3ProviderConfig cfg = new S3ProviderConfig(base.getRegion(), props.getEwoc().getCreodiasEndpoint(), true);
        cfg.setProvider(base.getProvider());
        cfg.setApiTimeout(base.getApiTimeout());
        cfg.setTags(base.getTags());
        return cfg;
    }

    private static Optional<AwsCredentialsProvider> staticCredentials(CredentialSet credentials, String idKey, String secretKey) {
        Optional<String> id = credentials.get(idKey);
        Optional<String> secret = credentials.get(secretKey);
        if (id.isEmpty() || secret.isEmpty()) return Optional.empty();
        return Optional.of(StaticCredentialsProvider.create(AwsBasicCredentials.create(id.get(), secret.get())));
    }
}
