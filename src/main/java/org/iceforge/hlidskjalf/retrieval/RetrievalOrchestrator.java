package org.iceforge.hlidskjalf.retrieval;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;
import org.iceforge.hlidskjalf.aws.s3.Checksums;
import org.iceforge.hlidskjalf.product.InvalidProductIdException;
import org.iceforge.hlidskjalf.product.ProductIds;
import org.iceforge.hlidskjalf.provider.DataKind;
import org.iceforge.hlidskjalf.provider.EoProvider;
import org.iceforge.hlidskjalf.provider.ProviderDescriptor;
import org.iceforge.hlidskjalf.provider.ProviderException;
import org.iceforge.hlidskjalf.provider.ProviderUnavailableException;
import org.iceforge.hlidskjalf.provider.SelectionConfig;
import org.iceforge.hlidskjalf.provider.SourceSelector;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.MaterializedProduct;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.ProductLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.ProviderFailure;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.TileLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Drives the candidate providers of a request one after the other until one succeeds.
 * <p>
 * Each attempt writes into a private staging directory under the output directory and is bounded
 * by the attempt timeout. A failed or timed-out attempt is recorded and, once it has stopped, the
 * next candidate is tried; the same provider is never retried. The first success is renamed to its canonical
 * name and returned.
 */
public class RetrievalOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    private static final String STAGING_PREFIX = ".staging-";

    @FunctionalInterface
    interface Attempt {
        List<Path> run(EoProvider provider, Path targetDir);
    }

    private final SourceSelector selector;
    private final SelectionConfig selectionConfig;
    private final Map<String, EoProvider> providers;
    private final ExecutorService executor;
    private final Duration attemptTimeout;

    public RetrievalOrchestrator(SourceSelector selector,
                                 SelectionConfig selectionConfig,
                                 List<EoProvider> providers,
                                 ExecutorService executor,
                                 Duration attemptTimeout) {
        this.selector = selector;
        this.selectionConfig = selectionConfig;
        Map<String, EoProvider> byName = new LinkedHashMap<>();
        for (EoProvider p : providers) byName.put(p.name(), p);
        this.providers = Map.copyOf(byName);
        this.executor = executor;
        this.attemptTimeout = attemptTimeout;
    }

    public MaterializedProduct retrieve(DataRequest request) {
        Path outDir = requireWritableOutput(request.outputDirectory());
        validateLocator(request);
        List<ProviderDescriptor> candidates = selector.selectCandidates(request, selectionConfig);
        log.info("Retrieving {} ({}) from candidates {}", request.canonicalName(), request.dataKind(),
                candidates.stream().map(ProviderDescriptor::name).toList());
        return runCandidates(candidates, outDir, request.canonicalName(), (p, dir) -> p.fetch(request, dir));
    }

    /** Retrieval by product ID. {@code provider} may be null to let the selector choose. */
    public MaterializedProduct retrieveById(String productId, String provider, Path outDir) {
        return retrieveById(productId, provider, outDir, RetrievalOptions.DEFAULTS);
    }

    public MaterializedProduct retrieveById(String productId, String provider, Path outDir, RetrievalOptions options) {
        Path out = requireWritableOutput(outDir);
        DataKind kind = ProductIds.detectKind(productId);
        DataRequest request = new DataRequest(kind, new ProductLocator(productId), out,
                Optional.ofNullable(provider), options);
        List<ProviderDescriptor> candidates = selector.selectCandidates(request, selectionConfig);
        log.info("Retrieving product {} from candidates {}", productId,
                candidates.stream().map(ProviderDescriptor::name).toList());
        return runCandidates(candidates, out, request.canonicalName(),
                (p, dir) -> p.fetchById(productId, kind, options, dir));
    }

    private MaterializedProduct runCandidates(List<ProviderDescriptor> candidates, Path outDir, String canonicalName,
                                              Attempt attempt) {
        List<ProviderFailure> failures = new ArrayList<>();
        for (ProviderDescriptor candidate : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RetrievalCancelledException("Retrieval of " + canonicalName + " cancelled before trying "
                        + candidate.name());
            }
            EoProvider provider = providers.get(candidate.name());
            if (provider == null) {
                log.warn("No retrieval implementation registered for provider {}", candidate.name());
                failures.add(new ProviderFailure(candidate.name(), ErrorKind.PROVIDER_UNAVAILABLE,
                        "no retrieval implementation registered"));
                continue;
            }

            Path staging = null;
            try {
                staging = Files.createTempDirectory(outDir, STAGING_PREFIX);
                Path content = Files.createDirectory(staging.resolve(canonicalName));
                runBounded(provider, attempt, content, canonicalName);
                MaterializedProduct result = publish(content, outDir.resolve(canonicalName), candidate.name());
                log.info("Retrieved {} from {}: {} bytes at {}", canonicalName, candidate.name(),
                        result.byteSize(), result.localPath());
                return result;
            } catch (ProviderException e) {
                log.warn("Provider {} failed for {}: {} ({})", candidate.name(), canonicalName,
                        e.kind().label(), e.getMessage());
                failures.add(new ProviderFailure(candidate.name(), e.kind(), e.getMessage()));
            } catch (GatewayException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Provider {} failed unexpectedly for {}", candidate.name(), canonicalName, e);
                failures.add(new ProviderFailure(candidate.name(), ErrorKind.PROVIDER_UNAVAILABLE, e.toString()));
            } catch (IOException e) {
                throw new InvalidOutputTargetException("Cannot write under " + outDir + ": " + e.getMessage(), e);
            } finally {
                if (staging != null) deleteTree(staging);
            }
        }
        throw new RetrievalExhaustedException("No provider could serve " + canonicalName, failures);
    }

    /**
     * Runs one attempt on the executor. The timeout counts from the moment the attempt starts
     * running, not from submission. An attempt that times out or is cancelled is interrupted and
     * waited for, so the next candidate never overlaps with it.
     */
    private void runBounded(EoProvider provider, Attempt attempt, Path content, String canonicalName) {
        AtomicBoolean claimed = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        Future<List<Path>> future = executor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) return List.<Path>of();
            started.countDown();
            try {
                return attempt.run(provider, content);
            } finally {
                finished.countDown();
            }
        });
        try {
            started.await();
            if (attemptTimeout == null || attemptTimeout.isZero() || attemptTimeout.isNegative()) {
                future.get();
            } else {
                future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            stopAndWait(future, claimed, finished, provider.name());
            throw new ProviderUnavailableException("attempt timed out after " + attemptTimeout, e);
        } catch (InterruptedException e) {
            stopAndWait(future, claimed, finished, provider.name());
            Thread.currentThread().interrupt();
            throw new RetrievalCancelledException("Retrieval of " + canonicalName + " cancelled while "
                    + provider.name() + " was fetching", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new ProviderUnavailableException(String.valueOf(cause), cause);
        }
    }

    private static void stopAndWait(Future<?> future, AtomicBoolean claimed, CountDownLatch finished, String provider) {
        if (claimed.compareAndSet(false, true)) {
            // never started, and now never will
            future.cancel(false);
            return;
        }
        future.cancel(true);
        if (finished.getCount() > 0) {
            log.warn("Waiting for the abandoned {} attempt to stop", provider);
        }
        boolean interrupted = false;
        while (true) {
            try {
                finished.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    /**
     * Moves the staged content to {@code finalPath}. A previous result at that path is set aside
     * first and restored if the move fails.
     */
    private static MaterializedProduct publish(Path content, Path finalPath, String provider) throws IOException {
        Path previous = null;
        if (Files.exists(finalPath)) {
            log.info("Replacing existing {}", finalPath);
            previous = content.resolveSibling(".previous-" + finalPath.getFileName());
            Files.move(finalPath, previous, StandardCopyOption.ATOMIC_MOVE);
        }
        try {
            Files.move(content, finalPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (previous != null) Files.move(previous, finalPath, StandardCopyOption.ATOMIC_MOVE);
            throw e;
        }
        if (previous != null) deleteTree(previous);

        List<Path> files;
        try (Stream<Path> walk = Files.walk(finalPath)) {
            files = walk.filter(Files::isRegularFile).toList();
        }
        long size = 0;
        for (Path f : files) size += Files.size(f);
        Optional<String> checksum = files.size() == 1
                ? Optional.of(Checksums.sha256Hex(files.get(0)))
                : Optional.empty();
        return new MaterializedProduct(finalPath, provider, size, Instant.now(), checksum);
    }

    static Path requireWritableOutput(Path outDir) {
        if (outDir == null || outDir.toString().isBlank()) {
            throw new InvalidOutputTargetException("Output directory is required");
        }
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new InvalidOutputTargetException("Cannot create output directory " + outDir, e);
        }
        if (!Files.isDirectory(outDir)) {
            throw new InvalidOutputTargetException("Output target is not a directory: " + outDir);
        }
        if (!Files.isWritable(outDir)) {
            throw new InvalidOutputTargetException("Output directory is not writable: " + outDir);
        }
        return outDir;
    }

    private static void validateLocator(DataRequest request) {
        DataKind kind = request.dataKind();
        if (request.locator() instanceof ProductLocator p) {
            DataKind actual = ProductIds.detectKind(p.productId());
            if (actual != kind) {
                throw new InvalidProductIdException(p.productId() + " is a " + actual + " product, not " + kind);
            }
        } else if (request.locator() instanceof TileLocator && !kind.isDem()) {
            throw new IllegalArgumentException(kind + " retrieval by tile needs a date range");
        }
    }

    private static void deleteTree(Path root) {
        if (!Files.exists(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Could not fully remove {}", root, e);
        }
    }
}
