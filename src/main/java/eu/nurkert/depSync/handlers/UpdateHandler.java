package eu.nurkert.depSync.handlers;

import eu.nurkert.depSync.core.SyncSettings;
import eu.nurkert.depSync.fetcher.TagFetcher;
import eu.nurkert.depSync.fetcher.TagFetcherFactory;
import eu.nurkert.depSync.net.HttpClient;
import eu.nurkert.depSync.persistence.VersionsFileRepository;
import eu.nurkert.depSync.update.ChecksumUpdateStep;
import eu.nurkert.depSync.update.DependencyDescriptor;
import eu.nurkert.depSync.update.DependencyRegistry;
import eu.nurkert.depSync.update.FetchUpdateStep;
import eu.nurkert.depSync.update.UpdateContext;
import eu.nurkert.depSync.update.UpdateJob;
import eu.nurkert.depSync.update.UpdateProgressListener;
import eu.nurkert.depSync.update.UpdateResult;
import eu.nurkert.depSync.update.VersionComparator;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks every registered dependency against its upstream concurrently and, in write
 * mode, persists the discovered updates with a single rewrite of the versions file.
 */
public class UpdateHandler {

    private static final Logger LOGGER = Logger.getLogger(UpdateHandler.class.getName());

    private final DependencyRegistry registry;
    private final Function<DependencyDescriptor, TagFetcher> fetcherResolver;
    private final ChecksumVerifier checksumVerifier;
    private final VersionsFileRepository repository;
    private final VersionComparator versionComparator;
    private final Path versionsFile;
    private final int maxConcurrency;
    private volatile UpdateProgressListener progressListener = UpdateProgressListener.NONE;

    public UpdateHandler(DependencyRegistry registry,
                         Function<DependencyDescriptor, TagFetcher> fetcherResolver,
                         ChecksumVerifier checksumVerifier,
                         VersionsFileRepository repository,
                         Path versionsFile,
                         int maxConcurrency) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fetcherResolver = Objects.requireNonNull(fetcherResolver, "fetcherResolver");
        this.checksumVerifier = Objects.requireNonNull(checksumVerifier, "checksumVerifier");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.versionComparator = new VersionComparator();
        this.versionsFile = Objects.requireNonNull(versionsFile, "versionsFile");
        this.maxConcurrency = maxConcurrency;
    }

    public static UpdateHandler fromSettings(SyncSettings settings,
                                             DependencyRegistry registry,
                                             Path versionsFile,
                                             String githubToken) {
        TagFetcherFactory fetcherFactory = TagFetcherFactory.fromSettings(settings, githubToken);
        HttpClient downloadClient = HttpClient.builder()
                .userAgent(settings.userAgent())
                .accept("*/*")
                .connectTimeout(Duration.ofSeconds(settings.http().connectTimeoutSeconds()))
                .requestTimeout(Duration.ofSeconds(settings.http().downloadTimeoutSeconds()))
                .retryPolicy(settings.retryPolicy())
                .build();
        return new UpdateHandler(registry,
                dependency -> fetcherFactory.create(dependency.getFetchSource()),
                new ChecksumVerifier(downloadClient),
                new VersionsFileRepository(),
                versionsFile,
                settings.maxConcurrency());
    }

    public void setProgressListener(UpdateProgressListener progressListener) {
        this.progressListener = progressListener != null ? progressListener : UpdateProgressListener.NONE;
    }

    /**
     * Reads the versions file, checks every dependency and, when {@code writeMode} is set and
     * something changed, writes the new pins back.
     *
     * @throws IOException if the versions file is missing or cannot be read or written
     */
    public UpdateRunSummary run(boolean writeMode) throws IOException {
        Map<String, String> currentVersions = repository.parse(versionsFile);
        List<UpdateResult> results = checkForUpdates(currentVersions);

        boolean written = false;
        if (writeMode) {
            Map<String, String> updates = collectWritableUpdates(results);
            if (!updates.isEmpty()) {
                repository.write(versionsFile, updates);
                written = true;
            }
        }
        return new UpdateRunSummary(results, writeMode, written);
    }

    /**
     * Runs one job per dependency in parallel. Failures end up in the corresponding
     * {@link UpdateResult}; this method only returns once every job finished.
     *
     * @return results in registry order
     */
    public List<UpdateResult> checkForUpdates(Map<String, String> currentVersions) {
        if (registry.size() == 0) {
            return List.of();
        }
        List<DependencyDescriptor> dependencies = registry.getDependencies();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize(registry.size()), new WorkerThreadFactory());
        try {
            List<CompletableFuture<UpdateResult>> futures = new ArrayList<>(dependencies.size());
            for (DependencyDescriptor dependency : dependencies) {
                String current = currentVersions.get(dependency.getVersionKey());
                futures.add(CompletableFuture.supplyAsync(() -> check(dependency, current), executor));
            }
            List<UpdateResult> results = new ArrayList<>(futures.size());
            for (CompletableFuture<UpdateResult> future : futures) {
                results.add(future.join());
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private UpdateResult check(DependencyDescriptor dependency, String current) {
        UpdateProgressListener listener = progressListener;
        listener.onCheckStarted(dependency, currentOrUnknown(current));
        UpdateResult result = runJob(dependency, current);
        listener.onCheckCompleted(dependency, result);
        return result;
    }

    private UpdateResult runJob(DependencyDescriptor dependency, String current) {
        try {
            UpdateContext context = new UpdateContext(dependency, fetcherResolver.apply(dependency), current, LOGGER);
            createDefaultJob().run(context);
            return UpdateResult.fromContext(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UpdateResult.failed(dependency.getName(), currentOrUnknown(current), "Interrupted");
        } catch (Exception e) {
            String message = describe(e);
            LOGGER.log(Level.WARNING, "Failed to check {0}: {1}", new Object[]{dependency.getName(), message});
            LOGGER.log(Level.FINE, "Failure details for " + dependency.getName(), e);
            return UpdateResult.failed(dependency.getName(), currentOrUnknown(current), message);
        }
    }

    private UpdateJob createDefaultJob() {
        return new UpdateJob()
                .addStep(new FetchUpdateStep(versionComparator))
                .addStep(new ChecksumUpdateStep(checksumVerifier));
    }

    /**
     * Builds the key/value batch for the file rewrite. Dependencies whose checksum could not
     * be computed are held back so the pinned version never disagrees with its checksum.
     */
    Map<String, String> collectWritableUpdates(List<UpdateResult> results) {
        Map<String, String> updates = new LinkedHashMap<>();
        for (UpdateResult result : results) {
            if (!result.updated()) {
                continue;
            }
            if (result.hasChecksumError()) {
                LOGGER.log(Level.WARNING, "Not writing {0} {1}: {2}",
                        new Object[]{result.name(), result.latestVersion(), result.checksumError()});
                continue;
            }
            DependencyDescriptor dependency = registry.find(result.name()).orElse(null);
            if (dependency == null) {
                continue;
            }
            String latest = result.latestVersion();
            updates.put(dependency.getVersionKey(), latest);
            dependency.getSha256Key().ifPresent(key -> result.getSha256().ifPresent(sha -> updates.put(key, sha)));
            dependency.getUrlKey().ifPresent(key -> dependency.downloadUrl(latest).ifPresent(url -> updates.put(key, url)));
        }
        return updates;
    }

    private int poolSize(int dependencyCount) {
        return maxConcurrency > 0 ? Math.min(maxConcurrency, dependencyCount) : dependencyCount;
    }

    private static String currentOrUnknown(String current) {
        return current != null ? current : UpdateContext.UNKNOWN_VERSION;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "dependency-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
