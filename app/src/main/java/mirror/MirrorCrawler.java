package mirror;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static mirror.MirrorLogger.LOGGER;

// Drives one mirror run. A single coordinator thread pops targets from the Frontier and hands them
// to a fixed pool of maxConcurrency workers. Each worker fetches its target, pushes the links it finds
// back into the frontier and persists the rewritten bytes; the coordinator then completes the URL.
// The crawl is over when the frontier is empty and nothing is in flight.
public class MirrorCrawler {

    private static final long POLL_MILLIS = 100;
    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final MirrorConfig config;
    private final HttpTransport transport;
    private final CrawlTarget root;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile CrawlPhase phase = CrawlPhase.IDLE;
    private volatile boolean stopRequested = false;

    // Per-run collaborators, set when run() starts.
    private CrawlState state;
    private PageFetcher fetcher;
    private LinkExtractor extractor;
    private MirrorStore store;

    public MirrorCrawler(MirrorConfig config, HttpTransport transport) throws ConfigException {
        this.config = config;
        this.transport = transport;
        try {
            this.root = new CrawlTarget(UrlNormalizer.normalize(config.rootUrl()),
                    UrlNormalizer.resolve(null, config.rootUrl()));
        } catch (MalformedUrlException e) {
            throw new ConfigException("Invalid root URL '" + e.getReference() + "': " + e.getMessage(), e);
        }
    }

    public CrawlPhase phase() {
        return phase;
    }

    // Ask a running crawl to stop. Pages already written stay valid.
    public void stop() {
        stopRequested = true;
    }

    // Wait for run() to finish, e.g. from a shutdown hook after stop().
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // Runs the crawl to completion (or until stopped). ConfigException means nothing was fetched.
    public CrawlReport run() throws ConfigException {
        if (phase != CrawlPhase.IDLE) throw new IllegalStateException("A MirrorCrawler runs only once");
        try {
            prepareOutputDirectory(config.outputDir());

            this.state = new CrawlState(root, config.maxPages());
            LocalPathMapper mapper = new LocalPathMapper(config.outputDir());
            Frontier frontier = state.frontier();
            this.store = new MirrorStore(mapper, new LinkRewriter(mapper, frontier::isAttempted, frontier::aliasOf));
            this.extractor = new LinkExtractor(root.url(), config.scope(), config.mirrorAssets());
            this.fetcher = new PageFetcher(transport, config, root.url(), frontier::claimRedirect);

            boolean cancelled = crawl();

            CrawlReport report = state.report(cancelled);
            new ReportWriter(config.outputDir()).writeFailuresFile(report);
            LOGGER.info("Mirror of {} finished: {} fetched, {} failed, {} skipped",
                    root.url(), report.fetched(), report.failed(), report.skipped());
            return report;
        } finally {
            phase = CrawlPhase.DONE;
            finished.countDown();
        }
    }

    // Returns true if the crawl was stopped before the frontier drained.
    private boolean crawl() {
        Frontier frontier = state.frontier();
        ExecutorService pool = Executors.newFixedThreadPool(config.maxConcurrency());
        ExecutorCompletionService<PageOutcome> completion = new ExecutorCompletionService<>(pool);
        Map<Future<PageOutcome>, CrawlTarget> dispatched = new HashMap<>();
        Instant deadline = config.hasCrawlTimeout() ? Instant.now().plus(config.crawlTimeout()) : null;
        boolean cancelled = false;

        phase = CrawlPhase.RUNNING;
        LOGGER.info("Mirroring {} into {} ({} workers, scope {})",
                root.url(), config.outputDir(), config.maxConcurrency(), config.scope().cliName());

        try {
            while (true) {
                if (stopRequested) {
                    LOGGER.warn("Stop requested, abandoning the crawl");
                    cancelled = true;
                    break;
                }
                if (deadline != null && Instant.now().isAfter(deadline)) {
                    LOGGER.warn("Crawl timeout of {} s reached, abandoning the crawl", config.crawlTimeout().toSeconds());
                    cancelled = true;
                    break;
                }

                while (dispatched.size() < config.maxConcurrency()) {
                    CrawlTarget next = frontier.pop();
                    if (next == null) break;
                    dispatched.put(completion.submit(() -> process(next)), next);
                }

                if (frontier.isDrained()) {
                    phase = CrawlPhase.DRAINING;
                    break;
                }

                Future<PageOutcome> done = completion.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (done == null) continue;

                CrawlTarget target = dispatched.remove(done);
                Disposition disposition;
                try {
                    disposition = done.get().disposition();
                } catch (ExecutionException e) {
                    LOGGER.error("Worker crashed on {}", target.url(), e.getCause());
                    state.recordFailure(target.url(), ErrorKind.CRASH, String.valueOf(e.getCause()));
                    disposition = Disposition.FAILED;
                }
                frontier.complete(target.url(), disposition);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
        } finally {
            if (cancelled) {
                int abandoned = frontier.abandon();
                LOGGER.warn("{} queued or in-flight URLs abandoned", abandoned);
            }
            shutdown(pool, cancelled);
            if (cancelled) recoverFinished(frontier, dispatched);
        }
        return cancelled;
    }

    // Workers that still managed to store their page while the pool was stopping.
    private static void recoverFinished(Frontier frontier, Map<Future<PageOutcome>, CrawlTarget> dispatched) {
        for (Map.Entry<Future<PageOutcome>, CrawlTarget> e : dispatched.entrySet()) {
            Future<PageOutcome> future = e.getKey();
            if (!future.isDone() || future.isCancelled()) continue;
            try {
                if (future.get().disposition() == Disposition.FETCHED) {
                    frontier.recoverFetched(e.getValue().url());
                }
            } catch (ExecutionException ex) {
                LOGGER.debug("Worker for {} ended with {}", e.getValue().url(), String.valueOf(ex.getCause()));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    // Worker body: fetch, discover, persist. Per-URL problems end here as a FAILED outcome.
    private PageOutcome process(CrawlTarget target) {
        try {
            FetchResult result = fetcher.fetch(target);
            if (result.status() == FetchStatus.REDIRECT_TO_KNOWN) {
                MirroredPage page = store.persistRedirect(target.url(), result.finalLocation());
                LOGGER.info("Saved {} -> {} (redirect to {})", target.url(), page.localPath(), result.redirectTarget());
                return new PageOutcome(target, Disposition.FETCHED);
            }
            if (!result.isSuccess()) {
                state.recordFailure(target.url(), result.status().errorKind(), result.message());
                return new PageOutcome(target, Disposition.FAILED);
            }

            discover(target, result);

            MirroredPage page = store.persist(target.url(), result.finalLocation(), result.contentType(), result.body());
            LOGGER.info("Saved {} -> {}", target.url(), page.localPath());
            return new PageOutcome(target, Disposition.FETCHED);
        } catch (IOException e) {
            state.recordFailure(target.url(), ErrorKind.STORAGE_ERROR, e.toString());
            return new PageOutcome(target, Disposition.FAILED);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error processing {}", target.url(), e);
            state.recordFailure(target.url(), ErrorKind.CRASH, e.toString());
            return new PageOutcome(target, Disposition.FAILED);
        }
    }

    private void discover(CrawlTarget target, FetchResult result) {
        Frontier frontier = state.frontier();
        ExtractedLinks links = extractor.extractLinks(result.contentType(), result.body(), result.finalLocation());

        for (Map.Entry<String, String> link : links.inScope().entrySet()) {
            if (frontier.push(link.getKey(), link.getValue()) == Frontier.PushResult.LIMITED) {
                LOGGER.debug("Page limit reached, not queueing {}", link.getKey());
            }
        }
        for (String url : links.outOfScope()) {
            if (frontier.recordSkipped(url, Disposition.SKIPPED_OUT_OF_SCOPE)) {
                LOGGER.debug("Out of scope: {}", url);
            }
        }
        for (String url : links.filtered()) {
            frontier.recordSkipped(url, Disposition.SKIPPED_FILTERED);
        }
        for (String ref : links.malformed()) {
            state.recordMalformed(ref, target.url());
        }
    }

    // Stop workers and wait for them. When cancelled, in-flight fetches are interrupted first.
    private static void shutdown(ExecutorService pool, boolean cancelled) {
        if (cancelled) {
            pool.shutdownNow();
        } else {
            pool.shutdown();
        }
        try {
            if (!pool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static void prepareOutputDirectory(Path dir) throws ConfigException {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ConfigException("Could not create output dir: " + dir + " (" + e.getMessage() + ")", e);
        }
        if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
            throw new ConfigException("Output dir is not writable: " + dir);
        }
    }
}
