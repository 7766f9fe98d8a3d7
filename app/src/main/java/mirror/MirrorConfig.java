package mirror;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

// Settings for one mirror run. maxPages 0 means no cap; a zero crawlTimeout means no time limit.
public record MirrorConfig(
        String rootUrl,
        Path outputDir,
        int maxConcurrency,
        Duration requestTimeout,
        int maxRedirects,
        int maxPages,
        Scope scope,
        boolean mirrorAssets,
        int maxRetries,
        Duration crawlTimeout,
        String userAgent
) {
    public static final int DEFAULT_MAX_CONCURRENCY = 8;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_REDIRECTS = 5;
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible; SiteMirror/1.0)";

    public MirrorConfig {
        Objects.requireNonNull(rootUrl, "rootUrl");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(crawlTimeout, "crawlTimeout");
        Objects.requireNonNull(userAgent, "userAgent");
        if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1");
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (maxRedirects < 0) throw new IllegalArgumentException("maxRedirects must be >= 0");
        if (maxPages < 0) throw new IllegalArgumentException("maxPages must be >= 0");
        if (maxRetries < 0) throw new IllegalArgumentException("retries must be >= 0");
        if (crawlTimeout.isNegative()) throw new IllegalArgumentException("crawlTimeout must be >= 0");
    }

    public static MirrorConfig defaults(String rootUrl, Path outputDir) {
        return new MirrorConfig(rootUrl, outputDir, DEFAULT_MAX_CONCURRENCY, DEFAULT_REQUEST_TIMEOUT,
                DEFAULT_MAX_REDIRECTS, 0, Scope.SAME_ORIGIN, true, 0, Duration.ZERO, DEFAULT_USER_AGENT);
    }

    public boolean hasPageLimit() {
        return maxPages > 0;
    }

    public boolean hasCrawlTimeout() {
        return !crawlTimeout.isZero();
    }

    public MirrorConfig withMaxConcurrency(int value) {
        return new MirrorConfig(rootUrl, outputDir, value, requestTimeout, maxRedirects, maxPages, scope,
                mirrorAssets, maxRetries, crawlTimeout, userAgent);
    }

    public MirrorConfig withRequestTimeout(Duration value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, value, maxRedirects, maxPages, scope,
                mirrorAssets, maxRetries, crawlTimeout, userAgent);
    }

    public MirrorConfig withMaxRedirects(int value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, requestTimeout, value, maxPages, scope,
                mirrorAssets, maxRetries, crawlTimeout, userAgent);
    }

    public MirrorConfig withMaxPages(int value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, requestTimeout, maxRedirects, value, scope,
                mirrorAssets, maxRetries, crawlTimeout, userAgent);
    }

    public MirrorConfig withScope(Scope value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, requestTimeout, maxRedirects, maxPages, value,
                mirrorAssets, maxRetries, crawlTimeout, userAgent);
    }

    public MirrorConfig withMirrorAssets(boolean value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, requestTimeout, maxRedirects, maxPages, scope,
                value, maxRetries, crawlTimeout, userAgent);
    }

    public MirrorConfig withMaxRetries(int value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, requestTimeout, maxRedirects, maxPages, scope,
                mirrorAssets, value, crawlTimeout, userAgent);
    }

    public MirrorConfig withCrawlTimeout(Duration value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, requestTimeout, maxRedirects, maxPages, scope,
                mirrorAssets, maxRetries, value, userAgent);
    }

    public MirrorConfig withUserAgent(String value) {
        return new MirrorConfig(rootUrl, outputDir, maxConcurrency, requestTimeout, maxRedirects, maxPages, scope,
                mirrorAssets, maxRetries, crawlTimeout, value);
    }
}
