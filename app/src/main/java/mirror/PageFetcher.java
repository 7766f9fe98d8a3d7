package mirror;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.function.BiPredicate;

import static mirror.MirrorLogger.LOGGER;

// Fetches one crawl target, following redirects itself so hops can be counted, kept inside the site
// and checked against the frontier. Never throws: network trouble comes back as TRANSPORT_ERROR.
public class PageFetcher {

    private final HttpTransport transport;
    private final Semaphore permits;
    private final Duration timeout;
    private final int maxRedirects;
    private final String rootUrl;
    private final Scope scope;
    // (redirect target, URL being fetched) -> may this fetch request the target?
    private final BiPredicate<String, String> redirectClaims;

    public PageFetcher(HttpTransport transport, MirrorConfig config, String rootUrl) {
        this(transport, config, rootUrl, (url, owner) -> true);
    }

    public PageFetcher(HttpTransport transport, MirrorConfig config, String rootUrl,
                       BiPredicate<String, String> redirectClaims) {
        this.transport = transport;
        this.permits = new Semaphore(config.maxConcurrency());
        this.timeout = config.requestTimeout();
        this.maxRedirects = config.maxRedirects();
        this.rootUrl = rootUrl;
        this.scope = config.scope();
        this.redirectClaims = redirectClaims;
    }

    public FetchResult fetch(CrawlTarget target) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(target, target.location(), FetchStatus.TRANSPORT_ERROR, 0, "interrupted before fetch");
        }
        try {
            return followRedirects(target);
        } finally {
            permits.release();
        }
    }

    private FetchResult followRedirects(CrawlTarget target) {
        String location = target.location();
        int redirects = 0;
        // canonical URLs this fetch may request: the target and the hops it claimed
        Set<String> owned = new HashSet<>();
        owned.add(target.url());

        while (true) {
            HttpResponse res;
            try {
                LOGGER.debug("GET {}", location);
                res = transport.fetch(location, timeout);
            } catch (SocketTimeoutException e) {
                return FetchResult.failure(target, location, FetchStatus.TRANSPORT_ERROR, 0,
                        "timed out after " + timeout.toMillis() + " ms");
            } catch (IOException e) {
                return FetchResult.failure(target, location, FetchStatus.TRANSPORT_ERROR, 0, describe(e));
            }

            int status = res.statusCode();
            if (isRedirect(status)) {
                String header = res.header("Location");
                if (header == null || header.isBlank()) {
                    return FetchResult.failure(target, location, FetchStatus.REDIRECT_ERROR, status,
                            "HTTP " + status + " without Location header");
                }
                String next;
                String canonical;
                try {
                    next = UrlNormalizer.resolve(location, header);
                    canonical = UrlNormalizer.normalize(next);
                } catch (MalformedUrlException e) {
                    return FetchResult.failure(target, location, FetchStatus.REDIRECT_ERROR, status,
                            "bad Location header: " + e.getMessage());
                }
                if (!UrlNormalizer.inScope(canonical, rootUrl, scope)) {
                    return FetchResult.failure(target, location, FetchStatus.REDIRECT_ERROR, status,
                            "redirect leaves the site: " + next);
                }
                if (redirects >= maxRedirects) {
                    return FetchResult.failure(target, location, FetchStatus.REDIRECT_LOOP, status,
                            "more than " + maxRedirects + " redirects");
                }
                if (!owned.contains(canonical)) {
                    if (!redirectClaims.test(canonical, target.url())) {
                        LOGGER.debug("{} redirects to {}, already known", target.url(), canonical);
                        return FetchResult.redirectToKnown(target, next, status, canonical);
                    }
                    owned.add(canonical);
                }
                redirects++;
                location = next;
                continue;
            }

            if (status >= 200 && status < 300) {
                return FetchResult.success(target, location, status, res.contentType(), res.body());
            }
            return FetchResult.failure(target, location, classify(status), status, "HTTP " + status);
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    // Non-2xx that is not a followable redirect.
    private static FetchStatus classify(int status) {
        if (status >= 300 && status < 400) return FetchStatus.REDIRECT_ERROR;
        if (status >= 400 && status < 500) return FetchStatus.CLIENT_ERROR;
        if (status >= 500 && status < 600) return FetchStatus.SERVER_ERROR;
        return FetchStatus.UNEXPECTED_STATUS;
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        return msg == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg;
    }
}
