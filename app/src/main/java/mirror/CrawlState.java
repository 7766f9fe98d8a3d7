package mirror;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

// Everything one crawl mutates: the frontier (with its visited set), the failure log and the
// malformed references seen. Created with the root as the only frontier entry and dropped
// when the crawl ends.
public class CrawlState {

    private final Frontier frontier;
    private final FailureLogger failures = new FailureLogger();
    private final Instant startedAt = Instant.now();

    public CrawlState(CrawlTarget root, int maxPages) {
        this.frontier = new Frontier(maxPages);
        frontier.push(root.url(), root.location());
    }

    public Frontier frontier() {
        return frontier;
    }

    public void recordFailure(String url, ErrorKind type, String message) {
        failures.fail(url, type, message);
    }

    public void recordMalformed(String ref, String foundOn) {
        failures.malformed(ref, foundOn);
    }

    public CrawlReport report(boolean cancelled) {
        Map<Disposition, Integer> counts = frontier.counts();
        return new CrawlReport(
                counts.get(Disposition.FETCHED),
                counts.get(Disposition.FAILED),
                counts.get(Disposition.SKIPPED_OUT_OF_SCOPE),
                counts.get(Disposition.SKIPPED_FILTERED),
                counts.get(Disposition.SKIPPED_PAGE_LIMIT),
                counts.get(Disposition.SKIPPED_CANCELLED),
                failures.malformedCount(),
                failures.snapshot(),
                Duration.between(startedAt, Instant.now()),
                cancelled);
    }
}
