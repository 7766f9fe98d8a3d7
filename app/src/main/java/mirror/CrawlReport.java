package mirror;

import java.time.Duration;
import java.util.List;

// Final tally of a crawl. Every discovered canonical URL is counted in exactly one of fetched,
// failed or one of the skipped buckets; malformed references are counted on their own.
public record CrawlReport(
        int fetched,
        int failed,
        int skippedOutOfScope,
        int skippedFiltered,
        int skippedPageLimit,
        int skippedCancelled,
        int malformed,
        List<FailureRecord> failures,
        Duration elapsed,
        boolean cancelled
) {
    public CrawlReport {
        failures = List.copyOf(failures);
    }

    public int skipped() {
        return skippedOutOfScope + skippedFiltered + skippedPageLimit + skippedCancelled;
    }
}
