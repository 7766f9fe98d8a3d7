package mirror;

// Where a discovered URL stands. Everything except QUEUED and IN_FLIGHT is terminal.
public enum Disposition {
    QUEUED,
    IN_FLIGHT,
    FETCHED,
    FAILED,
    // reached through another URL's redirect, stored at that URL's local path
    REDIRECTED,
    SKIPPED_OUT_OF_SCOPE,
    SKIPPED_FILTERED,
    SKIPPED_PAGE_LIMIT,
    SKIPPED_CANCELLED;

    public boolean isTerminal() {
        return this != QUEUED && this != IN_FLIGHT;
    }

    public boolean isSkipped() {
        return name().startsWith("SKIPPED_");
    }

    // Queued, fetching, fetched, failed or redirected: the URL got (or will get) a local path.
    public boolean isAttempted() {
        return this == QUEUED || this == IN_FLIGHT || this == FETCHED || this == FAILED || this == REDIRECTED;
    }
}
