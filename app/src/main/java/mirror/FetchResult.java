package mirror;

// Outcome of one fetch, including the redirects it followed.
// finalLocation is where the content came from (base for relative links); statusCode is 0 when no
// response arrived; redirectTarget is set only for REDIRECT_TO_KNOWN and names the canonical URL
// the crawl already has.
public record FetchResult(
        String url,
        String finalLocation,
        FetchStatus status,
        int statusCode,
        String contentType,
        byte[] body,
        String message,
        String redirectTarget
) {
    private static final byte[] EMPTY = new byte[0];

    public static FetchResult success(CrawlTarget target, String finalLocation, int statusCode,
                                      String contentType, byte[] body) {
        return new FetchResult(target.url(), finalLocation, FetchStatus.SUCCESS, statusCode, contentType,
                body == null ? EMPTY : body, null, null);
    }

    public static FetchResult failure(CrawlTarget target, String finalLocation, FetchStatus status,
                                      int statusCode, String message) {
        return new FetchResult(target.url(), finalLocation, status, statusCode, null, EMPTY, message, null);
    }

    // The redirect points at a URL another fetch owns; it was not requested.
    public static FetchResult redirectToKnown(CrawlTarget target, String location, int statusCode,
                                              String canonicalTarget) {
        return new FetchResult(target.url(), location, FetchStatus.REDIRECT_TO_KNOWN, statusCode, null, EMPTY,
                null, canonicalTarget);
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }
}
