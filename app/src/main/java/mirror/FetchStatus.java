package mirror;

public enum FetchStatus {
    SUCCESS(null),
    // redirect to a URL that is already queued, fetched or claimed; stored as a local redirect
    REDIRECT_TO_KNOWN(null),
    // 3xx we could not follow: no usable Location, the target leaves the site, or not a redirect code (300, 304)
    REDIRECT_ERROR(ErrorKind.REDIRECT_ERROR),
    // more hops than maxRedirects
    REDIRECT_LOOP(ErrorKind.REDIRECT_LOOP),
    CLIENT_ERROR(ErrorKind.HTTP_ERROR),
    SERVER_ERROR(ErrorKind.HTTP_ERROR),
    // 1xx or a code outside 100-599
    UNEXPECTED_STATUS(ErrorKind.HTTP_ERROR),
    // timeout, refused connection, DNS, TLS...
    TRANSPORT_ERROR(ErrorKind.TRANSPORT_ERROR);

    private final ErrorKind errorKind;

    FetchStatus(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }
}
