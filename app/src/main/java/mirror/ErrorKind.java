package mirror;

// Classification of a per-URL failure in the report and failures.csv.
public enum ErrorKind {
    MALFORMED_URL,
    TRANSPORT_ERROR,
    HTTP_ERROR,
    REDIRECT_LOOP,
    REDIRECT_ERROR,
    STORAGE_ERROR,
    CRASH
}
