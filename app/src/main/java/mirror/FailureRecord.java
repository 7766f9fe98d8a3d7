package mirror;

// Lightweight failure detail for failures.csv.
public record FailureRecord(String url, ErrorKind type, String message) { }
