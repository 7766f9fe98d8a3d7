package mirror;

// Thrown when a reference cannot be turned into a canonical http(s) URL.
public class MalformedUrlException extends Exception {

    private final String reference;

    public MalformedUrlException(String reference, String reason) {
        super(reason + ": " + reference);
        this.reference = reference;
    }

    public MalformedUrlException(String reference, Throwable cause) {
        super(cause.getMessage() + ": " + reference, cause);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
