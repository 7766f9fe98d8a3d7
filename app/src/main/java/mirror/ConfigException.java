package mirror;

// Startup problem (bad root URL, unwritable output dir). Raised before any crawl state exists.
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
