package mirror;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static mirror.MirrorLogger.LOGGER;

// Retries transport failures with exponential backoff. HTTP error statuses are answers, not
// failures, and are never retried.
public class RetryingTransport implements HttpTransport {

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final HttpTransport delegate;
    private final int maxRetries;
    private final Duration initialBackoff;

    public RetryingTransport(HttpTransport delegate, int maxRetries, Duration initialBackoff) {
        this.delegate = delegate;
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
    }

    @Override
    public HttpResponse fetch(String location, Duration timeout) throws IOException {
        int attempt = 0;
        while (true) {
            try {
                return delegate.fetch(location, timeout);
            } catch (IOException e) {
                if (attempt >= maxRetries || isInterrupt(e)) throw e;
                Duration wait = backoff(attempt);
                attempt++;
                LOGGER.debug("Retry {}/{} for {} in {} ms ({})", attempt, maxRetries, location, wait.toMillis(), e.getMessage());
                sleep(wait);
            }
        }
    }

    // SocketTimeoutException is an InterruptedIOException too, but worth retrying
    private static boolean isInterrupt(IOException e) {
        return e instanceof InterruptedIOException && !(e instanceof SocketTimeoutException);
    }

    private Duration backoff(int attempt) {
        Duration wait = initialBackoff.multipliedBy(1L << Math.min(attempt, 16));
        return wait.compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : wait;
    }

    private static void sleep(Duration wait) throws InterruptedIOException {
        if (wait.isZero()) return;
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting to retry");
        }
    }
}
