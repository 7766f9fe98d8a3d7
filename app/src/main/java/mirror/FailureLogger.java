package mirror;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

import static mirror.MirrorLogger.LOGGER;

// Collects per-URL failures from all workers. Each one is logged as it happens and kept in
// memory for the report and failures.csv.
public class FailureLogger {

    private final Queue<FailureRecord> failures = new ConcurrentLinkedQueue<>();
    private final Set<String> malformed = ConcurrentHashMap.newKeySet();

    public void fail(String url, ErrorKind type, String message) {
        LOGGER.warn("{} {}: {}", type, url, message);
        failures.add(new FailureRecord(url, type, message));
    }

    // Each distinct bad reference is reported once, however many pages carry it.
    public void malformed(String ref, String foundOn) {
        if (malformed.add(ref)) {
            LOGGER.warn("{} {} (found on {})", ErrorKind.MALFORMED_URL, ref, foundOn);
            failures.add(new FailureRecord(ref, ErrorKind.MALFORMED_URL, "found on " + foundOn));
        }
    }

    public int malformedCount() {
        return malformed.size();
    }

    public List<FailureRecord> snapshot() {
        return new ArrayList<>(failures);
    }
}
