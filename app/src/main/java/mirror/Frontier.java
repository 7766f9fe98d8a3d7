package mirror;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

// FIFO queue of discovered-but-unfetched URLs plus the visited set (the disposition map keys).
// Every method runs under the same monitor, so "is it new?" and "enqueue it" are one atomic step.
public class Frontier {

    public enum PushResult { ENQUEUED, DUPLICATE, LIMITED, CLOSED }

    private final Queue<CrawlTarget> pending = new ArrayDeque<>();
    private final Map<String, Disposition> dispositions = new HashMap<>();
    // redirect target -> URL whose fetch reached it
    private final Map<String, String> aliases = new HashMap<>();
    // in flight when the crawl was abandoned
    private final Set<String> abandonedInFlight = new HashSet<>();
    private final int maxPages;

    private int admitted = 0;
    private int inFlight = 0;
    private boolean closed = false;

    // maxPages <= 0 means no cap
    public Frontier(int maxPages) {
        this.maxPages = maxPages;
    }

    public synchronized PushResult push(String url, String location) {
        if (closed) return PushResult.CLOSED;
        Disposition known = dispositions.get(url);
        // an asset skipped by policy may still be linked as a page elsewhere
        if (known != null && known != Disposition.SKIPPED_FILTERED) return PushResult.DUPLICATE;
        if (maxPages > 0 && admitted >= maxPages) {
            dispositions.put(url, Disposition.SKIPPED_PAGE_LIMIT);
            return PushResult.LIMITED;
        }
        dispositions.put(url, Disposition.QUEUED);
        pending.add(new CrawlTarget(url, location));
        admitted++;
        return PushResult.ENQUEUED;
    }

    // Record a URL that is never fetched. Returns false if the URL was already known.
    public synchronized boolean recordSkipped(String url, Disposition reason) {
        if (!reason.isSkipped()) throw new IllegalArgumentException("Not a skip disposition: " + reason);
        if (closed || dispositions.containsKey(url)) return false;
        dispositions.put(url, reason);
        return true;
    }

    // A fetch of owner is about to follow a redirect to url. Succeeds only for a URL
    // nobody has seen yet; it is then marked REDIRECTED and never queued on its own.
    public synchronized boolean claimRedirect(String url, String owner) {
        if (closed || dispositions.containsKey(url)) return false;
        dispositions.put(url, Disposition.REDIRECTED);
        aliases.put(url, owner);
        return true;
    }

    // The URL whose local file holds this URL's content.
    public synchronized String aliasOf(String url) {
        return aliases.getOrDefault(url, url);
    }

    // Next URL to fetch, or null when nothing is pending. The URL counts as in flight until complete().
    public synchronized CrawlTarget pop() {
        if (closed) return null;
        CrawlTarget next = pending.poll();
        if (next == null) return null;
        dispositions.put(next.url(), Disposition.IN_FLIGHT);
        inFlight++;
        return next;
    }

    public synchronized void complete(String url, Disposition terminal) {
        if (!terminal.isTerminal()) throw new IllegalArgumentException("Not terminal: " + terminal);
        if (dispositions.get(url) != Disposition.IN_FLIGHT) return; // abandoned meanwhile
        dispositions.put(url, terminal);
        inFlight--;
    }

    // Empty queue and nothing in flight: no one can enqueue anything any more.
    public synchronized boolean isDrained() {
        return pending.isEmpty() && inFlight == 0;
    }

    public synchronized int inFlight() {
        return inFlight;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized boolean isAttempted(String url) {
        Disposition d = dispositions.get(url);
        return d != null && d.isAttempted();
    }

    public synchronized Disposition dispositionOf(String url) {
        return dispositions.get(url);
    }

    // Stop the crawl: everything queued or in flight ends as cancelled. Returns how many.
    public synchronized int abandon() {
        closed = true;
        pending.clear();
        int abandoned = 0;
        for (Map.Entry<String, Disposition> e : dispositions.entrySet()) {
            if (e.getValue() == Disposition.IN_FLIGHT) abandonedInFlight.add(e.getKey());
            if (!e.getValue().isTerminal()) {
                e.setValue(Disposition.SKIPPED_CANCELLED);
                abandoned++;
            }
        }
        inFlight = 0;
        return abandoned;
    }

    // A worker still running at abandon() managed to store its page before the pool stopped.
    public synchronized void recoverFetched(String url) {
        if (abandonedInFlight.remove(url) && dispositions.get(url) == Disposition.SKIPPED_CANCELLED) {
            dispositions.put(url, Disposition.FETCHED);
        }
    }

    public synchronized Map<Disposition, Integer> counts() {
        Map<Disposition, Integer> counts = new EnumMap<>(Disposition.class);
        for (Disposition d : Disposition.values()) counts.put(d, 0);
        for (Disposition d : dispositions.values()) counts.merge(d, 1, Integer::sum);
        return counts;
    }
}
