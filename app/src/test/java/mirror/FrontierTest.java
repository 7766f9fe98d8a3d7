package mirror;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FrontierTest {

    @Test
    void popsInFifoOrderAndIgnoresDuplicates() {
        Frontier frontier = new Frontier(0);
        assertEquals(Frontier.PushResult.ENQUEUED, frontier.push("http://ex.com/a", "http://ex.com/a"));
        assertEquals(Frontier.PushResult.ENQUEUED, frontier.push("http://ex.com/b", "http://ex.com/b/"));
        assertEquals(Frontier.PushResult.DUPLICATE, frontier.push("http://ex.com/a", "http://ex.com/a/"));

        assertEquals(new CrawlTarget("http://ex.com/a", "http://ex.com/a"), frontier.pop());
        assertEquals(new CrawlTarget("http://ex.com/b", "http://ex.com/b/"), frontier.pop());
        assertNull(frontier.pop());
    }

    @Test
    void drainedOnlyWhenEmptyAndNothingInFlight() {
        Frontier frontier = new Frontier(0);
        frontier.push("http://ex.com/", "http://ex.com/");
        assertFalse(frontier.isDrained());

        CrawlTarget root = frontier.pop();
        assertFalse(frontier.isDrained(), "a fetch in flight may still discover URLs");
        assertEquals(1, frontier.inFlight());

        frontier.complete(root.url(), Disposition.FETCHED);
        assertTrue(frontier.isDrained());
        assertEquals(Disposition.FETCHED, frontier.dispositionOf(root.url()));
    }

    @Test
    void urlsBeyondThePageLimitAreRecordedNotQueued() {
        Frontier frontier = new Frontier(2);
        assertEquals(Frontier.PushResult.ENQUEUED, frontier.push("http://ex.com/a", "http://ex.com/a"));
        assertEquals(Frontier.PushResult.ENQUEUED, frontier.push("http://ex.com/b", "http://ex.com/b"));
        assertEquals(Frontier.PushResult.LIMITED, frontier.push("http://ex.com/c", "http://ex.com/c"));
        assertEquals(Frontier.PushResult.DUPLICATE, frontier.push("http://ex.com/c", "http://ex.com/c"));

        assertEquals(2, frontier.pendingCount());
        assertEquals(1, frontier.counts().get(Disposition.SKIPPED_PAGE_LIMIT));
        assertFalse(frontier.isAttempted("http://ex.com/c"));
    }

    @Test
    void skippedUrlsAreRecordedOnce() {
        Frontier frontier = new Frontier(0);
        assertTrue(frontier.recordSkipped("http://other.com/x", Disposition.SKIPPED_OUT_OF_SCOPE));
        assertFalse(frontier.recordSkipped("http://other.com/x", Disposition.SKIPPED_OUT_OF_SCOPE));
        assertEquals(Frontier.PushResult.DUPLICATE, frontier.push("http://other.com/x", "http://other.com/x"));
        assertEquals(1, frontier.counts().get(Disposition.SKIPPED_OUT_OF_SCOPE));
    }

    @Test
    void filteredAssetCanStillBeQueuedAsPage() {
        Frontier frontier = new Frontier(0);
        frontier.recordSkipped("http://ex.com/doc.pdf", Disposition.SKIPPED_FILTERED);
        assertEquals(Frontier.PushResult.ENQUEUED, frontier.push("http://ex.com/doc.pdf", "http://ex.com/doc.pdf"));
        assertTrue(frontier.isAttempted("http://ex.com/doc.pdf"));
    }

    @Test
    void concurrentPushersAdmitEachUrlOnce() throws Exception {
        Frontier frontier = new Frontier(0);
        int threads = 8;
        int urls = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                int enqueued = 0;
                for (int i = 0; i < urls; i++) {
                    String url = "http://ex.com/p" + i;
                    if (frontier.push(url, url) == Frontier.PushResult.ENQUEUED) enqueued++;
                }
                return enqueued;
            }));
        }
        start.countDown();

        int total = 0;
        for (Future<Integer> f : futures) total += f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(urls, total);
        assertEquals(urls, frontier.pendingCount());
    }

    @Test
    void abandonCancelsQueuedAndInFlightUrls() {
        Frontier frontier = new Frontier(0);
        frontier.push("http://ex.com/a", "http://ex.com/a");
        frontier.push("http://ex.com/b", "http://ex.com/b");
        frontier.push("http://ex.com/c", "http://ex.com/c");
        CrawlTarget a = frontier.pop();
        frontier.complete(a.url(), Disposition.FETCHED);
        frontier.pop();

        assertEquals(2, frontier.abandon());
        assertEquals(2, frontier.counts().get(Disposition.SKIPPED_CANCELLED));
        assertEquals(1, frontier.counts().get(Disposition.FETCHED));
        assertTrue(frontier.isDrained());
        assertNull(frontier.pop());
        assertEquals(Frontier.PushResult.CLOSED, frontier.push("http://ex.com/d", "http://ex.com/d"));
    }

    @Test
    void redirectTargetIsClaimedOnlyOnce() {
        Frontier frontier = new Frontier(0);
        frontier.push("http://ex.com/a", "http://ex.com/a");
        frontier.push("http://ex.com/known", "http://ex.com/known");

        assertTrue(frontier.claimRedirect("http://ex.com/b", "http://ex.com/a"));
        assertFalse(frontier.claimRedirect("http://ex.com/b", "http://ex.com/c"));
        assertFalse(frontier.claimRedirect("http://ex.com/known", "http://ex.com/a"));

        assertEquals(Frontier.PushResult.DUPLICATE, frontier.push("http://ex.com/b", "http://ex.com/b"));
        assertEquals(Disposition.REDIRECTED, frontier.dispositionOf("http://ex.com/b"));
        assertTrue(frontier.isAttempted("http://ex.com/b"));
        assertEquals("http://ex.com/a", frontier.aliasOf("http://ex.com/b"));
        assertEquals("http://ex.com/known", frontier.aliasOf("http://ex.com/known"));
    }

    @Test
    void pageStoredDuringAbandonIsCountedAsFetched() {
        Frontier frontier = new Frontier(0);
        frontier.push("http://ex.com/a", "http://ex.com/a");
        frontier.push("http://ex.com/b", "http://ex.com/b");
        CrawlTarget a = frontier.pop();

        frontier.abandon();
        frontier.recoverFetched(a.url());
        frontier.recoverFetched("http://ex.com/b");

        assertEquals(Disposition.FETCHED, frontier.dispositionOf(a.url()));
        assertEquals(Disposition.SKIPPED_CANCELLED, frontier.dispositionOf("http://ex.com/b"));
    }
}
