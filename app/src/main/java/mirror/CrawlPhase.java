package mirror;

// IDLE -> RUNNING -> DRAINING -> DONE, or straight to DONE when stopped.
public enum CrawlPhase {
    IDLE,
    RUNNING,
    DRAINING,
    DONE
}
