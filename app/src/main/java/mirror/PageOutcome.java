package mirror;

// What a worker hands back to the coordinator for one target.
public record PageOutcome(CrawlTarget target, Disposition disposition) { }
