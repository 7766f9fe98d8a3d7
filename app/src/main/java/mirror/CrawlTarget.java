package mirror;

// A frontier entry: canonical URL (dedup key) and the location actually requested.
public record CrawlTarget(String url, String location) { }
