package mirror;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

// CLI entry point that parses args and launches the mirror.
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_STOPPED = 1;
    static final int EXIT_CONFIG = 2;

    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    private static final String USAGE = """
            Usage: <rootUrl> <outputDir> [key=value ...]
              maxConcurrency=8     parallel fetches
              timeout=30           per-request timeout in seconds
              maxRedirects=5       redirect hops before giving up
              maxPages=0           cap on mirrored URLs, 0 for none
              scope=same-origin    or same-host-subdomains
              assets=true          also mirror css, js and images
              retries=0            retries after a network error
              crawlTimeout=0       stop the whole crawl after this many seconds, 0 for none
              userAgent=...        User-Agent header
            Example: https://example.com ./mirror maxConcurrency=4 maxPages=500
            """;

    public static void main(String[] args) {
        MirrorConfig config;
        try {
            config = parseConfig(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(EXIT_CONFIG);
            return;
        }

        HttpTransport transport = new JsoupTransport(config.userAgent());
        if (config.maxRetries() > 0) {
            transport = new RetryingTransport(transport, config.maxRetries(), RETRY_BACKOFF);
        }

        MirrorCrawler crawler;
        try {
            crawler = new MirrorCrawler(config, transport);
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            System.exit(EXIT_CONFIG);
            return;
        }

        // If user hits Ctrl+C, stop the crawl and let it write its report
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (crawler.phase() == CrawlPhase.DONE) return;
            crawler.stop();
            try {
                crawler.awaitFinished(Duration.ofSeconds(15));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));

        CrawlReport report;
        try {
            report = crawler.run();
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            System.exit(EXIT_CONFIG);
            return;
        }

        new ReportWriter(config.outputDir()).printSummary(report, System.out);
        System.exit(report.cancelled() ? EXIT_STOPPED : EXIT_OK);
    }

    // Build the run configuration from CLI args. Throws IllegalArgumentException with a readable message.
    static MirrorConfig parseConfig(String[] args) {
        if (args.length < 2) {
            throw new IllegalArgumentException("Expected <rootUrl> <outputDir>");
        }

        String rootUrl = args[0].trim();
        Path outputDir = Paths.get(args[1]);
        MirrorConfig config = MirrorConfig.defaults(rootUrl, outputDir);

        for (int i = 2; i < args.length; i++) {
            String arg = args[i];
            int eq = arg.indexOf('=');
            if (eq <= 0) throw new IllegalArgumentException("Expected key=value, got: " + arg);
            String key = arg.substring(0, eq).trim();
            String value = arg.substring(eq + 1).trim();

            config = switch (key) {
                case "maxConcurrency" -> config.withMaxConcurrency(parseInt(value, key));
                case "timeout" -> config.withRequestTimeout(Duration.ofSeconds(parseInt(value, key)));
                case "maxRedirects" -> config.withMaxRedirects(parseInt(value, key));
                case "maxPages" -> config.withMaxPages(parseInt(value, key));
                case "scope" -> config.withScope(Scope.fromCliName(value));
                case "assets" -> config.withMirrorAssets(parseBoolean(value, key));
                case "retries" -> config.withMaxRetries(parseInt(value, key));
                case "crawlTimeout" -> config.withCrawlTimeout(Duration.ofSeconds(parseInt(value, key)));
                case "userAgent" -> config.withUserAgent(value);
                default -> throw new IllegalArgumentException("Unknown option: " + key);
            };
        }
        return config;
    }

    // Strict integer parsing with a clean error message.
    private static int parseInt(String s, String name) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + s);
        }
    }

    // Boolean.parseBoolean returns false for anything not "true", so we validate manually to catch "maybe" etc.
    private static boolean parseBoolean(String s, String name) {
        String raw = s.toLowerCase(Locale.ROOT);
        if (!raw.equals("true") && !raw.equals("false")) {
            throw new IllegalArgumentException("Invalid boolean for " + name + ": " + s + " (use true/false)");
        }
        return Boolean.parseBoolean(raw);
    }
}
