package mirror;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import static mirror.MirrorLogger.LOGGER;

public class ReportWriter {

    static final String FAILURES_FILE = "failures.csv";

    private final Path outputDir;

    public ReportWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    // Writes failures.csv when there is anything to write; returns the file or null.
    public Path writeFailuresFile(CrawlReport report) {
        if (report.failures().isEmpty()) return null;

        Path out = outputDir.resolve(FAILURES_FILE);
        try {
            // Very simple CSV: url,type,message
            List<String> lines = new ArrayList<>();
            lines.add("url,type,message");

            for (FailureRecord f : report.failures()) {
                lines.add(csv(f.url()) + "," + csv(f.type()) + "," + csv(f.message()));
            }

            Files.write(out, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            LOGGER.info("Wrote failures file: {}", out);
            return out;
        } catch (IOException e) {
            LOGGER.error("Could not write failures file: {}", e.getMessage());
            return null;
        }
    }

    // Print a minimal end-of-run summary.
    public void printSummary(CrawlReport report, PrintStream out) {
        out.println("==== Mirror summary ====");
        out.println("Saved output under: " + outputDir);
        out.println("Fetched  : " + report.fetched());
        out.println("Failed   : " + report.failed());
        out.println("Skipped  : " + report.skipped()
                + " (out of scope " + report.skippedOutOfScope()
                + ", filtered " + report.skippedFiltered()
                + ", page limit " + report.skippedPageLimit()
                + ", cancelled " + report.skippedCancelled() + ")");
        out.println("Malformed: " + report.malformed());
        out.println("Elapsed  : " + report.elapsed().toMillis() + " ms" + (report.cancelled() ? " (stopped early)" : ""));
        for (FailureRecord f : report.failures()) {
            out.println("  " + f.type() + " " + f.url() + " - " + f.message());
        }
        if (!report.failures().isEmpty()) {
            out.println("Failures details: " + outputDir.resolve(FAILURES_FILE));
        }
    }

    // Quote CSV fields safely (minimal)
    private static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
