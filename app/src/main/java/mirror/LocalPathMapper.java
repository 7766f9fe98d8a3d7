package mirror;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

// Maps canonical URLs to files under the output directory.
// The layout mirrors the site: <out>/<host>/<path>. Paths that already name a file
// (html or a known asset extension) keep their name; anything else is treated as a directory and
// stored as index.html inside it. A query string adds a short hash to the file name.
// Assignments are remembered for the whole run: the same URL always gets the same path, and a
// second URL that would land on an already-assigned path gets a hash of its own URL appended.
public class LocalPathMapper {

    private static final String INDEX = "index.html";

    private static final Set<String> FILE_EXTENSIONS = Set.of(
            "html", "htm", "xhtml", "css", "js", "mjs", "json", "xml", "txt", "map",
            "png", "jpg", "jpeg", "gif", "webp", "svg", "ico", "bmp", "avif",
            "woff", "woff2", "ttf", "otf", "eot",
            "mp3", "mp4", "webm", "ogg", "wav", "pdf", "zip");

    private final Path outputDir;
    private final Map<String, Path> byUrl = new HashMap<>();
    private final Map<Path, String> byPath = new HashMap<>();

    public LocalPathMapper(Path outputDir) {
        this.outputDir = outputDir;
    }

    public synchronized Path path(String url) {
        Path known = byUrl.get(url);
        if (known != null) return known;

        Path structural = structuralPath(url);
        Path candidate = structural;
        if (byPath.containsKey(candidate)) {
            String hash = UrlUtil.shortHash(url);
            candidate = withSuffix(structural, hash);
            for (int n = 2; byPath.containsKey(candidate); n++) {
                candidate = withSuffix(structural, hash + "_" + n);
            }
        }
        byUrl.put(url, candidate);
        byPath.put(candidate, url);
        return candidate;
    }

    // Link from one mirrored file to another, '/'-separated as browsers expect.
    public static String relativeLink(Path fromFile, Path toFile) {
        Path rel = fromFile.getParent().relativize(toFile);
        return rel.toString().replace(rel.getFileSystem().getSeparator(), "/");
    }

    private Path structuralPath(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return outputDir.resolve("_unparsed").resolve(UrlUtil.shortHash(url) + ".html");
        }

        String host = uri.getHost() == null ? "_nohost" : uri.getHost().toLowerCase(Locale.ROOT);
        if (uri.getPort() != -1) host = host + "_" + uri.getPort();
        Path dir = outputDir.resolve(UrlUtil.sanitizeSegment(host));

        List<String> segments = new ArrayList<>();
        String path = uri.getPath() == null ? "" : uri.getPath();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) segments.add(s);
        }

        String fileName = INDEX;
        if (!segments.isEmpty() && FILE_EXTENSIONS.contains(extension(segments.get(segments.size() - 1)))) {
            fileName = UrlUtil.sanitizeSegment(segments.remove(segments.size() - 1));
        }
        for (String segment : segments) {
            dir = dir.resolve(UrlUtil.sanitizeSegment(segment));
        }

        Path file = dir.resolve(fileName);
        String query = uri.getRawQuery();
        return query == null ? file : withSuffix(file, UrlUtil.shortHash(query));
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    // index.html + abc -> index_abc.html
    private static Path withSuffix(Path file, String suffix) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String renamed = dot <= 0
                ? name + "_" + suffix
                : name.substring(0, dot) + "_" + suffix + name.substring(dot);
        return file.resolveSibling(renamed);
    }
}
