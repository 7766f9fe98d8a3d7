package mirror;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

// Canonical form and scope checks for crawl URLs.
// Canonical URLs look like scheme://host[:port]path[?query]: lower-case scheme and
// host, no default port, no fragment, no dot segments, / for an empty path and no
// trailing slash on any other path. Only http and https are accepted.
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    // Canonical form of an absolute URL.
    public static String normalize(String url) throws MalformedUrlException {
        return normalize(null, url);
    }

    // Resolve rawRef against baseUrl and return its canonical form (used for dedup and paths).
    public static String normalize(String baseUrl, String rawRef) throws MalformedUrlException {
        URI abs = absolute(baseUrl, rawRef);
        String path = removeDotSegments(abs.getRawPath());
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return build(abs, path);
    }

    // Resolve rawRef against baseUrl keeping the path as written (used for the actual request).
    public static String resolve(String baseUrl, String rawRef) throws MalformedUrlException {
        URI abs = absolute(baseUrl, rawRef);
        return build(abs, removeDotSegments(abs.getRawPath()));
    }

    // True iff url belongs to the site rooted at rootUrl.
    // Same-origin compares scheme, host and port; same-host-subdomains compares scheme and
    // accepts the root host (without a leading www.) and any of its subdomains.
    public static boolean inScope(String url, String rootUrl, Scope scope) {
        URI u;
        URI root;
        try {
            u = new URI(url);
            root = new URI(rootUrl);
        } catch (URISyntaxException e) {
            return false;
        }
        if (u.getScheme() == null || root.getScheme() == null || u.getHost() == null || root.getHost() == null) {
            return false;
        }
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals(root.getScheme().toLowerCase(Locale.ROOT))) return false;

        String host = u.getHost().toLowerCase(Locale.ROOT);
        String rootHost = root.getHost().toLowerCase(Locale.ROOT);

        if (scope == Scope.SAME_HOST_SUBDOMAINS) {
            String base = rootHost.startsWith("www.") ? rootHost.substring(4) : rootHost;
            return host.equals(base) || host.endsWith("." + base);
        }
        return host.equals(rootHost) && effectivePort(scheme, u.getPort()) == effectivePort(scheme, root.getPort());
    }

    private static URI absolute(String baseUrl, String rawRef) throws MalformedUrlException {
        if (rawRef == null || rawRef.isBlank()) {
            throw new MalformedUrlException(String.valueOf(rawRef), "empty reference");
        }
        URI ref = parse(rawRef.trim());
        URI abs = ref;
        if (!ref.isAbsolute()) {
            if (baseUrl == null) throw new MalformedUrlException(rawRef, "relative reference without a base");
            URI base = parse(baseUrl);
            if (!base.isAbsolute() || base.isOpaque()) throw new MalformedUrlException(baseUrl, "base is not absolute");
            // URI.resolve glues "a" onto "http://host" as "http://hosta"
            if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
                base = base.resolve("/");
            }
            if (ref.getRawAuthority() == null && ref.getRawPath().isEmpty() && ref.getRawQuery() != null) {
                // query-only reference keeps the base path (RFC 3986 5.2.2)
                abs = parse(base.getScheme() + "://" + base.getRawAuthority() + base.getRawPath() + "?" + ref.getRawQuery());
            } else {
                abs = base.resolve(ref);
            }
        }

        String scheme = abs.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new MalformedUrlException(rawRef, "unsupported scheme '" + scheme + "'");
        }
        if (abs.getHost() == null) {
            throw new MalformedUrlException(rawRef, "missing or invalid host");
        }
        return abs;
    }

    private static String build(URI abs, String path) {
        String scheme = abs.getScheme().toLowerCase(Locale.ROOT);
        String host = abs.getHost().toLowerCase(Locale.ROOT);
        while (host.endsWith(".")) host = host.substring(0, host.length() - 1);

        int port = abs.getPort();
        if (port == effectivePort(scheme, -1)) port = -1;

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path.isEmpty() ? "/" : path);
        String query = abs.getRawQuery();
        if (query != null && !query.isEmpty()) sb.append('?').append(query);
        return sb.toString();
    }

    private static int effectivePort(String scheme, int port) {
        if (port != -1) return port;
        return scheme.equals("https") ? 443 : 80;
    }

    private static URI parse(String raw) throws MalformedUrlException {
        try {
            return new URI(escapeIllegal(raw));
        } catch (URISyntaxException e) {
            throw new MalformedUrlException(raw, e);
        }
    }

    // Browsers tolerate these in hrefs; java.net.URI does not.
    private static String escapeIllegal(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            switch (c) {
                case ' ' -> sb.append("%20");
                case '"' -> sb.append("%22");
                case '<' -> sb.append("%3C");
                case '>' -> sb.append("%3E");
                case '^' -> sb.append("%5E");
                case '`' -> sb.append("%60");
                case '{' -> sb.append("%7B");
                case '|' -> sb.append("%7C");
                case '}' -> sb.append("%7D");
                case '\\' -> sb.append('/');
                case '%' -> sb.append(isHexEscape(raw, i) ? "%" : "%25");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isHexEscape(String s, int i) {
        return i + 2 < s.length()
                && Character.digit(s.charAt(i + 1), 16) >= 0
                && Character.digit(s.charAt(i + 2), 16) >= 0;
    }

    private static String removeDotSegments(String path) {
        if (path == null || path.isEmpty()) return "/";
        if (!path.startsWith("/")) path = "/" + path;
        String[] parts = path.split("/", -1);
        List<String> out = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            String p = parts[i];
            boolean last = i == parts.length - 1;
            if (p.equals(".")) {
                if (last) out.add("");
            } else if (p.equals("..")) {
                if (!out.isEmpty()) out.remove(out.size() - 1);
                if (last) out.add("");
            } else {
                out.add(p);
            }
        }
        return "/" + String.join("/", out);
    }
}
