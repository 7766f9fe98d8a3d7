package mirror;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public class UrlUtil {

    private static final String[] NON_NAVIGABLE_PREFIXES = {
            "#", "mailto:", "tel:", "javascript:", "data:", "blob:", "about:"
    };

    private UrlUtil() {
    }

    // Clean up common malformed hrefs before resolving against base URL.
    public static String cleanHref(String href) {
        if (href == null) return null;
        String s = href.trim();
        if (s.isEmpty()) return null;

        // Strip surrounding quotes if present
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            s = s.substring(1, s.length() - 1).trim();
        }

        // Attribute soup like: /page target="_blank"
        int ws = s.indexOf(' ');
        if (ws > 0 && s.indexOf('=', ws) > 0) s = s.substring(0, ws).trim();

        // Drop trailing quote/angle bracket artifacts
        while (s.endsWith("\"") || s.endsWith("'") || s.endsWith(">")) {
            s = s.substring(0, s.length() - 1).trim();
        }

        return s.isEmpty() ? null : s;
    }

    // False for references that never point at a mirrorable resource.
    public static boolean isNavigable(String href) {
        if (href == null || href.isBlank()) return false;
        String s = href.trim().toLowerCase(Locale.ROOT);
        for (String prefix : NON_NAVIGABLE_PREFIXES) {
            if (s.startsWith(prefix)) return false;
        }
        return true;
    }

    // Replace anything a filesystem may reject with underscore.
    public static String sanitizeSegment(String segment) {
        String safe = segment.replaceAll("[^A-Za-z0-9._~-]+", "_");
        // Keep names well under common filename limits.
        int maxBase = 120;
        if (safe.length() > maxBase) {
            safe = safe.substring(0, maxBase) + "_" + shortHash(segment);
        }
        if (safe.equals(".") || safe.equals("..")) safe = "_" + safe;
        return safe.isEmpty() ? "_" : safe;
    }

    // Short hash for filenames to avoid collisions.
    public static String shortHash(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            // 12 hex chars is plenty for collisions to be extremely unlikely here
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
