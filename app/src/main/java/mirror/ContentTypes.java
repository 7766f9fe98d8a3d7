package mirror;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;

// Helpers for Content-Type headers.
public final class ContentTypes {

    private ContentTypes() {
    }

    // Media type without parameters, lower-case; guessed from the location's extension when missing.
    public static String mediaType(String contentType, String location) {
        if (contentType != null && !contentType.isBlank()) {
            int semi = contentType.indexOf(';');
            String type = semi >= 0 ? contentType.substring(0, semi) : contentType;
            return type.trim().toLowerCase(Locale.ROOT);
        }
        String path = location == null ? "" : location.toLowerCase(Locale.ROOT);
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        if (path.endsWith(".css")) return "text/css";
        if (path.endsWith(".html") || path.endsWith(".htm")) return "text/html";
        return "application/octet-stream";
    }

    public static boolean isHtml(String mediaType) {
        return "text/html".equals(mediaType) || "application/xhtml+xml".equals(mediaType);
    }

    public static boolean isCss(String mediaType) {
        return "text/css".equals(mediaType);
    }

    // charset parameter, or null when the header has none or names a charset this JVM lacks
    // (parsers then sniff the document themselves)
    public static String charset(String contentType) {
        if (contentType == null) return null;
        for (String param : contentType.split(";")) {
            String p = param.trim();
            if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                String cs = p.substring(8).trim();
                if (cs.length() >= 2 && (cs.startsWith("\"") || cs.startsWith("'"))) {
                    cs = cs.substring(1, cs.length() - 1);
                }
                return isSupported(cs) ? cs : null;
            }
        }
        return null;
    }

    private static boolean isSupported(String charset) {
        if (charset.isEmpty()) return false;
        try {
            return Charset.isSupported(charset);
        } catch (IllegalCharsetNameException e) {
            return false;
        }
    }
}
