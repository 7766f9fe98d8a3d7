package mirror;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UrlNormalizerTest {

    @Test
    void stripsFragmentAndLowercasesSchemeAndHost() throws Exception {
        assertEquals("http://ex.com/Path", UrlNormalizer.normalize("HTTP://Ex.COM/Path#frag"));
    }

    @Test
    void removesDefaultPortsOnly() throws Exception {
        assertEquals("http://ex.com/a", UrlNormalizer.normalize("http://ex.com:80/a"));
        assertEquals("https://ex.com/", UrlNormalizer.normalize("https://ex.com:443"));
        assertEquals("http://ex.com:8080/a", UrlNormalizer.normalize("http://ex.com:8080/a"));
    }

    @Test
    void trailingSlashFormsAreEquivalent() throws Exception {
        assertEquals("http://ex.com/", UrlNormalizer.normalize("http://ex.com"));
        assertEquals("http://ex.com/", UrlNormalizer.normalize("http://ex.com/"));
        assertEquals(UrlNormalizer.normalize("http://ex.com/a"), UrlNormalizer.normalize("http://ex.com/a/"));
    }

    @Test
    void resolvesRelativeReferences() throws Exception {
        String base = "http://ex.com/dir/page.html";
        assertEquals("http://ex.com/img/a.png", UrlNormalizer.normalize(base, "../img/a.png"));
        assertEquals("http://ex.com/dir/other", UrlNormalizer.normalize(base, "other"));
        assertEquals("http://ex.com/dir/page.html?q=1", UrlNormalizer.normalize(base, "?q=1"));
        assertEquals("http://other.com/x", UrlNormalizer.normalize(base, "//other.com/x"));
        assertEquals("http://ex.com/a", UrlNormalizer.normalize("http://ex.com", "a"));
        assertEquals("http://ex.com/dir/page.html", UrlNormalizer.normalize(base, "#section"));
    }

    @Test
    void resolveKeepsTheWrittenPath() throws Exception {
        assertEquals("http://ex.com/docs/", UrlNormalizer.resolve("http://ex.com/", "/docs/#top"));
        assertEquals("http://ex.com/docs", UrlNormalizer.normalize("http://ex.com/", "/docs/#top"));
    }

    @Test
    void normalizationIsIdempotent() throws Exception {
        List<String> urls = List.of(
                "http://ex.com",
                "HTTPS://EX.com:443/./a/../b/",
                "http://ex.com/a%20b/?x=1#f",
                "http://ex.com/a b",
                "http://ex.com/100%zz",
                "http://ex.com/café/menü",
                "http://ex.com:8080//double//slash/",
                "http://ex.com/?");
        for (String u : urls) {
            String once = UrlNormalizer.normalize(u);
            assertEquals(once, UrlNormalizer.normalize(once), "not idempotent for " + u);
        }
    }

    @Test
    void rejectsMalformedAndUnsupportedReferences() {
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("mailto:someone@ex.com"));
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("http://ex.com/", "javascript:void(0)"));
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("http://ex.com/", "http://[bad"));
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("relative/only"));
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("http://ex.com/", "  "));
    }

    @Test
    void sameOriginScope() {
        String root = "http://ex.com/";
        assertTrue(UrlNormalizer.inScope("http://ex.com/a", root, Scope.SAME_ORIGIN));
        assertFalse(UrlNormalizer.inScope("http://other.com/x", root, Scope.SAME_ORIGIN));
        assertFalse(UrlNormalizer.inScope("https://ex.com/a", root, Scope.SAME_ORIGIN));
        assertFalse(UrlNormalizer.inScope("http://ex.com:8080/a", root, Scope.SAME_ORIGIN));
        assertFalse(UrlNormalizer.inScope("http://blog.ex.com/a", root, Scope.SAME_ORIGIN));
    }

    @Test
    void subdomainScopeIgnoresLeadingWww() {
        String root = "http://www.ex.com/";
        assertTrue(UrlNormalizer.inScope("http://ex.com/a", root, Scope.SAME_HOST_SUBDOMAINS));
        assertTrue(UrlNormalizer.inScope("http://blog.ex.com/a", root, Scope.SAME_HOST_SUBDOMAINS));
        assertFalse(UrlNormalizer.inScope("http://notex.com/a", root, Scope.SAME_HOST_SUBDOMAINS));
        assertFalse(UrlNormalizer.inScope("https://blog.ex.com/a", root, Scope.SAME_HOST_SUBDOMAINS));
    }
}
