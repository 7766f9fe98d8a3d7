package mirror;

import java.nio.file.Path;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Decides what a reference inside a mirrored document should point at.
// References to URLs the crawl attempted become relative paths to their local file (fragment kept).
// Everything else points at the live site: absolute references stay as written, relative ones are made absolute.
public class LinkRewriter {

    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    private final LocalPathMapper mapper;
    private final Predicate<String> attempted;
    // URL reached by redirect -> URL whose file holds it
    private final UnaryOperator<String> aliases;

    public LinkRewriter(LocalPathMapper mapper, Predicate<String> attempted) {
        this(mapper, attempted, UnaryOperator.identity());
    }

    public LinkRewriter(LocalPathMapper mapper, Predicate<String> attempted, UnaryOperator<String> aliases) {
        this.mapper = mapper;
        this.attempted = attempted;
        this.aliases = aliases;
    }

    public String rewrite(String ref, String baseUrl, Path documentPath) {
        String cleaned = UrlUtil.cleanHref(ref);
        if (cleaned == null || !UrlUtil.isNavigable(cleaned)) return ref;

        try {
            String canonical = UrlNormalizer.normalize(baseUrl, cleaned);
            if (attempted.test(canonical)) {
                return LocalPathMapper.relativeLink(documentPath, mapper.path(aliases.apply(canonical))) + fragmentOf(cleaned);
            }
            if (HAS_SCHEME.matcher(cleaned).find()) return ref;
            return UrlNormalizer.resolve(baseUrl, cleaned) + fragmentOf(cleaned);
        } catch (MalformedUrlException e) {
            return ref;
        }
    }

    // Rewrites url(...) and @import "..." references inside a stylesheet.
    public String rewriteCss(String css, String baseUrl, Path documentPath) {
        String out = replace(CssLinkParser.URL_PATTERN, css, baseUrl, documentPath, "url(", ")");
        return replace(CssLinkParser.IMPORT_PATTERN, out, baseUrl, documentPath, "@import ", "");
    }

    private String replace(Pattern pattern, String css, String baseUrl, Path documentPath, String prefix, String suffix) {
        Matcher m = pattern.matcher(css);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String quote = m.group(1);
            String ref = m.group(2).trim();
            String replacement = prefix + quote + rewrite(ref, baseUrl, documentPath) + quote + suffix;
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String fragmentOf(String ref) {
        int hash = ref.indexOf('#');
        return hash < 0 ? "" : ref.substring(hash);
    }
}
