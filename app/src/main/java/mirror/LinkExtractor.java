package mirror;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static mirror.MirrorLogger.LOGGER;

// Turns fetched bytes into canonical, scoped link targets. Tokenizing is delegated to a
// LinkParser; this class resolves, canonicalizes and sorts what the parser returns.
public class LinkExtractor {

    private final String rootUrl;
    private final Scope scope;
    private final boolean includeAssets;
    private final LinkParser htmlParser;
    private final LinkParser cssParser;

    public LinkExtractor(String rootUrl, Scope scope, boolean includeAssets) {
        this(rootUrl, scope, includeAssets, new HtmlLinkParser(), new CssLinkParser());
    }

    public LinkExtractor(String rootUrl, Scope scope, boolean includeAssets,
                         LinkParser htmlParser, LinkParser cssParser) {
        this.rootUrl = rootUrl;
        this.scope = scope;
        this.includeAssets = includeAssets;
        this.htmlParser = htmlParser;
        this.cssParser = cssParser;
    }

    public ExtractedLinks extractLinks(String contentType, byte[] body, String baseUrl) {
        String mediaType = ContentTypes.mediaType(contentType, baseUrl);
        LinkParser parser;
        if (ContentTypes.isHtml(mediaType)) parser = htmlParser;
        else if (ContentTypes.isCss(mediaType)) parser = cssParser;
        else return ExtractedLinks.empty();

        ParseResult parsed = parser.parseLinks(body, ContentTypes.charset(contentType));
        if (!parsed.isComplete()) {
            LOGGER.warn("Partial link extraction for {}: {}", baseUrl, parsed.error());
        }

        Map<String, String> inScope = new LinkedHashMap<>();
        Set<String> outOfScope = new LinkedHashSet<>();
        Set<String> filtered = new LinkedHashSet<>();
        List<String> malformed = new ArrayList<>();

        for (ParsedLink link : parsed.links()) {
            String ref = UrlUtil.cleanHref(link.ref());
            if (ref == null || !UrlUtil.isNavigable(ref)) continue;

            String canonical;
            String location;
            try {
                canonical = UrlNormalizer.normalize(baseUrl, ref);
                location = UrlNormalizer.resolve(baseUrl, ref);
            } catch (MalformedUrlException e) {
                malformed.add(ref);
                continue;
            }

            if (!UrlNormalizer.inScope(canonical, rootUrl, scope)) {
                outOfScope.add(canonical);
            } else if (link.asset() && !includeAssets) {
                filtered.add(canonical);
            } else {
                inScope.putIfAbsent(canonical, location);
            }
        }
        // also linked as a page somewhere in the document
        filtered.removeAll(inScope.keySet());

        return new ExtractedLinks(inScope, outOfScope, filtered, malformed, !parsed.isComplete());
    }
}
