package mirror;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

// Pulls page and asset references out of HTML with jsoup.
public class HtmlLinkParser implements LinkParser {

    static final String PAGE_SELECTOR = "a[href], area[href], iframe[src], frame[src]";
    static final String ASSET_SELECTOR =
            "img[src], script[src], source[src], video[src], audio[src], embed[src], input[src], link[href]";

    private static final Set<String> ASSET_RELS =
            Set.of("stylesheet", "icon", "apple-touch-icon", "mask-icon", "preload", "manifest");

    @Override
    public ParseResult parseLinks(byte[] content, String charset) {
        List<ParsedLink> links = new ArrayList<>();
        try {
            Document doc = Jsoup.parse(new ByteArrayInputStream(content), charset, "");

            for (Element el : doc.select(PAGE_SELECTOR)) {
                links.add(new ParsedLink(el.attr(refAttribute(el)), false));
            }
            for (Element el : doc.select(ASSET_SELECTOR)) {
                if (el.normalName().equals("link") && !isAssetLink(el)) continue;
                links.add(new ParsedLink(el.attr(refAttribute(el)), true));
            }
            for (Element style : doc.select("style")) {
                for (String ref : CssLinkParser.findReferences(style.data())) {
                    links.add(new ParsedLink(ref, true));
                }
            }
            return ParseResult.ok(links);
        } catch (IOException | RuntimeException e) {
            return ParseResult.partial(links, e.getMessage());
        }
    }

    static String refAttribute(Element el) {
        return el.hasAttr("href") ? "href" : "src";
    }

    // <link rel="canonical"> and friends are metadata, not something to download.
    static boolean isAssetLink(Element link) {
        for (String rel : link.attr("rel").toLowerCase(Locale.ROOT).split("\\s+")) {
            if (ASSET_RELS.contains(rel)) return true;
        }
        return false;
    }
}
