package mirror;

import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static mirror.MirrorLogger.LOGGER;

// Writes mirrored documents to disk with their links rewritten.
// Each write goes to a temp file next to the target and is moved into place, so a file under the
// output directory is either absent or complete. Calls for distinct URLs may run concurrently.
public class MirrorStore {

    private static final String[] LINK_ATTRIBUTES = {"href", "src"};

    private final LocalPathMapper mapper;
    private final LinkRewriter rewriter;

    public MirrorStore(LocalPathMapper mapper, LinkRewriter rewriter) {
        this.mapper = mapper;
        this.rewriter = rewriter;
    }

    // baseUrl is where the bytes came from (after redirects); contentType may be null.
    public MirroredPage persist(String url, String baseUrl, String contentType, byte[] body) throws IOException {
        Path target = mapper.path(url);
        String mediaType = ContentTypes.mediaType(contentType, baseUrl);
        String charset = ContentTypes.charset(contentType);

        byte[] content = body;
        if (ContentTypes.isHtml(mediaType)) {
            content = rewriteHtml(body, charset, baseUrl, target);
        } else if (ContentTypes.isCss(mediaType)) {
            Charset cs = CssLinkParser.toCharset(charset);
            content = rewriter.rewriteCss(new String(body, cs), baseUrl, target).getBytes(cs);
        }

        write(target, content);
        return new MirroredPage(url, target, content);
    }

    // Stores a small page for url that forwards to the local copy of an already-known redirect target.
    public MirroredPage persistRedirect(String url, String location) throws IOException {
        Path target = mapper.path(url);
        String link = rewriter.rewrite(location, location, target);

        Document doc = Document.createShell("");
        doc.head().appendElement("meta").attr("http-equiv", "refresh").attr("content", "0; url=" + link);
        doc.body().appendElement("a").attr("href", link).text(link);
        byte[] content = doc.outerHtml().getBytes(StandardCharsets.UTF_8);

        write(target, content);
        return new MirroredPage(url, target, content);
    }

    private byte[] rewriteHtml(byte[] body, String charset, String baseUrl, Path target) {
        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(body), charset, baseUrl);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Could not parse {} for rewriting, storing it unchanged: {}", baseUrl, e.getMessage());
            return body;
        }
        doc.outputSettings().prettyPrint(false);

        // local links are relative to the file, a <base> would redirect them
        doc.select("base[href]").remove();

        for (Element el : doc.select("[href], [src]")) {
            for (String attr : LINK_ATTRIBUTES) {
                if (el.hasAttr(attr)) {
                    el.attr(attr, rewriter.rewrite(el.attr(attr), baseUrl, target));
                }
            }
        }
        for (Element style : doc.select("style")) {
            for (DataNode node : style.dataNodes()) {
                node.setWholeData(rewriter.rewriteCss(node.getWholeData(), baseUrl, target));
            }
        }
        return doc.outerHtml().getBytes(doc.outputSettings().charset());
    }

    private static void write(Path target, byte[] content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".mirror-", ".part");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
