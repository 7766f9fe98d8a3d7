package mirror;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Finds url(...) and @import "..." references in stylesheets. Everything a stylesheet references is an asset.
public class CssLinkParser implements LinkParser {

    // url(x), url('x'), url("x")
    static final Pattern URL_PATTERN =
            Pattern.compile("url\\(\\s*(['\"]?)([^)'\"]+)\\1\\s*\\)", Pattern.CASE_INSENSITIVE);
    // @import "x" (the url(...) form is covered above)
    static final Pattern IMPORT_PATTERN =
            Pattern.compile("@import\\s+(['\"])([^'\"]+)\\1", Pattern.CASE_INSENSITIVE);

    @Override
    public ParseResult parseLinks(byte[] content, String charset) {
        List<ParsedLink> links = new ArrayList<>();
        for (String ref : findReferences(new String(content, toCharset(charset)))) {
            links.add(new ParsedLink(ref, true));
        }
        return ParseResult.ok(links);
    }

    static List<String> findReferences(String css) {
        List<String> refs = new ArrayList<>();
        if (css == null || css.isEmpty()) return refs;
        Matcher m = URL_PATTERN.matcher(css);
        while (m.find()) refs.add(m.group(2).trim());
        m = IMPORT_PATTERN.matcher(css);
        while (m.find()) refs.add(m.group(2).trim());
        return refs;
    }

    static Charset toCharset(String charset) {
        if (charset == null) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(charset);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return StandardCharsets.UTF_8;
        }
    }
}
