package mirror;

import java.util.List;

// Links found in a document. A non-null error means parsing stopped early and
// links holds what was found up to that point.
public record ParseResult(List<ParsedLink> links, String error) {

    public ParseResult {
        links = List.copyOf(links);
    }

    public static ParseResult ok(List<ParsedLink> links) {
        return new ParseResult(links, null);
    }

    public static ParseResult partial(List<ParsedLink> links, String error) {
        return new ParseResult(links, error == null ? "parse failed" : error);
    }

    public boolean isComplete() {
        return error == null;
    }
}
