package mirror;

// Tokenizes a document into the raw references it contains. Implementations must not throw on
// bad input; they report trouble through ParseResult#error().
public interface LinkParser {

    // charset comes from the Content-Type header; null means detect it
    ParseResult parseLinks(byte[] content, String charset);
}
