package mirror;

// A raw reference as written in the document. Assets are things a page embeds (css, js, images).
public record ParsedLink(String ref, boolean asset) { }
