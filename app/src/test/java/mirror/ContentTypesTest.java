package mirror;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ContentTypesTest {

    @Test
    void charsetIsReadFromTheHeader() {
        assertEquals("UTF-8", ContentTypes.charset("text/html; charset=UTF-8"));
        assertEquals("iso-8859-1", ContentTypes.charset("text/html;Charset=\"iso-8859-1\""));
        assertNull(ContentTypes.charset("text/html"));
        assertNull(ContentTypes.charset(null));
    }

    @Test
    void charsetsTheJvmCannotDecodeAreDropped() {
        assertNull(ContentTypes.charset("text/html; charset=utf8x"));
        assertNull(ContentTypes.charset("text/html; charset=\"\""));
        assertNull(ContentTypes.charset("text/html; charset=bad name!"));
    }

    @Test
    void mediaTypeFallsBackToTheExtension() {
        assertEquals("text/html", ContentTypes.mediaType("Text/HTML; charset=UTF-8", "http://ex.com/x.css"));
        assertEquals("text/css", ContentTypes.mediaType(null, "http://ex.com/s.css?v=2"));
        assertEquals("application/octet-stream", ContentTypes.mediaType(null, "http://ex.com/blob"));
    }
}
