package mirror;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

// Talks to a real HTTP server on the loopback interface.
public class JsoupTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private HttpServer server;
    private String base;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", exchange -> {
            switch (exchange.getRequestURI().getPath()) {
                case "/" -> send(exchange, 200, "text/html; charset=UTF-8",
                        "<a href='/moved'>moved</a><img src='/pixel.gif'>");
                case "/moved" -> {
                    exchange.getResponseHeaders().add("Location", "/target");
                    exchange.sendResponseHeaders(302, -1);
                    exchange.close();
                }
                case "/target" -> send(exchange, 200, "text/html", "<p>target</p>");
                case "/pixel.gif" -> send(exchange, 200, "image/gif", "GIF89a");
                default -> send(exchange, 404, "text/plain", "nope");
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void send(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void returnsStatusHeadersAndBody() throws IOException {
        HttpResponse res = new JsoupTransport("TestBot").fetch(base + "/target", TIMEOUT);

        assertEquals(200, res.statusCode());
        assertEquals("text/html", res.contentType());
        assertArrayEquals("<p>target</p>".getBytes(StandardCharsets.UTF_8), res.body());
    }

    @Test
    void doesNotFollowRedirects() throws IOException {
        HttpResponse res = new JsoupTransport("TestBot").fetch(base + "/moved", TIMEOUT);

        assertEquals(302, res.statusCode());
        assertEquals("/target", res.header("location"));
    }

    @Test
    void errorStatusIsAResponseNotAnException() throws IOException {
        HttpResponse res = new JsoupTransport("TestBot").fetch(base + "/missing", TIMEOUT);

        assertEquals(404, res.statusCode());
    }

    @Test
    void badUrlIsAnIOException() {
        assertThrows(IOException.class, () -> new JsoupTransport("TestBot").fetch("not a url", TIMEOUT));
    }

    @Test
    void mirrorsALiveServer(@TempDir Path out) throws Exception {
        MirrorConfig config = MirrorConfig.defaults(base + "/", out).withMaxConcurrency(2);

        CrawlReport report = new MirrorCrawler(config, new JsoupTransport("TestBot")).run();

        assertFalse(report.cancelled());
        assertEquals(3, report.fetched());
        assertEquals(0, report.failed());

        Path site = out.resolve("127.0.0.1_" + server.getAddress().getPort());
        String index = Files.readString(site.resolve("index.html"), StandardCharsets.UTF_8);
        assertTrue(index.contains("href=\"moved/index.html\""), index);
        assertTrue(index.contains("src=\"pixel.gif\""), index);
        assertTrue(Files.readString(site.resolve("moved/index.html")).contains("target"));
        assertTrue(Files.exists(site.resolve("pixel.gif")));
    }
}
