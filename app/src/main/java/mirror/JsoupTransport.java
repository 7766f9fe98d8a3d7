package mirror;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.time.Duration;

// HttpTransport backed by jsoup's connection.
public class JsoupTransport implements HttpTransport {

    private final String userAgent;

    public JsoupTransport(String userAgent) {
        this.userAgent = userAgent;
    }

    @Override
    public HttpResponse fetch(String location, Duration timeout) throws IOException {
        Connection connection;
        try {
            connection = Jsoup.connect(location);
        } catch (IllegalArgumentException e) {
            // jsoup rejects malformed URLs up front
            throw new IOException(e.getMessage(), e);
        }

        Connection.Response res = connection
                .userAgent(userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .timeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .method(Connection.Method.GET)
                // redirects are counted and scope-checked by PageFetcher
                .followRedirects(false)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(0)
                .execute();

        return new HttpResponse(res.statusCode(), res.headers(), res.bodyAsBytes());
    }
}
