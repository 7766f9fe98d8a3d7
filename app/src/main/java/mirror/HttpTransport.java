package mirror;

import java.io.IOException;
import java.time.Duration;

// One HTTP GET, no redirect following. Any status code is a normal return; only failing to get a
// response at all (timeout, connection, TLS) is an IOException.
public interface HttpTransport {

    HttpResponse fetch(String location, Duration timeout) throws IOException;
}
