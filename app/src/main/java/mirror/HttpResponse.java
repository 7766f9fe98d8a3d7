package mirror;

import java.util.Map;
import java.util.TreeMap;

// Raw answer from the transport. Header lookup ignores case.
public record HttpResponse(int statusCode, Map<String, String> headers, byte[] body) {

    public HttpResponse {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) copy.putAll(headers);
        headers = copy;
        body = body == null ? new byte[0] : body;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String contentType() {
        return header("Content-Type");
    }
}
