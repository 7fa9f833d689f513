package de.bsommerfeld.sysml.sql.api;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A received HTTP response.
 *
 * @param status  status code
 * @param headers header values by name, as sent by the server
 * @param body    raw body bytes
 * @param uri     the URI that was requested
 */
public record ApiResponse(int status, Map<String, List<String>> headers, byte[] body, URI uri) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    /** All values of a header, matched case-insensitively, in received order. */
    public List<String> headerValues(String name) {
        List<String> values = new ArrayList<>();
        headers.forEach((key, list) -> {
            if (key != null && key.equalsIgnoreCase(name)) {
                values.addAll(list);
            }
        });
        return values;
    }
}
