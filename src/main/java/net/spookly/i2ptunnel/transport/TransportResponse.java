package net.spookly.i2ptunnel.transport;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Status, headers and (unless streamed) the full body of a response. Header names are lower case.
 * The body array is shared with the transport that produced it and must be treated as read-only;
 * responses leaving the router are copied by {@code RoutedResponse}.
 */
@Getter
@Accessors(fluent = true)
public final class TransportResponse {
    private final int status;
    private final Map<String, String> headers;
    private final byte[] body;
    private final boolean streamed;

    public TransportResponse(int status, Map<String, String> headers, byte[] body, boolean streamed) {
        this.status = status;
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? new byte[0] : body;
        this.streamed = streamed;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
