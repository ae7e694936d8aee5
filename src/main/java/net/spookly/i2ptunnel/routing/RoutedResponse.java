package net.spookly.i2ptunnel.routing;

import java.util.Map;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.i2ptunnel.transport.TransportResponse;

/**
 * Response delivered through a proxy, with the identity of the proxy that served it.
 * Any HTTP status is a successful routing outcome.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class RoutedResponse {
    private final int status;
    private final Map<String, String> headers;
    @Getter(AccessLevel.NONE)
    private final byte[] body;
    private final String proxyUsed;
    private final boolean streamed;

    /**
     * A copy of the buffered body. Empty when {@link #streamed()} is true; the body went to the
     * caller's consumer instead.
     */
    public byte[] body() {
        return body.clone();
    }

    static RoutedResponse from(TransportResponse response, String proxyUsed) {
        return new RoutedResponse(
                response.status(),
                response.headers(),
                response.body(),
                proxyUsed,
                response.streamed()
        );
    }
}
