package net.spookly.i2ptunnel.routing;

/**
 * The request itself is unusable (bad URI, method or malformed exchange); never retried.
 */
public class ProtocolException extends RouteException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
