package net.spookly.i2ptunnel.routing;

/**
 * Base type for every failure surfaced by {@link RequestRouter#route}.
 */
public class RouteException extends Exception {
    public RouteException(String message) {
        super(message);
    }

    public RouteException(String message, Throwable cause) {
        super(message, cause);
    }
}
