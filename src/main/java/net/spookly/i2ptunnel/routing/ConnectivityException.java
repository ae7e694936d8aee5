package net.spookly.i2ptunnel.routing;

import net.spookly.i2ptunnel.transport.TransportException;

/**
 * A single attempt could not reach its target through the chosen proxy.
 */
public class ConnectivityException extends RouteException {
    public ConnectivityException(String message, TransportException cause) {
        super(message, cause);
    }
}
