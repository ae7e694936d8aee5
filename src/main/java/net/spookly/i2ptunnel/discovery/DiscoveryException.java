package net.spookly.i2ptunnel.discovery;

/**
 * The directory page could not be fetched. Finding no proxies is not an error.
 */
public class DiscoveryException extends Exception {
    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
