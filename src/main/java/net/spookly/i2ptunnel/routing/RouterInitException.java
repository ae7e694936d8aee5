package net.spookly.i2ptunnel.routing;

/**
 * The overlay router could not be initialised or started. Fatal for the current request.
 */
public class RouterInitException extends RouteException {
    private final int code;

    public RouterInitException(String stage, int code) {
        super("Overlay router " + stage + " failed with code " + code);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
