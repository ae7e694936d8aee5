package net.spookly.i2ptunnel.routing;

public class NoCandidatesException extends RouteException {
    public NoCandidatesException(String message) {
        super(message);
    }
}
