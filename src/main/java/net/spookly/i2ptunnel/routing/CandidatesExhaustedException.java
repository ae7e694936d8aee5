package net.spookly.i2ptunnel.routing;

/**
 * Every ranked candidate failed with a connectivity error.
 */
public class CandidatesExhaustedException extends RouteException {
    private final int attempts;

    public CandidatesExhaustedException(int attempts, Throwable lastFailure) {
        super("All " + attempts + " proxy candidate(s) failed"
                + (lastFailure == null ? "" : ": " + lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    public Throwable lastFailure() {
        return getCause();
    }
}
