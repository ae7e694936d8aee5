package net.spookly.i2ptunnel.transport;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends one HTTP request over one route.
 */
public interface HttpTransport extends AutoCloseable {
    long RESULT_GRACE_MS = 1_000;

    /**
     * Execute the request. The future fails with {@link TransportException} and never blocks past
     * {@code timeout} before status and headers arrive. For streamed requests the future completes
     * on the response head and the body is pushed to {@code bodyConsumer}.
     */
    CompletableFuture<TransportResponse> execute(ProxyRoute route,
                                                 OutboundRequest request,
                                                 Duration timeout,
                                                 BodyConsumer bodyConsumer);

    default CompletableFuture<TransportResponse> execute(ProxyRoute route, OutboundRequest request, Duration timeout) {
        return execute(route, request, timeout, BodyConsumer.NOOP);
    }

    /**
     * Blocking variant of {@link #execute}: waits for status and headers, slightly past the timeout
     * the transport enforces itself, and rethrows every failure as a classified {@link TransportException}.
     */
    default TransportResponse send(ProxyRoute route,
                                   OutboundRequest request,
                                   Duration timeout,
                                   BodyConsumer bodyConsumer) throws TransportException {
        CompletableFuture<TransportResponse> future = execute(route, request, timeout, bodyConsumer);
        try {
            return future.get(timeout.toMillis() + RESULT_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = FailureClassifier.unwrap(e);
            if (cause instanceof TransportException) {
                throw (TransportException) cause;
            }
            throw new TransportException(FailureClassifier.classify(cause), route,
                    String.valueOf(cause.getMessage()), cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransportException(FailureKind.TIMEOUT, route,
                    "Request timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransportException(FailureKind.TIMEOUT, route, "Interrupted while waiting for response", e);
        }
    }

    default TransportResponse send(ProxyRoute route, OutboundRequest request, Duration timeout)
            throws TransportException {
        return send(route, request, timeout, BodyConsumer.NOOP);
    }

    @Override
    default void close() {
    }
}
