package net.spookly.i2ptunnel.transport;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.PrematureChannelClosureException;
import io.netty.handler.proxy.ProxyConnectException;
import io.netty.handler.timeout.TimeoutException;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.UnresolvedAddressException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps request failures to a {@link FailureKind}. Exception types decide first; the message is
 * inspected only for plain I/O errors that carry no structured kind.
 */
public final class FailureClassifier {
    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            return FailureKind.PROTOCOL;
        }
        if (cause instanceof TransportException) {
            return ((TransportException) cause).kind();
        }
        if (cause instanceof ProxyConnectException) {
            return FailureKind.PROXY_HANDSHAKE;
        }
        if (cause instanceof ConnectTimeoutException
                || cause instanceof TimeoutException
                || cause instanceof SocketTimeoutException
                || cause instanceof java.util.concurrent.TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (cause instanceof ConnectException
                || cause instanceof NoRouteToHostException
                || cause instanceof PortUnreachableException
                || cause instanceof UnknownHostException
                || cause instanceof UnresolvedAddressException) {
            return FailureKind.CONNECT;
        }
        if (cause instanceof SSLException) {
            return FailureKind.TLS;
        }
        if (cause instanceof ClosedChannelException || cause instanceof PrematureChannelClosureException) {
            return FailureKind.RESET;
        }
        if (cause instanceof DecoderException || cause instanceof IllegalArgumentException) {
            return FailureKind.PROTOCOL;
        }
        FailureKind byMessage = fromMessage(cause.getMessage());
        if (byMessage != null) {
            return byMessage;
        }
        return cause instanceof IOException ? FailureKind.RESET : FailureKind.PROTOCOL;
    }

    /**
     * Strip future and decoder wrappers; a decoder failure caused by TLS is a TLS failure.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current != null && current.getCause() != null && current.getCause() != current) {
            if (current instanceof CompletionException || current instanceof ExecutionException) {
                current = current.getCause();
                continue;
            }
            if (current instanceof DecoderException && current.getCause() instanceof SSLException) {
                current = current.getCause();
                continue;
            }
            break;
        }
        return current;
    }

    private static FailureKind fromMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String text = message.toLowerCase(Locale.ROOT);
        if (text.contains("refused") || text.contains("unreachable") || text.contains("no route")) {
            return FailureKind.CONNECT;
        }
        if (text.contains("timed out") || text.contains("timeout")) {
            return FailureKind.TIMEOUT;
        }
        if (text.contains("reset") || text.contains("broken pipe") || text.contains("connection closed")) {
            return FailureKind.RESET;
        }
        if (text.contains("socks")) {
            return FailureKind.PROXY_HANDSHAKE;
        }
        return null;
    }
}
