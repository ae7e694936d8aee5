package net.spookly.i2ptunnel.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.proxy.HttpProxyHandler;
import io.netty.handler.proxy.ProxyConnectionEvent;
import io.netty.handler.proxy.ProxyHandler;
import io.netty.handler.proxy.Socks5ProxyHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import io.netty.resolver.NoopAddressResolverGroup;
import io.netty.util.concurrent.ScheduledFuture;
import net.spookly.i2ptunnel.util.HostPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Netty based HTTP/1.1 client that reaches the origin directly, through a forward proxy,
 * through a CONNECT tunnel or through SOCKS5. One connection per request.
 */
public final class NettyHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(NettyHttpTransport.class);
    private static final int DEFAULT_MAX_CONTENT_LENGTH = 64 * 1024 * 1024;
    private static final String USER_AGENT = "i2ptunnel/0.1";

    private final EventLoopGroup workerGroup;
    private final boolean ownsGroup;
    private final SslContext sslContext;
    private final int maxContentLength;

    public NettyHttpTransport() {
        this(new NioEventLoopGroup(0, threadFactory()), true, DEFAULT_MAX_CONTENT_LENGTH);
    }

    /**
     * Create a transport on a shared event loop group; the caller keeps ownership of the group.
     */
    public NettyHttpTransport(EventLoopGroup workerGroup) {
        this(workerGroup, false, DEFAULT_MAX_CONTENT_LENGTH);
    }

    private NettyHttpTransport(EventLoopGroup workerGroup, boolean ownsGroup, int maxContentLength) {
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.ownsGroup = ownsGroup;
        this.maxContentLength = maxContentLength;
        this.sslContext = buildSslContext();
    }

    @Override
    public CompletableFuture<TransportResponse> execute(ProxyRoute route,
                                                        OutboundRequest request,
                                                        Duration timeout,
                                                        BodyConsumer bodyConsumer) {
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");
        CompletableFuture<TransportResponse> result = new CompletableFuture<>();
        String scheme = request.uri().getScheme();
        if (request.host() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            result.completeExceptionally(new TransportException(FailureKind.PROTOCOL, route,
                    "Unsupported request target: " + request.uri()));
            return result;
        }
        // A forward proxy cannot carry TLS to the origin; tunnel instead.
        ProxyRoute effective = route.mode() == ProxyRoute.Mode.HTTP_FORWARD && request.encrypted()
                ? ProxyRoute.httpConnect(route.proxy())
                : route;
        long timeoutMs = Math.max(1L, timeout.toMillis());
        ProxyHandler proxyHandler = proxyHandler(effective, timeoutMs);
        ResponseHandler handler = new ResponseHandler(effective, request, result,
                bodyConsumer == null ? BodyConsumer.NOOP : bodyConsumer, proxyHandler != null);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMs))
                .resolver(effective.tunnels() ? NoopAddressResolverGroup.INSTANCE : DefaultAddressResolverGroup.INSTANCE)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (proxyHandler != null) {
                            pipeline.addLast("proxy", proxyHandler);
                        }
                        pipeline.addLast("read-timeout", new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS));
                        pipeline.addLast("codec", new HttpClientCodec());
                        if (!request.stream()) {
                            pipeline.addLast("aggregator", new HttpObjectAggregator(maxContentLength));
                        }
                        pipeline.addLast("handler", handler);
                    }
                });

        InetSocketAddress remote = effective.mode() == ProxyRoute.Mode.HTTP_FORWARD
                ? effective.proxy().toSocketAddress()
                : InetSocketAddress.createUnresolved(request.host(), request.port());
        log.debug("Connecting {} via {}", request, effective);
        ChannelFuture connectFuture = bootstrap.connect(remote);
        ScheduledFuture<?> deadline = workerGroup.next().schedule(
                () -> handler.fail(new TransportException(FailureKind.TIMEOUT, effective,
                        "Request timed out after " + timeoutMs + "ms")),
                timeoutMs,
                TimeUnit.MILLISECONDS);
        result.whenComplete((response, error) -> {
            deadline.cancel(false);
            if (error != null) {
                connectFuture.channel().close();
            }
        });
        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                handler.fail(new TransportException(FailureClassifier.classify(future.cause()), effective,
                        "Connect to " + remote + " failed: " + future.cause().getMessage(), future.cause()));
            }
        });
        return result;
    }

    @Override
    public void close() {
        if (!ownsGroup) {
            return;
        }
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private static ProxyHandler proxyHandler(ProxyRoute route, long timeoutMs) {
        ProxyHandler handler;
        switch (route.mode()) {
            case HTTP_CONNECT:
                handler = new HttpProxyHandler(resolved(route.proxy()));
                break;
            case SOCKS5:
                handler = new Socks5ProxyHandler(resolved(route.proxy()));
                break;
            default:
                return null;
        }
        handler.setConnectTimeoutMillis(timeoutMs);
        return handler;
    }

    private static InetSocketAddress resolved(HostPort proxy) {
        return new InetSocketAddress(proxy.host(), proxy.port());
    }

    private static FullHttpRequest buildRequest(ProxyRoute route, OutboundRequest request) {
        String target = route.mode() == ProxyRoute.Mode.HTTP_FORWARD
                ? absoluteForm(request)
                : originForm(request.uri());
        ByteBuf content = Unpooled.wrappedBuffer(request.body());
        DefaultFullHttpRequest message = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.valueOf(request.method()),
                target,
                content
        );
        HttpHeaders headers = message.headers();
        headers.set(HttpHeaderNames.HOST, hostHeader(request));
        headers.set(HttpHeaderNames.USER_AGENT, USER_AGENT);
        headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            headers.set(header.getKey(), header.getValue());
        }
        if (content.isReadable() || expectsBody(request.method())) {
            headers.set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        }
        return message;
    }

    private static boolean expectsBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }

    private static String originForm(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    private static String absoluteForm(OutboundRequest request) {
        URI uri = request.uri();
        return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + hostHeader(request) + originForm(uri);
    }

    private static String hostHeader(OutboundRequest request) {
        int defaultPort = request.encrypted() ? 443 : 80;
        String host = request.host();
        if (host.indexOf(':') >= 0 && !host.startsWith("[")) {
            host = "[" + host + "]";
        }
        return request.port() == defaultPort ? host : host + ":" + request.port();
    }

    private static Map<String, String> copyHeaders(HttpHeaders headers) {
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> header : headers) {
            copy.merge(header.getKey().toLowerCase(Locale.ROOT), header.getValue(), (left, right) -> left + ", " + right);
        }
        return copy;
    }

    private static SslContext buildSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to build client TLS context", e);
        }
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "i2ptunnel-transport-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Sends the request once the tunnel (and TLS, for https) is up and collects the response.
     */
    private final class ResponseHandler extends SimpleChannelInboundHandler<HttpObject> {
        private final ProxyRoute route;
        private final OutboundRequest request;
        private final CompletableFuture<TransportResponse> result;
        private final BodyConsumer bodyConsumer;
        private final boolean awaitProxy;
        private final AtomicBoolean bodyFinished = new AtomicBoolean(false);

        private ResponseHandler(ProxyRoute route,
                                OutboundRequest request,
                                CompletableFuture<TransportResponse> result,
                                BodyConsumer bodyConsumer,
                                boolean awaitProxy) {
            this.route = route;
            this.request = request;
            this.result = result;
            this.bodyConsumer = bodyConsumer;
            this.awaitProxy = awaitProxy;
        }

        void fail(TransportException error) {
            if (result.completeExceptionally(error)) {
                return;
            }
            if (request.stream() && bodyFinished.compareAndSet(false, true)) {
                bodyConsumer.onError(error);
            }
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            if (!awaitProxy) {
                onTunnelReady(ctx);
            }
            super.channelActive(ctx);
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof ProxyConnectionEvent) {
                onTunnelReady(ctx);
            } else if (evt instanceof SslHandshakeCompletionEvent) {
                SslHandshakeCompletionEvent handshake = (SslHandshakeCompletionEvent) evt;
                if (handshake.isSuccess()) {
                    sendRequest(ctx);
                } else {
                    fail(new TransportException(FailureKind.TLS, route,
                            "TLS handshake with " + request.host() + " failed", handshake.cause()));
                    ctx.close();
                }
            }
            super.userEventTriggered(ctx, evt);
        }

        private void onTunnelReady(ChannelHandlerContext ctx) {
            if (request.encrypted()) {
                SslHandler sslHandler = sslContext.newHandler(ctx.alloc(), request.host(), request.port());
                ctx.pipeline().addBefore("codec", "ssl", sslHandler);
                return;
            }
            sendRequest(ctx);
        }

        private void sendRequest(ChannelHandlerContext ctx) {
            ctx.writeAndFlush(buildRequest(route, request)).addListener(future -> {
                if (!future.isSuccess()) {
                    fail(new TransportException(FailureClassifier.classify(future.cause()), route,
                            "Failed to send request: " + future.cause().getMessage(), future.cause()));
                }
            });
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, HttpObject msg) {
            if (msg.decoderResult().isFailure()) {
                fail(new TransportException(FailureKind.PROTOCOL, route,
                        "Malformed response from " + request.host(), msg.decoderResult().cause()));
                ctx.close();
                return;
            }
            if (!request.stream() && msg instanceof FullHttpResponse) {
                FullHttpResponse response = (FullHttpResponse) msg;
                result.complete(new TransportResponse(
                        response.status().code(),
                        copyHeaders(response.headers()),
                        ByteBufUtil.getBytes(response.content()),
                        false
                ));
                ctx.close();
                return;
            }
            if (msg instanceof HttpResponse) {
                HttpResponse response = (HttpResponse) msg;
                result.complete(new TransportResponse(
                        response.status().code(),
                        copyHeaders(response.headers()),
                        new byte[0],
                        true
                ));
            }
            if (msg instanceof HttpContent) {
                ByteBuf content = ((HttpContent) msg).content();
                if (content.isReadable() && !bodyFinished.get()) {
                    bodyConsumer.onChunk(ByteBufUtil.getBytes(content));
                }
                if (msg instanceof LastHttpContent) {
                    if (bodyFinished.compareAndSet(false, true)) {
                        bodyConsumer.onComplete();
                    }
                    ctx.close();
                }
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            FailureKind kind = FailureClassifier.classify(cause);
            log.debug("Request {} via {} failed ({})", request, route, kind, cause);
            fail(new TransportException(kind, route, describe(cause), cause));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            fail(new TransportException(FailureKind.RESET, route,
                    "Connection closed before the response completed"));
            super.channelInactive(ctx);
        }

        private String describe(Throwable cause) {
            Throwable root = FailureClassifier.unwrap(cause);
            String message = root == null ? null : root.getMessage();
            return message == null ? String.valueOf(root) : message;
        }
    }
}
