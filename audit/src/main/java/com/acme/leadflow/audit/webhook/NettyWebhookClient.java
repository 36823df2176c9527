package com.acme.leadflow.audit.webhook;

import com.acme.leadflow.audit.util.AuditDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
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
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.ReferenceCountUtil;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Netty HTTP/1.1 client for webhook and chat alert delivery. One connection per request,
 * {@code Connection: close}. TLS uses the JDK trust store with HTTPS hostname verification.
 */
public final class NettyWebhookClient implements WebhookClient {
    private static final String USER_AGENT = "leadflow-audit-webhook/1";

    private final EventLoopGroup ioGroup;
    private final Bootstrap bootstrap;
    private final SslContext sslContext;
    private final Semaphore inFlight;

    public NettyWebhookClient() {
        this(256, 2);
    }

    public NettyWebhookClient(int maxInFlight, int ioThreads) {
        this.inFlight = new Semaphore(Math.max(1, maxInFlight));
        this.ioGroup = new NioEventLoopGroup(Math.max(1, ioThreads));
        this.bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, AuditDefaults.DEFAULT_CONNECT_TIMEOUT_MS);
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }
    }

    @Override
    public CompletableFuture<Integer> post(URI target, byte[] body, String contentType, int timeoutMillis) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(body, "body");
        CompletableFuture<Integer> result = new CompletableFuture<>();
        String host = target.getHost();
        if (host == null) {
            result.completeExceptionally(new IllegalArgumentException("target host required"));
            return result;
        }
        if (!inFlight.tryAcquire()) {
            result.completeExceptionally(new IllegalStateException("too many in-flight webhook requests"));
            return result;
        }
        int port = resolvePort(target);
        boolean https = isHttps(target);
        AtomicReference<ScheduledFuture<?>> timeoutRef = new AtomicReference<>();
        AtomicReference<Channel> channelRef = new AtomicReference<>();

        result.whenComplete((ignored, error) -> {
            ScheduledFuture<?> timeout = timeoutRef.getAndSet(null);
            if (timeout != null) {
                timeout.cancel(false);
            }
            Channel ch = channelRef.get();
            if (ch != null) {
                ch.close();
            }
            inFlight.release();
        });

        Bootstrap perRequest = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                if (https) {
                    p.addLast(newSslHandler(ch, host, port));
                }
                p.addLast(new HttpClientCodec());
                p.addLast(new HttpObjectAggregator(AuditDefaults.WEBHOOK_RESPONSE_LIMIT));
                p.addLast(new ResponseHandler(result));
            }
        });

        ChannelFuture connect = perRequest.connect(host, port);
        Channel channel = connect.channel();
        channelRef.set(channel);
        ScheduledFuture<?> timeout = channel.eventLoop().schedule(
            () -> result.completeExceptionally(new TimeoutException("webhook response timeout")),
            Math.max(1, timeoutMillis),
            TimeUnit.MILLISECONDS
        );
        timeoutRef.set(timeout);
        if (result.isDone() && timeoutRef.compareAndSet(timeout, null)) {
            timeout.cancel(false);
        }

        connect.addListener((ChannelFutureListener) connectFuture -> {
            if (!connectFuture.isSuccess()) {
                result.completeExceptionally(connectFuture.cause());
                return;
            }
            FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.POST,
                pathAndQuery(target),
                Unpooled.wrappedBuffer(body)
            );
            req.headers().set(HttpHeaderNames.HOST, hostHeader(target));
            req.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            req.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
            req.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
            req.headers().set(HttpHeaderNames.USER_AGENT, USER_AGENT);
            connectFuture.channel().writeAndFlush(req).addListener((ChannelFutureListener) writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    ReferenceCountUtil.safeRelease(req);
                    result.completeExceptionally(writeFuture.cause());
                }
            });
        });
        return result;
    }

    private SslHandler newSslHandler(Channel ch, String host, int port) {
        SslHandler handler = sslContext.newHandler(ch.alloc(), host, port);
        SSLEngine engine = handler.engine();
        SSLParameters params = engine.getSSLParameters();
        params.setEndpointIdentificationAlgorithm("HTTPS");
        engine.setSSLParameters(params);
        return handler;
    }

    @Override
    public void close() {
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<Integer> result;

        private ResponseHandler(CompletableFuture<Integer> result) {
            this.result = result;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            result.complete(msg.status().code());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!result.isDone()) {
                result.completeExceptionally(new IllegalStateException("webhook closed before response"));
            }
            ctx.fireChannelInactive();
        }
    }

    static boolean isHttps(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    static int resolvePort(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return isHttps(uri) ? AuditDefaults.HTTPS_DEFAULT_PORT : AuditDefaults.HTTP_DEFAULT_PORT;
    }

    static String pathAndQuery(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            return path + "?" + uri.getRawQuery();
        }
        return path;
    }

    static String hostHeader(URI uri) {
        int port = resolvePort(uri);
        boolean https = isHttps(uri);
        if ((https && port == AuditDefaults.HTTPS_DEFAULT_PORT) || (!https && port == AuditDefaults.HTTP_DEFAULT_PORT)) {
            return uri.getHost();
        }
        return uri.getHost() + ":" + port;
    }
}
