/*
 * Copyright 2022 - present Maksym Ostroverkhov.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.websock.engine;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.util.concurrent.ScheduledFuture;
import java.nio.channels.ClosedChannelException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Performs webSocket server-side handshake and replaces HTTP codec with {@link WebSocketSession}
 * in channel pipeline. Expects {@link HttpServerCodec} and {@link HttpObjectAggregator} before it.
 * Requests for other paths are passed to next handler.
 */
public final class WebSocketServerProtocolHandler extends ChannelInboundHandlerAdapter {
  private static final Logger logger =
      LoggerFactory.getLogger(WebSocketServerProtocolHandler.class);

  static final String SESSION_HANDLER_NAME = "websocket-session";

  private final String path;
  private final WebSocketHandshaker handshaker;
  private final WebSocketSessionConfig sessionConfig;
  private final long handshakeTimeoutMillis;
  private final WebSocketHandler webSocketHandler;
  private ChannelPromise handshakeCompleted;
  private ScheduledFuture<?> handshakeTimeout;

  public static Builder create() {
    return Builder.create();
  }

  private WebSocketServerProtocolHandler(
      String path,
      WebSocketHandshaker handshaker,
      WebSocketSessionConfig sessionConfig,
      long handshakeTimeoutMillis,
      WebSocketHandler webSocketHandler) {
    this.path = path;
    this.handshaker = handshaker;
    this.sessionConfig = sessionConfig;
    this.handshakeTimeoutMillis = handshakeTimeoutMillis;
    this.webSocketHandler = webSocketHandler;
  }

  /** @return future completed once upgrade response is written, or failed on rejection */
  public ChannelFuture handshakeCompleted() {
    ChannelPromise completed = handshakeCompleted;
    if (completed == null) {
      throw new IllegalStateException("handshakeCompleted() must be called after handlerAdded()");
    }
    return completed;
  }

  @Override
  public void handlerAdded(ChannelHandlerContext ctx) {
    ChannelPromise completed = handshakeCompleted = ctx.newPromise();
    handshakeTimeout = startHandshakeTimeout(ctx, handshakeTimeoutMillis, completed);
  }

  @Override
  public void handlerRemoved(ChannelHandlerContext ctx) {
    cancelHandshakeTimeout();
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    ChannelPromise completed = handshakeCompleted;
    if (!completed.isDone()) {
      completed.tryFailure(new ClosedChannelException());
    }
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    if (handshakeCompleted.tryFailure(cause)) {
      cancelHandshakeTimeout();
      logger.debug("webSocket {} handshake failed", ctx.channel(), cause);
      ctx.close();
      return;
    }
    ctx.fireExceptionCaught(cause);
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
    if (msg instanceof FullHttpRequest) {
      FullHttpRequest request = (FullHttpRequest) msg;
      HandshakeRequest handshakeRequest = HandshakeRequest.from(request);
      if (!path.equals(handshakeRequest.path())) {
        super.channelRead(ctx, msg);
        return;
      }
      try {
        completeHandshake(ctx, request.uri(), handshakeRequest);
      } finally {
        request.release();
      }
      return;
    }
    super.channelRead(ctx, msg);
  }

  private void completeHandshake(
      ChannelHandlerContext ctx, String uri, HandshakeRequest request) {
    ChannelPromise handshake = handshakeCompleted;
    HandshakeResult result = handshaker.negotiate(request);
    if (!result.isAccepted()) {
      cancelHandshakeTimeout();
      webSocketHandler.onHandshakeRejected(request, result);
      logger.debug("webSocket {} handshake rejected: {}", ctx.channel(), result);
      ctx.writeAndFlush(result.toHttpResponse()).addListener(ChannelFutureListener.CLOSE);
      handshake.tryFailure(new WebSocketHandshakeException(result.reason()));
      return;
    }

    ChannelPipeline p = ctx.pipeline();
    ChannelHandlerContext httpCodecCtx = p.context(HttpServerCodec.class);
    if (httpCodecCtx == null) {
      throw new IllegalStateException("no HttpServerCodec in channel pipeline");
    }
    WebSocketSession session = new WebSocketSession(sessionConfig);
    WebSocketListener listener;
    try {
      listener =
          Objects.requireNonNull(webSocketHandler.exchange(request, session), "listener");
    } catch (Exception e) {
      cancelHandshakeTimeout();
      logger.warn("webSocket {} handler failed to accept session", ctx.channel(), e);
      FullHttpResponse response =
          new DefaultFullHttpResponse(HTTP_1_1, HttpResponseStatus.INTERNAL_SERVER_ERROR);
      HttpUtil.setContentLength(response, 0);
      ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
      handshake.tryFailure(
          new WebSocketHandshakeException("webSocket handler failed to accept session", e));
      return;
    }

    HttpObjectAggregator aggregator = p.get(HttpObjectAggregator.class);
    if (aggregator != null) {
      p.remove(aggregator);
    }
    /*session receives bytes that follow upgrade request once http codec is removed*/
    p.addBefore(httpCodecCtx.name(), SESSION_HANDLER_NAME, session);

    String subprotocol = result.subprotocol();
    ctx.writeAndFlush(result.toHttpResponse())
        .addListener(
            future -> {
              cancelHandshakeTimeout();
              if (!future.isSuccess()) {
                handshake.tryFailure(future.cause());
                ctx.close();
                return;
              }
              if (!handshake.trySuccess()) {
                /*timed out*/
                return;
              }
              p.remove(HttpServerCodec.class);
              logger.debug("webSocket {} handshake completed, path: {}", ctx.channel(), path);
              session.open(listener);
              p.fireUserEventTriggered(
                  io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler
                      .ServerHandshakeStateEvent.HANDSHAKE_COMPLETE);
              p.fireUserEventTriggered(
                  new io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler
                      .HandshakeComplete(uri, request.headers(), subprotocol));
              if (p.context(this) != null) {
                p.remove(this);
              }
            });
  }

  static ScheduledFuture<?> startHandshakeTimeout(
      ChannelHandlerContext ctx, long handshakeTimeoutMillis, ChannelPromise handshake) {
    if (handshakeTimeoutMillis > 0) {
      return ctx.executor()
          .schedule(
              () -> {
                if (!handshake.isDone()
                    && handshake.tryFailure(
                        new WebSocketHandshakeException(
                            "webSocket handshake timeout after "
                                + handshakeTimeoutMillis
                                + " millis"))) {
                  logger.debug("webSocket {} handshake timed out", ctx.channel());
                  ctx.flush();
                  ctx.fireUserEventTriggered(
                      io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler
                          .ServerHandshakeStateEvent.HANDSHAKE_TIMEOUT);
                  ctx.close();
                }
              },
              handshakeTimeoutMillis,
              TimeUnit.MILLISECONDS);
    }
    return null;
  }

  private void cancelHandshakeTimeout() {
    ScheduledFuture<?> timeout = handshakeTimeout;
    if (timeout != null) {
      handshakeTimeout = null;
      timeout.cancel(false);
    }
  }

  public static final class Builder {
    private String path = "/";
    private Collection<String> subprotocols = Collections.emptyList();
    private WebSocketSessionConfig sessionConfig = WebSocketSessionConfig.defaultConfig();
    private WebSocketHandler webSocketHandler;
    private long handshakeTimeoutMillis;

    private Builder() {}

    public static Builder create() {
      return new Builder();
    }

    /**
     * @param path websocket path starting with "/". Must be non-null
     * @return this Builder instance
     */
    public Builder path(String path) {
      this.path = Objects.requireNonNull(path, "path");
      return this;
    }

    /**
     * @param subprotocols accepted subprotocols
     * @return this Builder instance
     */
    public Builder subprotocols(String... subprotocols) {
      this.subprotocols = Arrays.asList(subprotocols);
      return this;
    }

    /**
     * @param sessionConfig config of sessions created for accepted upgrade requests. Must be
     *     non-null
     * @return this Builder instance
     */
    public Builder sessionConfig(WebSocketSessionConfig sessionConfig) {
      this.sessionConfig = Objects.requireNonNull(sessionConfig, "sessionConfig");
      return this;
    }

    /**
     * @param handshakeTimeoutMillis webSocket handshake timeout
     * @return this Builder instance
     */
    public Builder handshakeTimeoutMillis(long handshakeTimeoutMillis) {
      this.handshakeTimeoutMillis =
          WebSocketSessionConfig.Builder.requirePositive(
              handshakeTimeoutMillis, "handshakeTimeoutMillis");
      return this;
    }

    /**
     * @param webSocketHandler handler to process successfully handshaked webSocket
     * @return this Builder instance
     */
    public Builder webSocketHandler(WebSocketHandler webSocketHandler) {
      this.webSocketHandler = Objects.requireNonNull(webSocketHandler, "webSocketHandler");
      return this;
    }

    /** @return new WebSocketServerProtocolHandler instance */
    public WebSocketServerProtocolHandler build() {
      WebSocketHandler handler = webSocketHandler;
      if (handler == null) {
        throw new IllegalStateException("webSocketHandler was not provided");
      }
      return new WebSocketServerProtocolHandler(
          path,
          new WebSocketHandshaker(subprotocols),
          sessionConfig,
          handshakeTimeoutMillis,
          handler);
    }
  }
}
