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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.http.websocketx.CorruptedWebSocketFrameException;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-connection webSocket state machine. Decodes inbound bytes into frames, dispatches control
 * frames to {@link WebSocketControlHandler} and data frames to {@link WebSocketMessageAggregator},
 * runs closing handshake and idle policy.
 *
 * <p>All state is confined to channel event loop. Send methods may be called from any thread:
 * frames are written in submission order.
 */
public final class WebSocketSession extends ChannelInboundHandlerAdapter {
  private static final Logger logger = LoggerFactory.getLogger(WebSocketSession.class);

  private final WebSocketSessionConfig config;
  private final WebSocketFrameCodec codec;
  private final WebSocketControlHandler controlHandler;
  private final ChannelFutureListener controlWriteListener = this::controlFrameWritten;

  private ChannelHandlerContext ctx;
  private WebSocketMessageAggregator aggregator;
  private WebSocketListener listener;
  private volatile ConnectionState state = ConnectionState.CONNECTING;
  /*close sent by this side, replaced with close received from peer*/
  private CloseInfo closeInfo;

  private ByteBuf cumulation;
  private boolean inboundClosed;

  private ScheduledFuture<?> idleCheck;
  private ScheduledFuture<?> closeTimeout;
  private long lastReadNanos;
  private long pingSentNanos;
  private boolean awaitingFrame;

  public WebSocketSession(WebSocketSessionConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.codec = new WebSocketFrameCodec(config.maxMessageSize(), config.expectMaskedFrames());
    this.controlHandler = new WebSocketControlHandler(this);
  }

  public ConnectionState state() {
    return state;
  }

  public boolean isOpen() {
    return state == ConnectionState.OPEN;
  }

  public WebSocketSessionConfig config() {
    return config;
  }

  /** @return channel of this session, null if session is not added to channel pipeline yet */
  @Nullable
  public Channel channel() {
    ChannelHandlerContext c = ctx;
    return c == null ? null : c.channel();
  }

  /** @return close requested or received so far, null if closing handshake did not start */
  @Nullable
  public CloseInfo closeInfo() {
    return closeInfo;
  }

  /*send*/

  public ChannelFuture sendText(CharSequence text) {
    Objects.requireNonNull(text, "text");
    return send(WebSocketOpcode.TEXT, true, ByteBufUtil.writeUtf8(ctx.alloc(), text));
  }

  /** @param payload message payload, released once written */
  public ChannelFuture sendBinary(ByteBuf payload) {
    return send(WebSocketOpcode.BINARY, true, Objects.requireNonNull(payload, "payload"));
  }

  /**
   * Sends single frame of fragmented message: first fragment carries TEXT or BINARY opcode, next
   * ones CONTINUATION. Last fragment has fin set.
   *
   * @param payload fragment payload, released once written
   */
  public ChannelFuture sendFragment(WebSocketOpcode opcode, boolean fin, ByteBuf payload) {
    Objects.requireNonNull(payload, "payload");
    if (opcode.isControl()) {
      payload.release();
      throw new IllegalArgumentException("not a data frame opcode: " + opcode);
    }
    return send(opcode, fin, payload);
  }

  /** @param payload ping payload of at most 125 bytes, released once written */
  public ChannelFuture sendPing(ByteBuf payload) {
    return send(WebSocketOpcode.PING, true, requireControlPayload(payload));
  }

  /** @param payload unsolicited pong payload of at most 125 bytes, released once written */
  public ChannelFuture sendPong(ByteBuf payload) {
    return send(WebSocketOpcode.PONG, true, requireControlPayload(payload));
  }

  /** Starts closing handshake with 1000 status code. */
  public ChannelFuture close() {
    return close(CloseInfo.NORMAL_CLOSURE);
  }

  /**
   * Starts closing handshake. Closing session that is already closing or closed is no-op.
   *
   * @throws IllegalArgumentException if code is not valid for sending or reason is too long
   */
  public ChannelFuture close(int code, @Nullable String reason) {
    return close(CloseInfo.create(code, reason));
  }

  public ChannelFuture close(CloseInfo closeInfo) {
    Objects.requireNonNull(closeInfo, "closeInfo");
    ChannelPromise promise = ctx.newPromise();
    EventExecutor executor = ctx.executor();
    if (executor.inEventLoop()) {
      doClose(closeInfo, promise);
    } else {
      try {
        executor.execute(() -> doClose(closeInfo, promise));
      } catch (RejectedExecutionException e) {
        promise.tryFailure(e);
      }
    }
    return promise;
  }

  private ChannelFuture send(WebSocketOpcode opcode, boolean fin, ByteBuf payload) {
    ChannelPromise promise = ctx.newPromise();
    EventExecutor executor = ctx.executor();
    if (executor.inEventLoop()) {
      doSend(opcode, fin, payload, promise);
    } else {
      try {
        executor.execute(() -> doSend(opcode, fin, payload, promise));
      } catch (RejectedExecutionException e) {
        payload.release();
        promise.tryFailure(e);
      }
    }
    return promise;
  }

  private void doSend(
      WebSocketOpcode opcode, boolean fin, ByteBuf payload, ChannelPromise promise) {
    ConnectionState st = state;
    if (st != ConnectionState.OPEN) {
      payload.release();
      promise.tryFailure(new IllegalStateException("webSocket session is not open: " + st));
      return;
    }
    writeFrame(opcode, fin, payload, promise);
  }

  private void doClose(CloseInfo info, ChannelPromise promise) {
    switch (state) {
      case CONNECTING:
        closeInfo = info;
        ctx.close(promise);
        break;
      case OPEN:
        state = ConnectionState.CLOSING_SENT;
        closeInfo = info;
        cancelIdleCheck();
        logger.debug("webSocket {} close sent: {}", ctx.channel(), info);
        writeFrame(WebSocketOpcode.CLOSE, true, info.encode(ctx.alloc()), promise);
        scheduleCloseTimeout();
        break;
      case CLOSING_SENT:
      case CLOSING_RECEIVED:
      case CLOSED:
        promise.trySuccess();
        break;
      default:
        throw new IllegalStateException("unexpected state: " + state);
    }
  }

  /*lifecycle*/

  /**
   * Moves session to {@link ConnectionState#OPEN} and starts decoding inbound bytes. Called after
   * upgrade response is written.
   */
  void open(WebSocketListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
    if (state != ConnectionState.CONNECTING) {
      throw new IllegalStateException("webSocket session is already opened: " + state);
    }
    state = ConnectionState.OPEN;
    lastReadNanos = System.nanoTime();
    /*called from upgrade write listener: exceptions must not reach it*/
    try {
      listener.onOpen(this);

      long idleTimeoutMillis = config.idleTimeoutMillis();
      if (idleTimeoutMillis > 0 && state == ConnectionState.OPEN) {
        scheduleIdleCheck(TimeUnit.MILLISECONDS.toNanos(idleTimeoutMillis));
      }
      if (cumulation != null) {
        decodeFrames();
      }
    } catch (Exception e) {
      logger.warn("webSocket {} unexpected error on open", ctx.channel(), e);
      fail(WebSocketErrorKind.INTERNAL_ERROR, WebSocketCloseStatus.INTERNAL_SERVER_ERROR, e);
    }
  }

  @Override
  public void handlerAdded(ChannelHandlerContext ctx) {
    this.ctx = ctx;
    this.aggregator = new WebSocketMessageAggregator(ctx.alloc(), config.maxMessageSize());
  }

  @Override
  public void handlerRemoved(ChannelHandlerContext ctx) {
    closeInbound();
    cancelIdleCheck();
    cancelCloseTimeout();
    aggregator.release();
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) {
    if (!(msg instanceof ByteBuf)) {
      ctx.fireChannelRead(msg);
      return;
    }
    ByteBuf buf = (ByteBuf) msg;
    if (inboundClosed) {
      buf.release();
      return;
    }
    ByteBuf c = cumulation;
    cumulation =
        c == null ? buf : ByteToMessageDecoder.MERGE_CUMULATOR.cumulate(ctx.alloc(), c, buf);
    if (state != ConnectionState.CONNECTING) {
      decodeFrames();
    }
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    ConnectionState st = state;
    if (st != ConnectionState.CLOSED) {
      state = ConnectionState.CLOSED;
      closeInbound();
      cancelIdleCheck();
      cancelCloseTimeout();
      aggregator.release();

      CloseInfo info = closeInfo;
      if (st == ConnectionState.OPEN || st == ConnectionState.CONNECTING || info == null) {
        info = CloseInfo.ABNORMAL_CLOSURE;
      }
      logger.debug("webSocket {} closed: {}", ctx.channel(), info);
      WebSocketListener l = listener;
      if (l != null) {
        l.onClose(this, info);
      }
    }
    ctx.fireChannelInactive();
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    if (cause instanceof CorruptedWebSocketFrameException) {
      protocolFailure((CorruptedWebSocketFrameException) cause);
      return;
    }
    if (cause instanceof IOException) {
      logger.debug("webSocket {} transport error", ctx.channel(), cause);
      closeInbound();
      notifyError(WebSocketErrorKind.TRANSPORT_ERROR, cause);
      ctx.close();
      return;
    }
    logger.warn("webSocket {} unexpected error", ctx.channel(), cause);
    fail(WebSocketErrorKind.INTERNAL_ERROR, WebSocketCloseStatus.INTERNAL_SERVER_ERROR, cause);
  }

  /*inbound*/

  private void decodeFrames() {
    ByteBuf in = cumulation;
    try {
      while (!inboundClosed && in.isReadable()) {
        WebSocketFrame frame;
        try {
          frame = codec.decode(in);
          if (frame == null) {
            break;
          }
          try {
            onFrame(frame);
          } finally {
            frame.release();
          }
        } catch (CorruptedWebSocketFrameException e) {
          protocolFailure(e);
          return;
        }
      }
    } finally {
      ByteBuf c = cumulation;
      if (c != null) {
        if (!c.isReadable()) {
          cumulation = null;
          c.release();
        } else if (c.refCnt() == 1) {
          c.discardSomeReadBytes();
        }
      }
    }
  }

  private void onFrame(WebSocketFrame frame) {
    lastReadNanos = System.nanoTime();
    awaitingFrame = false;
    if (frame.opcode().isControl()) {
      controlHandler.handle(frame);
      return;
    }
    WebSocketMessage message = aggregator.aggregate(frame);
    if (message != null) {
      try {
        listener.onMessage(this, message);
      } finally {
        message.release();
      }
    }
  }

  void pongReceived(ByteBuf payload) {
    listener.onPong(this, payload);
  }

  void closeReceived(CloseInfo peerClose) {
    switch (state) {
      case OPEN:
        {
          state = ConnectionState.CLOSING_RECEIVED;
          closeInfo = peerClose;
          closeInbound();
          cancelIdleCheck();
          logger.debug("webSocket {} close received: {}", ctx.channel(), peerClose);
          CloseInfo echo = peerClose.hasStatusCode() ? peerClose : CloseInfo.NORMAL_CLOSURE;
          writeControlFrame(WebSocketOpcode.CLOSE, echo.encode(ctx.alloc()))
              .addListener(ChannelFutureListener.CLOSE);
        }
        break;
      case CLOSING_SENT:
        closeInfo = peerClose;
        closeInbound();
        cancelCloseTimeout();
        logger.debug("webSocket {} close completed: {}", ctx.channel(), peerClose);
        ctx.close();
        break;
      case CONNECTING:
      case CLOSING_RECEIVED:
      case CLOSED:
        break;
      default:
        throw new IllegalStateException("unexpected state: " + state);
    }
  }

  private void protocolFailure(CorruptedWebSocketFrameException e) {
    WebSocketCloseStatus status = e.closeStatus();
    fail(WebSocketProtocol.errorKind(status), status, e);
  }

  /* sends close frame with given status if possible, then closes transport*/
  private void fail(WebSocketErrorKind kind, WebSocketCloseStatus status, Throwable cause) {
    ConnectionState st = state;
    if (st == ConnectionState.CLOSED) {
      return;
    }
    logger.debug("webSocket {} failed with {}: {}", ctx.channel(), kind, cause.getMessage());
    closeInbound();
    cancelIdleCheck();
    notifyError(kind, cause);
    if (st == ConnectionState.OPEN) {
      state = ConnectionState.CLOSING_SENT;
      CloseInfo info = closeInfo = CloseInfo.of(status);
      writeControlFrame(WebSocketOpcode.CLOSE, info.encode(ctx.alloc()))
          .addListener(ChannelFutureListener.CLOSE);
    } else {
      ctx.close();
    }
  }

  private void notifyError(WebSocketErrorKind kind, Throwable cause) {
    WebSocketListener l = listener;
    if (l == null) {
      return;
    }
    try {
      l.onError(this, kind, cause);
    } catch (Exception e) {
      logger.warn("webSocket {} listener onError failed", ctx.channel(), e);
    }
  }

  private void closeInbound() {
    inboundClosed = true;
    ByteBuf c = cumulation;
    if (c != null) {
      cumulation = null;
      c.release();
    }
  }

  /*outbound*/

  ChannelFuture writeControlFrame(WebSocketOpcode opcode, ByteBuf payload) {
    return writeFrame(opcode, true, payload, ctx.newPromise()).addListener(controlWriteListener);
  }

  private void controlFrameWritten(ChannelFuture future) {
    if (future.isSuccess() || future.isCancelled()) {
      return;
    }
    Throwable cause = future.cause();
    if (cause instanceof ClosedChannelException) {
      return;
    }
    logger.debug("webSocket {} control frame write failed", ctx.channel(), cause);
    closeInbound();
    cancelIdleCheck();
    notifyError(WebSocketErrorKind.TRANSPORT_ERROR, cause);
    ctx.close();
  }

  private ChannelFuture writeFrame(
      WebSocketOpcode opcode, boolean fin, ByteBuf payload, ChannelPromise promise) {
    ByteBuf frame;
    try {
      frame = codec.encode(ctx.alloc(), opcode, fin, payload);
    } catch (IllegalArgumentException e) {
      promise.tryFailure(e);
      return promise;
    }
    return ctx.writeAndFlush(frame, promise);
  }

  private static ByteBuf requireControlPayload(ByteBuf payload) {
    Objects.requireNonNull(payload, "payload");
    int length = payload.readableBytes();
    if (length > WebSocketProtocol.MAX_CONTROL_FRAME_PAYLOAD_LENGTH) {
      payload.release();
      throw new IllegalArgumentException(
          "control frame payloadSize: "
              + length
              + " exceeds limit: "
              + WebSocketProtocol.MAX_CONTROL_FRAME_PAYLOAD_LENGTH);
    }
    return payload;
  }

  /*timeouts*/

  private void scheduleIdleCheck(long delayNanos) {
    idleCheck = ctx.executor().schedule(this::checkIdle, delayNanos, TimeUnit.NANOSECONDS);
  }

  private void checkIdle() {
    idleCheck = null;
    if (state != ConnectionState.OPEN) {
      return;
    }
    long now = System.nanoTime();
    if (awaitingFrame) {
      long remaining =
          pingSentNanos + TimeUnit.MILLISECONDS.toNanos(config.pingTimeoutMillis()) - now;
      if (remaining > 0) {
        scheduleIdleCheck(remaining);
        return;
      }
      fail(
          WebSocketErrorKind.TIMEOUT,
          WebSocketCloseStatus.ENDPOINT_UNAVAILABLE,
          new TimeoutException(
              "no frames received within "
                  + config.pingTimeoutMillis()
                  + " millis after idle ping"));
      return;
    }
    long remaining =
        lastReadNanos + TimeUnit.MILLISECONDS.toNanos(config.idleTimeoutMillis()) - now;
    if (remaining > 0) {
      scheduleIdleCheck(remaining);
      return;
    }
    awaitingFrame = true;
    pingSentNanos = now;
    writeControlFrame(WebSocketOpcode.PING, ctx.alloc().buffer(0));
    scheduleIdleCheck(TimeUnit.MILLISECONDS.toNanos(config.pingTimeoutMillis()));
  }

  private void cancelIdleCheck() {
    ScheduledFuture<?> check = idleCheck;
    if (check != null) {
      idleCheck = null;
      check.cancel(false);
    }
  }

  private void scheduleCloseTimeout() {
    long timeoutMillis = config.closeTimeoutMillis();
    if (timeoutMillis > 0) {
      closeTimeout =
          ctx.executor()
              .schedule(
                  () -> {
                    closeTimeout = null;
                    if (state == ConnectionState.CLOSING_SENT) {
                      notifyError(
                          WebSocketErrorKind.TIMEOUT,
                          new TimeoutException(
                              "peer close frame not received within "
                                  + timeoutMillis
                                  + " millis"));
                      ctx.close();
                    }
                  },
                  timeoutMillis,
                  TimeUnit.MILLISECONDS);
    }
  }

  private void cancelCloseTimeout() {
    ScheduledFuture<?> timeout = closeTimeout;
    if (timeout != null) {
      closeTimeout = null;
      timeout.cancel(false);
    }
  }
}
