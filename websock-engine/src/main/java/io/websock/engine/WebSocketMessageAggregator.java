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
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.CompositeByteBuf;
import io.netty.handler.codec.http.websocketx.CorruptedWebSocketFrameException;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;

/**
 * Reassembles data frames into messages. Control frames must not be passed here: they are handled
 * by {@link WebSocketControlHandler} and do not affect reassembly state.
 */
public final class WebSocketMessageAggregator {
  static final int STATE_IDLE = 0;
  static final int STATE_ACCUMULATING = 1;

  private final ByteBufAllocator allocator;
  private final int maxMessageSize;

  private int state = STATE_IDLE;
  private WebSocketMessage.Type type;
  private CompositeByteBuf accumulated;

  public WebSocketMessageAggregator(ByteBufAllocator allocator, int maxMessageSize) {
    this.allocator = allocator;
    this.maxMessageSize = maxMessageSize;
  }

  /**
   * @param frame data frame, not released by this method
   * @return complete message, or null if frame started or continued fragmented message
   * @throws CorruptedWebSocketFrameException on broken fragment sequence (1002), message
   *     exceeding size limit (1009) or text message that is not UTF-8 (1007)
   */
  @Nullable
  public WebSocketMessage aggregate(WebSocketFrame frame) {
    ByteBuf payload = frame.content();
    switch (frame.opcode()) {
      case TEXT:
      case BINARY:
        {
          if (state == STATE_ACCUMULATING) {
            throw WebSocketProtocol.protocolError(
                "fragmentation start while fragmenting already: " + frame.opcode());
          }
          int length = payload.readableBytes();
          if (length > maxMessageSize) {
            throw WebSocketProtocol.messageTooBig(length, maxMessageSize);
          }
          WebSocketMessage.Type messageType =
              frame.opcode() == WebSocketOpcode.TEXT
                  ? WebSocketMessage.Type.TEXT
                  : WebSocketMessage.Type.BINARY;
          if (frame.isFinalFragment()) {
            return complete(messageType, payload.retain());
          }
          CompositeByteBuf buf = allocator.compositeBuffer();
          buf.addComponent(true, payload.retain());
          accumulated = buf;
          type = messageType;
          state = STATE_ACCUMULATING;
          return null;
        }
      case CONTINUATION:
        {
          if (state == STATE_IDLE) {
            throw WebSocketProtocol.protocolError(
                "fragmentation continuation while not in fragmenting state");
          }
          CompositeByteBuf buf = accumulated;
          long length = (long) buf.readableBytes() + payload.readableBytes();
          if (length > maxMessageSize) {
            throw WebSocketProtocol.messageTooBig(length, maxMessageSize);
          }
          buf.addComponent(true, payload.retain());
          if (!frame.isFinalFragment()) {
            return null;
          }
          accumulated = null;
          state = STATE_IDLE;
          return complete(type, buf);
        }
      case CLOSE:
      case PING:
      case PONG:
        throw new IllegalArgumentException("control frame is not aggregated: " + frame.opcode());
      default:
        throw new IllegalStateException("unexpected opcode: " + frame.opcode());
    }
  }

  /** @return true if fragmented message is in progress */
  public boolean isAccumulating() {
    return state == STATE_ACCUMULATING;
  }

  /** @return bytes accumulated for message in progress */
  public int accumulatedLength() {
    CompositeByteBuf buf = accumulated;
    return buf == null ? 0 : buf.readableBytes();
  }

  /** Drops message in progress, if any. */
  public void release() {
    CompositeByteBuf buf = accumulated;
    if (buf != null) {
      accumulated = null;
      buf.release();
    }
    state = STATE_IDLE;
  }

  private static WebSocketMessage complete(WebSocketMessage.Type type, ByteBuf payload) {
    if (type == WebSocketMessage.Type.TEXT
        && !ByteBufUtil.isText(payload, StandardCharsets.UTF_8)) {
      payload.release();
      throw WebSocketProtocol.invalidPayload("inbound text message with non-utf8 contents");
    }
    return new WebSocketMessage(type, payload);
  }
}
