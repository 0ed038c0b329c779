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

import static io.websock.engine.WebSocketProtocol.CLOSE_ABNORMAL_CLOSURE;
import static io.websock.engine.WebSocketProtocol.CLOSE_NO_STATUS_CODE;
import static io.websock.engine.WebSocketProtocol.MAX_CLOSE_REASON_LENGTH;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.CorruptedWebSocketFrameException;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import javax.annotation.Nullable;

/** Close status code and reason, used both to request and to record webSocket close. */
public final class CloseInfo {
  public static final CloseInfo NORMAL_CLOSURE = of(WebSocketCloseStatus.NORMAL_CLOSURE);
  /*peer close frame without payload*/
  public static final CloseInfo NO_STATUS = new CloseInfo(CLOSE_NO_STATUS_CODE, "");
  /*transport closed without close handshake*/
  public static final CloseInfo ABNORMAL_CLOSURE = new CloseInfo(CLOSE_ABNORMAL_CLOSURE, "");

  private final int code;
  private final String reason;

  private CloseInfo(int code, String reason) {
    this.code = code;
    this.reason = reason;
  }

  /**
   * @param code close status code valid for sending
   * @param reason close reason, at most 123 UTF-8 bytes. May be null
   * @return new CloseInfo
   * @throws IllegalArgumentException if code is not sendable or reason is too long
   */
  public static CloseInfo create(int code, @Nullable String reason) {
    if (!WebSocketProtocol.isValidCloseCode(code)) {
      throw new IllegalArgumentException("Incorrect close status code: " + code);
    }
    if (reason == null) {
      reason = "";
    }
    int reasonLength = ByteBufUtil.utf8Bytes(reason);
    if (reasonLength > MAX_CLOSE_REASON_LENGTH) {
      throw new IllegalArgumentException(
          "close reason length: " + reasonLength + " exceeds limit: " + MAX_CLOSE_REASON_LENGTH);
    }
    return new CloseInfo(code, reason);
  }

  public static CloseInfo of(WebSocketCloseStatus status) {
    Objects.requireNonNull(status, "status");
    return create(status.code(), status.reasonText());
  }

  /**
   * @param payload close frame payload, not released
   * @return decoded close info, {@link #NO_STATUS} if payload is empty
   * @throws CorruptedWebSocketFrameException with 1002 status if payload is 1 byte long, carries
   *     invalid status code or non-UTF-8 reason
   */
  public static CloseInfo decode(ByteBuf payload) {
    int length = payload.readableBytes();
    if (length == 0) {
      return NO_STATUS;
    }
    if (length < Short.BYTES) {
      throw WebSocketProtocol.protocolError("close frame payload of 1 byte");
    }
    int index = payload.readerIndex();
    int code = payload.getUnsignedShort(index);
    if (!WebSocketProtocol.isValidCloseCode(code)) {
      throw WebSocketProtocol.protocolError("invalid close status code: " + code);
    }
    if (length == Short.BYTES) {
      return new CloseInfo(code, "");
    }
    ByteBuf reason = payload.slice(index + Short.BYTES, length - Short.BYTES);
    if (!ByteBufUtil.isText(reason, StandardCharsets.UTF_8)) {
      throw WebSocketProtocol.protocolError("close reason is not UTF-8");
    }
    return new CloseInfo(code, reason.toString(StandardCharsets.UTF_8));
  }

  /** @return close frame payload: status code followed by UTF-8 reason */
  public ByteBuf encode(ByteBufAllocator allocator) {
    if (code == CLOSE_NO_STATUS_CODE) {
      return Unpooled.EMPTY_BUFFER;
    }
    ByteBuf payload = allocator.buffer(Short.BYTES + ByteBufUtil.utf8Bytes(reason));
    payload.writeShort(code);
    if (!reason.isEmpty()) {
      payload.writeCharSequence(reason, StandardCharsets.UTF_8);
    }
    return payload;
  }

  public int code() {
    return code;
  }

  public String reason() {
    return reason;
  }

  public boolean hasStatusCode() {
    return code != CLOSE_NO_STATUS_CODE && code != CLOSE_ABNORMAL_CLOSURE;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CloseInfo closeInfo = (CloseInfo) o;
    return code == closeInfo.code && reason.equals(closeInfo.reason);
  }

  @Override
  public int hashCode() {
    return 31 * code + reason.hashCode();
  }

  @Override
  public String toString() {
    return "CloseInfo{code=" + code + ", reason='" + reason + "'}";
  }
}
