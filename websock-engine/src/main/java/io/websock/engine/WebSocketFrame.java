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
import io.netty.buffer.DefaultByteBufHolder;
import java.util.Objects;

/**
 * Single decoded webSocket frame. Reserved bits are not represented: frames with reserved bits set
 * are rejected by {@link WebSocketFrameCodec} as no extensions are negotiated.
 *
 * <p>Frame owns its payload and must be released by consumer.
 */
public final class WebSocketFrame extends DefaultByteBufHolder {
  private final boolean fin;
  private final WebSocketOpcode opcode;
  private final boolean masked;
  private final int maskingKey;

  public WebSocketFrame(boolean fin, WebSocketOpcode opcode, ByteBuf payload) {
    this(fin, opcode, false, 0, payload);
  }

  public WebSocketFrame(
      boolean fin, WebSocketOpcode opcode, boolean masked, int maskingKey, ByteBuf payload) {
    super(Objects.requireNonNull(payload, "payload"));
    this.fin = fin;
    this.opcode = Objects.requireNonNull(opcode, "opcode");
    this.masked = masked;
    this.maskingKey = maskingKey;
  }

  public boolean isFinalFragment() {
    return fin;
  }

  public WebSocketOpcode opcode() {
    return opcode;
  }

  public boolean isMasked() {
    return masked;
  }

  /** @return 4-byte masking key in network order, 0 if frame is not masked */
  public int maskingKey() {
    return maskingKey;
  }

  public int payloadLength() {
    return content().readableBytes();
  }

  @Override
  public WebSocketFrame replace(ByteBuf content) {
    return new WebSocketFrame(fin, opcode, masked, maskingKey, content);
  }

  @Override
  public WebSocketFrame copy() {
    return (WebSocketFrame) super.copy();
  }

  @Override
  public WebSocketFrame duplicate() {
    return (WebSocketFrame) super.duplicate();
  }

  @Override
  public WebSocketFrame retainedDuplicate() {
    return (WebSocketFrame) super.retainedDuplicate();
  }

  @Override
  public WebSocketFrame retain() {
    super.retain();
    return this;
  }

  @Override
  public WebSocketFrame retain(int increment) {
    super.retain(increment);
    return this;
  }

  @Override
  public WebSocketFrame touch() {
    super.touch();
    return this;
  }

  @Override
  public WebSocketFrame touch(Object hint) {
    super.touch(hint);
    return this;
  }

  @Override
  public String toString() {
    return "WebSocketFrame{"
        + "fin="
        + fin
        + ", opcode="
        + opcode
        + ", masked="
        + masked
        + ", payloadLength="
        + payloadLength()
        + '}';
  }
}
