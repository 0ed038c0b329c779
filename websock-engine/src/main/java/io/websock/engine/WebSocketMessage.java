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
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Complete application message reassembled from one or more data frames. Payload is released by
 * session after {@link WebSocketListener#onMessage} returns.
 */
public final class WebSocketMessage extends DefaultByteBufHolder {

  public enum Type {
    TEXT,
    BINARY
  }

  private final Type type;

  public WebSocketMessage(Type type, ByteBuf payload) {
    super(Objects.requireNonNull(payload, "payload"));
    this.type = Objects.requireNonNull(type, "type");
  }

  public Type type() {
    return type;
  }

  public boolean isText() {
    return type == Type.TEXT;
  }

  /** @return payload decoded as UTF-8 */
  public String text() {
    return content().toString(StandardCharsets.UTF_8);
  }

  @Override
  public WebSocketMessage replace(ByteBuf content) {
    return new WebSocketMessage(type, content);
  }

  @Override
  public WebSocketMessage retain() {
    super.retain();
    return this;
  }

  @Override
  public WebSocketMessage retain(int increment) {
    super.retain(increment);
    return this;
  }

  @Override
  public WebSocketMessage touch() {
    super.touch();
    return this;
  }

  @Override
  public WebSocketMessage touch(Object hint) {
    super.touch(hint);
    return this;
  }

  @Override
  public String toString() {
    return "WebSocketMessage{type=" + type + ", payloadLength=" + content().readableBytes() + '}';
  }
}
