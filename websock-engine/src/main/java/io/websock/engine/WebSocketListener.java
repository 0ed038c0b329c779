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

/**
 * Application callbacks of single webSocket session. All callbacks are invoked on session channel
 * event loop, never concurrently. Payloads are released after callback returns, so listener must
 * retain them to use later.
 */
public interface WebSocketListener {

  default void onOpen(WebSocketSession session) {}

  void onMessage(WebSocketSession session, WebSocketMessage message);

  /** Liveness signal: solicited or unsolicited pong. */
  default void onPong(WebSocketSession session, ByteBuf payload) {}

  /**
   * Called exactly once when session transport is closed.
   *
   * @param closeInfo close received from peer, close sent by this side if peer did not answer,
   *     or {@link CloseInfo#ABNORMAL_CLOSURE} if transport closed without close handshake
   */
  default void onClose(WebSocketSession session, CloseInfo closeInfo) {}

  default void onError(WebSocketSession session, WebSocketErrorKind kind, Throwable cause) {}
}
