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

import io.netty.handler.codec.http.websocketx.CorruptedWebSocketFrameException;

/** Handles ping, pong and close frames of one session, independently of message reassembly. */
final class WebSocketControlHandler {
  private final WebSocketSession session;

  WebSocketControlHandler(WebSocketSession session) {
    this.session = session;
  }

  /**
   * @param frame control frame, not released by this method
   * @throws CorruptedWebSocketFrameException if close frame payload is malformed
   */
  void handle(WebSocketFrame frame) {
    switch (frame.opcode()) {
      case PING:
        /*no frames may follow own close frame*/
        if (session.state() == ConnectionState.OPEN) {
          session.writeControlFrame(WebSocketOpcode.PONG, frame.content().retainedDuplicate());
        }
        break;
      case PONG:
        session.pongReceived(frame.content());
        break;
      case CLOSE:
        session.closeReceived(CloseInfo.decode(frame.content()));
        break;
      case CONTINUATION:
      case TEXT:
      case BINARY:
        throw new IllegalArgumentException("not a control frame: " + frame.opcode());
      default:
        throw new IllegalStateException("unexpected opcode: " + frame.opcode());
    }
  }
}
