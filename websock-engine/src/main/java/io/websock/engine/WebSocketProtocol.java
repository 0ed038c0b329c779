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
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;

/** RFC 6455 constants shared by handshake, codec and session. */
public final class WebSocketProtocol {
  public static final String GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";
  public static final String VERSION = "13";

  public static final int MAX_CONTROL_FRAME_PAYLOAD_LENGTH = 125;
  /*control frame payload minus 2 bytes of status code*/
  public static final int MAX_CLOSE_REASON_LENGTH = 123;

  /*receive-side only, never sent on the wire*/
  public static final int CLOSE_NO_STATUS_CODE = 1005;
  public static final int CLOSE_ABNORMAL_CLOSURE = 1006;

  /**
   * @param code close status code
   * @return true if code may appear in close frame: 1000-1003, 1007-1014 and 3000-4999
   */
  public static boolean isValidCloseCode(int code) {
    return code >= 1000 && code < 5000 && WebSocketCloseStatus.isValidStatusCode(code);
  }

  static CorruptedWebSocketFrameException protocolError(String msg) {
    return new CorruptedWebSocketFrameException(WebSocketCloseStatus.PROTOCOL_ERROR, msg);
  }

  static CorruptedWebSocketFrameException messageTooBig(long length, int limit) {
    return new CorruptedWebSocketFrameException(
        WebSocketCloseStatus.MESSAGE_TOO_BIG,
        "payload length: " + length + " exceeds limit: " + limit);
  }

  static CorruptedWebSocketFrameException invalidPayload(String msg) {
    return new CorruptedWebSocketFrameException(WebSocketCloseStatus.INVALID_PAYLOAD_DATA, msg);
  }

  static WebSocketErrorKind errorKind(WebSocketCloseStatus status) {
    return status.code() == WebSocketCloseStatus.MESSAGE_TOO_BIG.code()
        ? WebSocketErrorKind.PAYLOAD_TOO_LARGE
        : WebSocketErrorKind.PROTOCOL_VIOLATION;
  }

  private WebSocketProtocol() {}
}
