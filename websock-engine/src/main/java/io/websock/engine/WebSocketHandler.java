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

/** Creates listener for each successfully handshaked webSocket */
public interface WebSocketHandler {

  /**
   * @param request accepted upgrade request
   * @param session new session, in {@link ConnectionState#CONNECTING} state until upgrade
   *     response is written. Not added to channel pipeline yet
   * @return listener of session events. If this method throws, upgrade request is answered with
   *     500 response and connection is closed
   */
  WebSocketListener exchange(HandshakeRequest request, WebSocketSession session);

  /** Called when upgrade request is rejected, before rejection response is written. */
  default void onHandshakeRejected(HandshakeRequest request, HandshakeResult result) {}
}
