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

/**
 * Categories of session failures reported with {@link WebSocketListener#onError}. Rejected
 * handshakes are reported with {@link WebSocketHandler#onHandshakeRejected} instead.
 */
public enum WebSocketErrorKind {
  /*bad opcode or reserved bits, unmasked frame, broken fragment sequence, malformed close*/
  PROTOCOL_VIOLATION,
  PAYLOAD_TOO_LARGE,
  /*channel read or write failure, no close frame is attempted*/
  TRANSPORT_ERROR,
  /*peer did not answer idle ping*/
  TIMEOUT,
  INTERNAL_ERROR
}
