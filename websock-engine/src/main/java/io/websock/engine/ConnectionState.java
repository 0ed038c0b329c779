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

/** Lifecycle of {@link WebSocketSession}. */
public enum ConnectionState {
  /*upgrade response is not written yet*/
  CONNECTING,
  OPEN,
  /*close frame sent, waiting for peer close*/
  CLOSING_SENT,
  /*close frame received, echo is being written*/
  CLOSING_RECEIVED,
  CLOSED;

  public boolean isClosing() {
    return this == CLOSING_SENT || this == CLOSING_RECEIVED;
  }
}
