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

import javax.annotation.Nullable;

/** Frame opcodes defined by RFC 6455. Values 0x3-0x7 and 0xB-0xF are reserved. */
public enum WebSocketOpcode {
  CONTINUATION(0x0),
  TEXT(0x1),
  BINARY(0x2),
  CLOSE(0x8),
  PING(0x9),
  PONG(0xA);

  private static final WebSocketOpcode[] BY_CODE = new WebSocketOpcode[16];

  static {
    for (WebSocketOpcode opcode : values()) {
      BY_CODE[opcode.code] = opcode;
    }
  }

  private final int code;

  WebSocketOpcode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isControl() {
    return (code & 0x8) != 0;
  }

  /** @return opcode for 4-bit wire value, or null if value is reserved */
  @Nullable
  public static WebSocketOpcode valueOf(int code) {
    if (code < 0 || code > 0xF) {
      return null;
    }
    return BY_CODE[code];
  }
}
