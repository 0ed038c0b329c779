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
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.CorruptedWebSocketFrameException;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import java.nio.charset.StandardCharsets;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CloseInfoTest {

  @Test
  void encodeStatusCodeAndReason() {
    ByteBuf payload = CloseInfo.create(4000, "done").encode(ByteBufAllocator.DEFAULT);
    try {
      Assertions.assertThat(payload.readableBytes()).isEqualTo(6);
      Assertions.assertThat(payload.getUnsignedShort(0)).isEqualTo(4000);
      Assertions.assertThat(payload.toString(2, 4, StandardCharsets.UTF_8)).isEqualTo("done");
      Assertions.assertThat(CloseInfo.decode(payload)).isEqualTo(CloseInfo.create(4000, "done"));
    } finally {
      payload.release();
    }
  }

  @Test
  void decodeEmptyPayload() {
    CloseInfo closeInfo = CloseInfo.decode(Unpooled.EMPTY_BUFFER);
    Assertions.assertThat(closeInfo).isSameAs(CloseInfo.NO_STATUS);
    Assertions.assertThat(closeInfo.code()).isEqualTo(1005);
    Assertions.assertThat(closeInfo.hasStatusCode()).isFalse();
    Assertions.assertThat(closeInfo.encode(ByteBufAllocator.DEFAULT).readableBytes()).isEqualTo(0);
  }

  @Test
  void decodeStatusCodeWithoutReason() {
    CloseInfo closeInfo = CloseInfo.decode(Unpooled.wrappedBuffer(new byte[] {0x03, (byte) 0xE9}));
    Assertions.assertThat(closeInfo.code()).isEqualTo(1001);
    Assertions.assertThat(closeInfo.reason()).isEmpty();
    Assertions.assertThat(closeInfo.hasStatusCode()).isTrue();
  }

  @Test
  void decodeSingleBytePayload() {
    assertProtocolError(Unpooled.wrappedBuffer(new byte[] {0x03}));
  }

  @ValueSource(ints = {0, 999, 1004, 1005, 1006, 1015, 1016, 2999, 5000, 65535})
  @ParameterizedTest
  void decodeInvalidStatusCode(int code) {
    assertProtocolError(Unpooled.buffer().writeShort(code));
    Assertions.assertThatThrownBy(() -> CloseInfo.create(code, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @ValueSource(ints = {1000, 1001, 1002, 1003, 1007, 1008, 1009, 1010, 1011, 3000, 4999})
  @ParameterizedTest
  void validStatusCode(int code) {
    ByteBuf payload = Unpooled.buffer().writeShort(code);
    try {
      Assertions.assertThat(CloseInfo.decode(payload).code()).isEqualTo(code);
    } finally {
      payload.release();
    }
  }

  @Test
  void decodeNonUtf8Reason() {
    assertProtocolError(Unpooled.buffer().writeShort(1000).writeByte(0xFF).writeByte(0xFE));
  }

  @Test
  void reasonLengthLimit() {
    StringBuilder reason = new StringBuilder();
    for (int i = 0; i < 123; i++) {
      reason.append('r');
    }
    Assertions.assertThat(CloseInfo.create(1000, reason.toString()).reason()).hasSize(123);
    reason.append('r');
    Assertions.assertThatThrownBy(() -> CloseInfo.create(1000, reason.toString()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void reasonLengthIsCountedInUtf8Bytes() {
    StringBuilder reason = new StringBuilder();
    for (int i = 0; i < 62; i++) {
      reason.append('ж');
    }
    Assertions.assertThatThrownBy(() -> CloseInfo.create(1000, reason.toString()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromCloseStatus() {
    CloseInfo closeInfo = CloseInfo.of(WebSocketCloseStatus.MESSAGE_TOO_BIG);
    Assertions.assertThat(closeInfo.code()).isEqualTo(1009);
    Assertions.assertThat(closeInfo.reason())
        .isEqualTo(WebSocketCloseStatus.MESSAGE_TOO_BIG.reasonText());
    Assertions.assertThat(CloseInfo.ABNORMAL_CLOSURE.code()).isEqualTo(1006);
    Assertions.assertThat(CloseInfo.ABNORMAL_CLOSURE.hasStatusCode()).isFalse();
  }

  static void assertProtocolError(ByteBuf payload) {
    try {
      CorruptedWebSocketFrameException e =
          Assertions.catchThrowableOfType(
              () -> CloseInfo.decode(payload), CorruptedWebSocketFrameException.class);
      Assertions.assertThat(e).isNotNull();
      Assertions.assertThat(e.closeStatus().code())
          .isEqualTo(WebSocketCloseStatus.PROTOCOL_ERROR.code());
    } finally {
      payload.release();
    }
  }
}
