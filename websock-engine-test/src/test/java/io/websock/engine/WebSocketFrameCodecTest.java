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
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.CorruptedWebSocketFrameException;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.websock.engine.test.ClientFrames;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class WebSocketFrameCodecTest {
  static final ByteBufAllocator ALLOCATOR = ByteBufAllocator.DEFAULT;

  @CsvSource({"0, 2", "1, 2", "125, 2", "126, 4", "65535, 4", "65536, 10"})
  @ParameterizedTest
  void encodeUsesShortestLengthForm(int payloadLength, int prefixLength) {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(70_000, true);
    byte[] payload = ClientFrames.randomBytes(payloadLength);
    ByteBuf frame =
        codec.encode(ALLOCATOR, WebSocketOpcode.BINARY, true, Unpooled.wrappedBuffer(payload));
    try {
      Assertions.assertThat(frame.readableBytes()).isEqualTo(prefixLength + payloadLength);
      Assertions.assertThat(WebSocketFrameCodec.sizeofFrame(payloadLength))
          .isEqualTo(prefixLength + payloadLength);
      Assertions.assertThat(frame.getUnsignedByte(0)).isEqualTo((short) 0x82);
      /*server frames are never masked*/
      Assertions.assertThat(frame.getByte(1) & 0x80).isEqualTo(0);
      Assertions.assertThat(ByteBufUtil.getBytes(frame, prefixLength, payloadLength))
          .isEqualTo(payload);
    } finally {
      frame.release();
    }
  }

  @ValueSource(ints = {0, 1, 7, 125, 126, 65535, 65536})
  @ParameterizedTest
  void decodeMaskedFrame(int payloadLength) {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(70_000, true);
    byte[] payload = ClientFrames.randomBytes(payloadLength);
    ByteBuf in = ClientFrames.masked(WebSocketOpcode.BINARY, true, payload);
    try {
      WebSocketFrame frame = codec.decode(in);
      Assertions.assertThat(frame).isNotNull();
      try {
        Assertions.assertThat(frame.isFinalFragment()).isTrue();
        Assertions.assertThat(frame.opcode()).isEqualTo(WebSocketOpcode.BINARY);
        Assertions.assertThat(frame.isMasked()).isTrue();
        Assertions.assertThat(frame.payloadLength()).isEqualTo(payloadLength);
        Assertions.assertThat(ByteBufUtil.getBytes(frame.content())).isEqualTo(payload);
        Assertions.assertThat(in.isReadable()).isFalse();
      } finally {
        frame.release();
      }
    } finally {
      in.release();
    }
  }

  @Test
  void decodeUnmaskedFrameIfMaskingIsNotExpected() {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(125, false);
    ByteBuf in = ClientFrames.unmasked(WebSocketOpcode.TEXT, false, new byte[] {1, 2, 3});
    try {
      WebSocketFrame frame = codec.decode(in);
      Assertions.assertThat(frame).isNotNull();
      try {
        Assertions.assertThat(frame.isFinalFragment()).isFalse();
        Assertions.assertThat(frame.opcode()).isEqualTo(WebSocketOpcode.TEXT);
        Assertions.assertThat(frame.isMasked()).isFalse();
        Assertions.assertThat(ByteBufUtil.getBytes(frame.content()))
            .isEqualTo(new byte[] {1, 2, 3});
      } finally {
        frame.release();
      }
    } finally {
      in.release();
    }
  }

  @Test
  void decodeConsecutiveFrames() {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(125, true);
    ByteBuf in =
        Unpooled.wrappedBuffer(
            ClientFrames.masked(WebSocketOpcode.TEXT, false, "hel"),
            ClientFrames.masked(WebSocketOpcode.PING, true, "ping"),
            ClientFrames.masked(WebSocketOpcode.CONTINUATION, true, "lo"));
    try {
      WebSocketFrame first = codec.decode(in);
      WebSocketFrame second = codec.decode(in);
      WebSocketFrame third = codec.decode(in);
      try {
        Assertions.assertThat(first.opcode()).isEqualTo(WebSocketOpcode.TEXT);
        Assertions.assertThat(second.opcode()).isEqualTo(WebSocketOpcode.PING);
        Assertions.assertThat(third.opcode()).isEqualTo(WebSocketOpcode.CONTINUATION);
        Assertions.assertThat(third.isFinalFragment()).isTrue();
        Assertions.assertThat(codec.decode(in)).isNull();
      } finally {
        first.release();
        second.release();
        third.release();
      }
    } finally {
      in.release();
    }
  }

  @ValueSource(ints = {0, 5, 125, 300, 70_000})
  @ParameterizedTest
  void partialFrameIsNotConsumed(int payloadLength) {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(70_000, true);
    ByteBuf frame =
        ClientFrames.masked(
            WebSocketOpcode.BINARY, true, ClientFrames.randomBytes(payloadLength));
    int frameLength = frame.readableBytes();
    try {
      for (int available : new int[] {0, 1, 2, 3, 5, 9, 13, frameLength - 1}) {
        if (available >= frameLength) {
          continue;
        }
        ByteBuf partial = frame.retainedSlice(0, available);
        try {
          Assertions.assertThat(codec.decode(partial)).isNull();
          Assertions.assertThat(partial.readerIndex()).isEqualTo(0);
        } finally {
          partial.release();
        }
      }
    } finally {
      frame.release();
    }
  }

  @ValueSource(ints = {0x40, 0x20, 0x10, 0x70})
  @ParameterizedTest
  void reservedBitsAreRejected(int rsv) {
    int firstByte = ClientFrames.firstByte(WebSocketOpcode.TEXT, true) | rsv;
    assertProtocolError(
        new WebSocketFrameCodec(125, true),
        ClientFrames.frame(firstByte, true, ClientFrames.randomMask(), new byte[] {'a'}));
  }

  @ValueSource(ints = {3, 4, 5, 6, 7, 11, 12, 13, 14, 15})
  @ParameterizedTest
  void reservedOpcodesAreRejected(int opcode) {
    Assertions.assertThat(WebSocketOpcode.valueOf(opcode)).isNull();
    assertProtocolError(
        new WebSocketFrameCodec(125, true),
        ClientFrames.frame(0x80 | opcode, true, ClientFrames.randomMask(), new byte[0]));
  }

  @ValueSource(ints = {0x8, 0x9, 0xA})
  @ParameterizedTest
  void fragmentedControlFrameIsRejected(int opcode) {
    assertProtocolError(
        new WebSocketFrameCodec(125, true),
        ClientFrames.frame(opcode, true, ClientFrames.randomMask(), new byte[0]));
  }

  @Test
  void oversizedControlFrameIsRejected() {
    assertProtocolError(
        new WebSocketFrameCodec(65_536, true),
        ClientFrames.masked(WebSocketOpcode.PING, true, new byte[126]));
  }

  @Test
  void maxControlFramePayloadIsAccepted() {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(125, true);
    ByteBuf in = ClientFrames.masked(WebSocketOpcode.PONG, true, new byte[125]);
    try {
      WebSocketFrame frame = codec.decode(in);
      Assertions.assertThat(frame).isNotNull();
      Assertions.assertThat(frame.payloadLength()).isEqualTo(125);
      frame.release();
    } finally {
      in.release();
    }
  }

  @Test
  void lengthWithMostSignificantBitIsRejected() {
    ByteBuf in =
        Unpooled.buffer()
            .writeByte(0x82)
            .writeByte(0x80 | 127)
            .writeLong(0x8000_0000_0000_0001L)
            .writeInt(ClientFrames.randomMask());
    assertProtocolError(new WebSocketFrameCodec(125, true), in);
  }

  @Test
  void unmaskedFrameIsRejected() {
    assertProtocolError(
        new WebSocketFrameCodec(125, true),
        ClientFrames.unmasked(WebSocketOpcode.BINARY, true, new byte[] {1}));
  }

  @Test
  void frameExceedingLimitIsRejectedFromPrefix() {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(1000, true);
    /*only length prefix, no payload yet*/
    ByteBuf in = Unpooled.buffer().writeByte(0x82).writeByte(0x80 | 126).writeShort(1001);
    assertCloseStatus(codec, in, WebSocketCloseStatus.MESSAGE_TOO_BIG);
  }

  @Test
  void encodeOversizedControlFrame() {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(125, true);
    ByteBuf payload = Unpooled.wrappedBuffer(new byte[126]);
    Assertions.assertThatThrownBy(
            () -> codec.encode(ALLOCATOR, WebSocketOpcode.PING, true, payload))
        .isInstanceOf(IllegalArgumentException.class);
    Assertions.assertThat(payload.refCnt()).isEqualTo(0);
  }

  @Test
  void encodeFragmentedControlFrame() {
    WebSocketFrameCodec codec = new WebSocketFrameCodec(125, true);
    ByteBuf payload = Unpooled.wrappedBuffer(new byte[1]);
    Assertions.assertThatThrownBy(
            () -> codec.encode(ALLOCATOR, WebSocketOpcode.CLOSE, false, payload))
        .isInstanceOf(IllegalArgumentException.class);
    Assertions.assertThat(payload.refCnt()).isEqualTo(0);
  }

  @Test
  void maxFramePayloadLengthIsAtLeastControlFrameLimit() {
    Assertions.assertThatThrownBy(() -> new WebSocketFrameCodec(124, true))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @ValueSource(ints = {0, 1, 3, 4, 5, 8, 11, 16, 1023})
  @ParameterizedTest
  void unmaskTwiceRestoresPayload(int length) {
    byte[] original = ClientFrames.randomBytes(length);
    int mask = ClientFrames.randomMask();
    ByteBuf payload = Unpooled.copiedBuffer(original);
    try {
      WebSocketFrameCodec.unmask(payload, mask);
      for (int i = 0; i < length; i++) {
        byte expected = (byte) (original[i] ^ WebSocketFrameCodec.byteAtIndex(mask, i & 3));
        Assertions.assertThat(payload.getByte(i)).isEqualTo(expected);
      }
      WebSocketFrameCodec.unmask(payload, mask);
      Assertions.assertThat(ByteBufUtil.getBytes(payload)).isEqualTo(original);
    } finally {
      payload.release();
    }
  }

  static void assertProtocolError(WebSocketFrameCodec codec, ByteBuf in) {
    assertCloseStatus(codec, in, WebSocketCloseStatus.PROTOCOL_ERROR);
  }

  static void assertCloseStatus(
      WebSocketFrameCodec codec, ByteBuf in, WebSocketCloseStatus expectedStatus) {
    try {
      CorruptedWebSocketFrameException e =
          Assertions.catchThrowableOfType(
              () -> codec.decode(in), CorruptedWebSocketFrameException.class);
      Assertions.assertThat(e).isNotNull();
      Assertions.assertThat(e.closeStatus().code()).isEqualTo(expectedStatus.code());
    } finally {
      in.release();
    }
  }
}
