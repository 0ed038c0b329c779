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

import static io.websock.engine.WebSocketProtocol.MAX_CONTROL_FRAME_PAYLOAD_LENGTH;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.CorruptedWebSocketFrameException;
import javax.annotation.Nullable;

/**
 * Encodes and decodes single RFC 6455 frames. Decoding is incremental: caller accumulates inbound
 * bytes and retries after {@link #decode(ByteBuf)} returns null. Outbound frames are never masked.
 */
public final class WebSocketFrameCodec {
  static final int PREFIX_SIZE_SMALL = 2;
  static final int PREFIX_SIZE_MEDIUM = 4;
  static final int PREFIX_SIZE_LARGE = 10;
  static final int MASK_SIZE = 4;

  static final int LENGTH_MEDIUM = 126;
  static final int LENGTH_LARGE = 127;

  private final int maxFramePayloadLength;
  private final boolean expectMaskedFrames;

  /**
   * @param maxFramePayloadLength frames with larger declared payload are rejected with 1009
   * @param expectMaskedFrames if true, unmasked frames are rejected with 1002
   */
  public WebSocketFrameCodec(int maxFramePayloadLength, boolean expectMaskedFrames) {
    if (maxFramePayloadLength < MAX_CONTROL_FRAME_PAYLOAD_LENGTH) {
      throw new IllegalArgumentException(
          "maxFramePayloadLength must be at least "
              + MAX_CONTROL_FRAME_PAYLOAD_LENGTH
              + ", provided: "
              + maxFramePayloadLength);
    }
    this.maxFramePayloadLength = maxFramePayloadLength;
    this.expectMaskedFrames = expectMaskedFrames;
  }

  /**
   * @param in inbound bytes starting at reader index
   * @return decoded frame with reader index advanced past it, or null if in does not contain
   *     whole frame yet. In that case reader index is not changed
   * @throws CorruptedWebSocketFrameException if frame violates protocol or exceeds payload limit.
   *     Thrown as soon as frame prefix allows it to be detected
   */
  @Nullable
  public WebSocketFrame decode(ByteBuf in) {
    int readableBytes = in.readableBytes();
    if (readableBytes < PREFIX_SIZE_SMALL) {
      return null;
    }
    int index = in.readerIndex();
    int flagsAndOpcode = in.getUnsignedByte(index);
    int maskAndLen = in.getUnsignedByte(index + 1);

    boolean fin = (flagsAndOpcode & 0x80) == 0x80;
    int rsv = flagsAndOpcode & 0x70;
    if (rsv != 0) {
      throw WebSocketProtocol.protocolError(
          "extensions are not supported, reserved bits: " + Integer.toBinaryString(rsv >> 4));
    }
    int code = flagsAndOpcode & 0x0F;
    WebSocketOpcode opcode = WebSocketOpcode.valueOf(code);
    if (opcode == null) {
      throw WebSocketProtocol.protocolError("reserved opcode: " + code);
    }
    boolean masked = (maskAndLen & 0x80) == 0x80;
    if (expectMaskedFrames && !masked) {
      throw WebSocketProtocol.protocolError("unmasked frame, opcode: " + opcode);
    }
    int len = maskAndLen & 0x7F;
    if (opcode.isControl()) {
      if (!fin) {
        throw WebSocketProtocol.protocolError("fragmented control frame: " + opcode);
      }
      if (len > MAX_CONTROL_FRAME_PAYLOAD_LENGTH) {
        throw WebSocketProtocol.protocolError(
            "control frame "
                + opcode
                + " payload exceeds limit: "
                + MAX_CONTROL_FRAME_PAYLOAD_LENGTH);
      }
    }

    long length;
    int prefixLength;
    if (len < LENGTH_MEDIUM) {
      length = len;
      prefixLength = PREFIX_SIZE_SMALL;
    } else if (len == LENGTH_MEDIUM) {
      if (readableBytes < PREFIX_SIZE_MEDIUM) {
        return null;
      }
      length = in.getUnsignedShort(index + PREFIX_SIZE_SMALL);
      prefixLength = PREFIX_SIZE_MEDIUM;
    } else {
      if (readableBytes < PREFIX_SIZE_LARGE) {
        return null;
      }
      length = in.getLong(index + PREFIX_SIZE_SMALL);
      if (length < 0) {
        throw WebSocketProtocol.protocolError("most significant bit of 64-bit length is set");
      }
      prefixLength = PREFIX_SIZE_LARGE;
    }
    if (length > maxFramePayloadLength) {
      throw WebSocketProtocol.messageTooBig(length, maxFramePayloadLength);
    }

    int headerLength = masked ? prefixLength + MASK_SIZE : prefixLength;
    if (readableBytes < headerLength + length) {
      return null;
    }
    int mask = masked ? in.getInt(index + prefixLength) : 0;
    in.skipBytes(headerLength);

    int payloadLength = (int) length;
    ByteBuf payload;
    if (payloadLength == 0) {
      payload = Unpooled.EMPTY_BUFFER;
    } else {
      payload = in.readRetainedSlice(payloadLength);
      if (masked) {
        unmask(payload, mask);
      }
    }
    return new WebSocketFrame(fin, opcode, masked, mask, payload);
  }

  /**
   * Encodes server frame: no masking, reserved bits are zero, shortest length encoding.
   *
   * @param payload frame payload, released by this method
   * @return frame bytes
   * @throws IllegalArgumentException if control frame is fragmented or its payload exceeds 125
   */
  public ByteBuf encode(
      ByteBufAllocator allocator, WebSocketOpcode opcode, boolean fin, ByteBuf payload) {
    try {
      int payloadLength = payload.readableBytes();
      if (opcode.isControl()) {
        if (!fin) {
          throw new IllegalArgumentException("control frame must not be fragmented: " + opcode);
        }
        if (payloadLength > MAX_CONTROL_FRAME_PAYLOAD_LENGTH) {
          throw new IllegalArgumentException(
              "control frame "
                  + opcode
                  + " payloadSize: "
                  + payloadLength
                  + " exceeds limit: "
                  + MAX_CONTROL_FRAME_PAYLOAD_LENGTH);
        }
      }
      int flagsAndOpcode = fin ? 0x80 | opcode.code() : opcode.code();
      ByteBuf frame;
      if (payloadLength < LENGTH_MEDIUM) {
        frame =
            allocator
                .buffer(PREFIX_SIZE_SMALL + payloadLength)
                .writeByte(flagsAndOpcode)
                .writeByte(payloadLength);
      } else if (payloadLength <= 0xFFFF) {
        frame =
            allocator
                .buffer(PREFIX_SIZE_MEDIUM + payloadLength)
                .writeByte(flagsAndOpcode)
                .writeByte(LENGTH_MEDIUM)
                .writeShort(payloadLength);
      } else {
        frame =
            allocator
                .buffer(PREFIX_SIZE_LARGE + payloadLength)
                .writeByte(flagsAndOpcode)
                .writeByte(LENGTH_LARGE)
                .writeLong(payloadLength);
      }
      return frame.writeBytes(payload);
    } finally {
      payload.release();
    }
  }

  /** @return number of bytes encoded frame with given payload length occupies */
  public static int sizeofFrame(int payloadLength) {
    if (payloadLength < LENGTH_MEDIUM) {
      return PREFIX_SIZE_SMALL + payloadLength;
    }
    if (payloadLength <= 0xFFFF) {
      return PREFIX_SIZE_MEDIUM + payloadLength;
    }
    return PREFIX_SIZE_LARGE + payloadLength;
  }

  /**
   * XORs readable bytes of payload with masking key in place: byte i is XORed with key byte i mod
   * 4. Applying it twice with same key restores original payload.
   *
   * @param payload bytes to (un)mask
   * @param mask 4-byte masking key in network order
   */
  public static void unmask(ByteBuf payload, int mask) {
    int start = payload.readerIndex();
    int end = payload.writerIndex();
    int cur = start;

    if (end - cur >= 8) {
      long longMask = (long) mask & 0xFFFFFFFFL;
      longMask |= longMask << 32;

      for (; cur <= end - 8; cur += 8) {
        payload.setLong(cur, payload.getLong(cur) ^ longMask);
      }
    }

    if (cur <= end - 4) {
      payload.setInt(cur, payload.getInt(cur) ^ mask);
      cur += 4;
    }

    int offset = 0;
    for (; cur < end; cur++) {
      payload.setByte(cur, payload.getByte(cur) ^ byteAtIndex(mask, offset++ & 3));
    }
  }

  static int byteAtIndex(int mask, int index) {
    return (mask >> 8 * (3 - index)) & 0xFF;
  }
}
