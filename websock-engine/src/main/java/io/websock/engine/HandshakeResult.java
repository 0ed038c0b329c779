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

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Outcome of upgrade request negotiation: either accepted with 101 response headers, or rejected
 * with 4xx status and reason.
 */
public final class HandshakeResult {
  private final HttpResponseStatus status;
  private final HttpHeaders headers;
  private final String reason;
  private final String subprotocol;

  private HandshakeResult(
      HttpResponseStatus status,
      HttpHeaders headers,
      @Nullable String reason,
      @Nullable String subprotocol) {
    this.status = status;
    this.headers = headers;
    this.reason = reason;
    this.subprotocol = subprotocol;
  }

  public static HandshakeResult accepted(HttpHeaders headers, @Nullable String subprotocol) {
    return new HandshakeResult(
        HttpResponseStatus.SWITCHING_PROTOCOLS,
        new DefaultHttpHeaders().add(Objects.requireNonNull(headers, "headers")),
        null,
        subprotocol);
  }

  public static HandshakeResult rejected(HttpResponseStatus status, String reason) {
    return rejected(status, reason, EmptyHttpHeaders.INSTANCE);
  }

  /**
   * @param hints response headers of rejection, e.g. supported protocol version. Must not contain
   *     upgrade headers
   */
  public static HandshakeResult rejected(
      HttpResponseStatus status, String reason, HttpHeaders hints) {
    Objects.requireNonNull(status, "status");
    int code = status.code();
    if (code < 400 || code >= 500) {
      throw new IllegalArgumentException("rejection status must be 4xx, provided: " + code);
    }
    return new HandshakeResult(
        status,
        new DefaultHttpHeaders().add(Objects.requireNonNull(hints, "hints")),
        Objects.requireNonNull(reason, "reason"),
        null);
  }

  public boolean isAccepted() {
    return reason == null;
  }

  public HttpResponseStatus status() {
    return status;
  }

  /** @return copy of response headers */
  public HttpHeaders headers() {
    return headers.copy();
  }

  /** @return rejection reason, null if accepted */
  @Nullable
  public String reason() {
    return reason;
  }

  /** @return selected subprotocol of accepted handshake, null if none */
  @Nullable
  public String subprotocol() {
    return subprotocol;
  }

  /** @return new HTTP/1.1 response for this result */
  public FullHttpResponse toHttpResponse() {
    String r = reason;
    ByteBuf content =
        r == null || r.isEmpty()
            ? Unpooled.EMPTY_BUFFER
            : Unpooled.copiedBuffer(r, StandardCharsets.UTF_8);
    FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, content);
    HttpHeaders responseHeaders = response.headers();
    responseHeaders.add(headers);
    if (r != null) {
      responseHeaders
          .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN)
          .setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
    }
    return response;
  }

  @Override
  public String toString() {
    return isAccepted()
        ? "HandshakeResult{accepted, subprotocol=" + subprotocol + '}'
        : "HandshakeResult{rejected, status=" + status + ", reason=" + reason + '}';
  }
}
