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

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.util.AsciiString;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Validates webSocket upgrade request and computes accept response. Negotiation is pure: it does
 * not touch connection state.
 */
public final class WebSocketHandshaker {
  private static final int KEY_LENGTH = 16;
  private static final int ENCODED_KEY_LENGTH = 24;
  private static final AsciiString CONNECTION_UPGRADE = AsciiString.cached("Upgrade");

  private final List<String> subprotocols;

  public WebSocketHandshaker() {
    this(Collections.emptyList());
  }

  /** @param subprotocols supported subprotocols, client preference order is honored */
  public WebSocketHandshaker(Collection<String> subprotocols) {
    this.subprotocols =
        Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(subprotocols, "subprotocols")));
  }

  public HandshakeResult negotiate(HandshakeRequest request) {
    String upgrade = request.header(HttpHeaderNames.UPGRADE);
    if (upgrade == null || !HttpHeaderValues.WEBSOCKET.contentEqualsIgnoreCase(upgrade.trim())) {
      return HandshakeResult.rejected(
          HttpResponseStatus.BAD_REQUEST, "missing or invalid upgrade header: " + upgrade);
    }
    if (!request.containsToken(HttpHeaderNames.CONNECTION, HttpHeaderValues.UPGRADE)) {
      return HandshakeResult.rejected(
          HttpResponseStatus.BAD_REQUEST,
          "connection header does not contain upgrade: "
              + request.header(HttpHeaderNames.CONNECTION));
    }
    String version = request.header(HttpHeaderNames.SEC_WEBSOCKET_VERSION);
    if (!WebSocketProtocol.VERSION.equals(version)) {
      return HandshakeResult.rejected(
          HttpResponseStatus.UPGRADE_REQUIRED,
          "unsupported webSocket version: " + version,
          new DefaultHttpHeaders()
              .set(HttpHeaderNames.SEC_WEBSOCKET_VERSION, WebSocketProtocol.VERSION));
    }
    String key = request.header(HttpHeaderNames.SEC_WEBSOCKET_KEY);
    if (!isValidKey(key)) {
      return HandshakeResult.rejected(
          HttpResponseStatus.BAD_REQUEST, "missing or invalid webSocket key: " + key);
    }

    HttpHeaders headers =
        new DefaultHttpHeaders()
            .set(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET)
            .set(HttpHeaderNames.CONNECTION, CONNECTION_UPGRADE)
            .set(HttpHeaderNames.SEC_WEBSOCKET_ACCEPT, acceptKey(key));
    String subprotocol = selectSubprotocol(request);
    if (subprotocol != null) {
      headers.set(HttpHeaderNames.SEC_WEBSOCKET_PROTOCOL, subprotocol);
    }
    return HandshakeResult.accepted(headers, subprotocol);
  }

  /** @return first subprotocol requested by client that is supported, null if none */
  @Nullable
  String selectSubprotocol(HandshakeRequest request) {
    if (subprotocols.isEmpty()) {
      return null;
    }
    List<String> requestedHeaders =
        request.headerValues(HttpHeaderNames.SEC_WEBSOCKET_PROTOCOL);
    for (String requestedHeader : requestedHeaders) {
      for (String requested : requestedHeader.split(",")) {
        String candidate = requested.trim();
        if (subprotocols.contains(candidate)) {
          return candidate;
        }
      }
    }
    return null;
  }

  static boolean isValidKey(@Nullable String key) {
    if (key == null) {
      return false;
    }
    String k = key.trim();
    /*canonical padded encoding of 16 bytes only*/
    if (k.length() != ENCODED_KEY_LENGTH) {
      return false;
    }
    try {
      return Base64.getDecoder().decode(k).length == KEY_LENGTH;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /** @return base64 of SHA-1 digest of key concatenated with protocol GUID */
  public static String acceptKey(String key) {
    MessageDigest sha1;
    try {
      sha1 = MessageDigest.getInstance("SHA-1");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 digest is not available", e);
    }
    byte[] digest =
        sha1.digest((key.trim() + WebSocketProtocol.GUID).getBytes(StandardCharsets.US_ASCII));
    return Base64.getEncoder().encodeToString(digest);
  }
}
