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
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpRequest;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/** Immutable snapshot of HTTP upgrade request: method, path and case-insensitive headers. */
public final class HandshakeRequest {
  private final String method;
  private final String path;
  private final HttpHeaders headers;

  public HandshakeRequest(String method, String path, HttpHeaders headers) {
    this.method = Objects.requireNonNull(method, "method");
    this.path = Objects.requireNonNull(path, "path");
    this.headers = new DefaultHttpHeaders().add(Objects.requireNonNull(headers, "headers"));
  }

  public static HandshakeRequest from(HttpRequest request) {
    return new HandshakeRequest(request.method().name(), path(request.uri()), request.headers());
  }

  /** @return path component of request uri, or uri itself if it can not be parsed */
  static String path(String uri) {
    try {
      String path = new URI(uri).getPath();
      return path == null || path.isEmpty() ? uri : path;
    } catch (URISyntaxException e) {
      return uri;
    }
  }

  public String method() {
    return method;
  }

  public String path() {
    return path;
  }

  /** @return copy of request headers */
  public HttpHeaders headers() {
    return headers.copy();
  }

  /** @return first value of header with given case-insensitive name, null if absent */
  @Nullable
  public String header(CharSequence name) {
    return headers.get(name);
  }

  /** @return all values of header with given case-insensitive name, empty if absent */
  public List<String> headerValues(CharSequence name) {
    return headers.getAll(name);
  }

  /**
   * @return true if header with given name contains given token in its comma-separated values,
   *     both compared case-insensitively
   */
  public boolean containsToken(CharSequence name, CharSequence token) {
    return headers.containsValue(name, token, true);
  }

  @Override
  public String toString() {
    return "HandshakeRequest{method=" + method + ", path=" + path + ", headers=" + headers + '}';
  }
}
