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

/** Immutable per-session settings, shared by all sessions created by one protocol handler. */
public final class WebSocketSessionConfig {
  private final int maxMessageSize;
  private final boolean expectMaskedFrames;
  private final long idleTimeoutMillis;
  private final long pingTimeoutMillis;
  private final long closeTimeoutMillis;

  private WebSocketSessionConfig(
      int maxMessageSize,
      boolean expectMaskedFrames,
      long idleTimeoutMillis,
      long pingTimeoutMillis,
      long closeTimeoutMillis) {
    this.maxMessageSize = maxMessageSize;
    this.expectMaskedFrames = expectMaskedFrames;
    this.idleTimeoutMillis = idleTimeoutMillis;
    this.pingTimeoutMillis = pingTimeoutMillis;
    this.closeTimeoutMillis = closeTimeoutMillis;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static WebSocketSessionConfig defaultConfig() {
    return Builder.DEFAULT;
  }

  /** @return limit of single frame payload and of reassembled message */
  public int maxMessageSize() {
    return maxMessageSize;
  }

  public boolean expectMaskedFrames() {
    return expectMaskedFrames;
  }

  /** @return inbound silence after which ping is sent, 0 if idle policy is disabled */
  public long idleTimeoutMillis() {
    return idleTimeoutMillis;
  }

  /** @return silence after idle ping after which session is closed with 1001 */
  public long pingTimeoutMillis() {
    return pingTimeoutMillis;
  }

  /** @return wait for peer close frame after local close, 0 means wait indefinitely */
  public long closeTimeoutMillis() {
    return closeTimeoutMillis;
  }

  @Override
  public String toString() {
    return "WebSocketSessionConfig{"
        + "maxMessageSize="
        + maxMessageSize
        + ", expectMaskedFrames="
        + expectMaskedFrames
        + ", idleTimeoutMillis="
        + idleTimeoutMillis
        + ", pingTimeoutMillis="
        + pingTimeoutMillis
        + ", closeTimeoutMillis="
        + closeTimeoutMillis
        + '}';
  }

  public static final class Builder {
    static final WebSocketSessionConfig DEFAULT = new Builder().build();

    private int maxMessageSize = 65_536;
    private boolean expectMaskedFrames = true;
    private long idleTimeoutMillis;
    private long pingTimeoutMillis = 10_000;
    private long closeTimeoutMillis = 5_000;

    private Builder() {}

    /**
     * @param maxMessageSize max size of frame payload and reassembled message, at least 125
     * @return this Builder instance
     */
    public Builder maxMessageSize(int maxMessageSize) {
      if (maxMessageSize < WebSocketProtocol.MAX_CONTROL_FRAME_PAYLOAD_LENGTH) {
        throw new IllegalArgumentException(
            "maxMessageSize must be at least "
                + WebSocketProtocol.MAX_CONTROL_FRAME_PAYLOAD_LENGTH
                + ", provided: "
                + maxMessageSize);
      }
      this.maxMessageSize = maxMessageSize;
      return this;
    }

    /**
     * @param expectMaskedFrames true if unmasked inbound frames close session with 1002
     * @return this Builder instance
     */
    public Builder expectMaskedFrames(boolean expectMaskedFrames) {
      this.expectMaskedFrames = expectMaskedFrames;
      return this;
    }

    /**
     * @param idleTimeoutMillis inbound silence after which ping is sent. 0 disables idle policy
     * @return this Builder instance
     */
    public Builder idleTimeoutMillis(long idleTimeoutMillis) {
      this.idleTimeoutMillis = requireNonNegative(idleTimeoutMillis, "idleTimeoutMillis");
      return this;
    }

    /**
     * @param pingTimeoutMillis silence after idle ping after which session is closed
     * @return this Builder instance
     */
    public Builder pingTimeoutMillis(long pingTimeoutMillis) {
      this.pingTimeoutMillis = requirePositive(pingTimeoutMillis, "pingTimeoutMillis");
      return this;
    }

    /**
     * @param closeTimeoutMillis wait for peer close frame after local close. 0 waits indefinitely
     * @return this Builder instance
     */
    public Builder closeTimeoutMillis(long closeTimeoutMillis) {
      this.closeTimeoutMillis = requireNonNegative(closeTimeoutMillis, "closeTimeoutMillis");
      return this;
    }

    public WebSocketSessionConfig build() {
      return new WebSocketSessionConfig(
          maxMessageSize,
          expectMaskedFrames,
          idleTimeoutMillis,
          pingTimeoutMillis,
          closeTimeoutMillis);
    }

    static long requirePositive(long val, String desc) {
      if (val <= 0) {
        throw new IllegalArgumentException(desc + " must be positive, provided: " + val);
      }
      return val;
    }

    static long requireNonNegative(long val, String desc) {
      if (val < 0) {
        throw new IllegalArgumentException(desc + " must be non-negative, provided: " + val);
      }
      return val;
    }
  }
}
