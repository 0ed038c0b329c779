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
package io.websock.echo;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.websock.engine.CloseInfo;
import io.websock.engine.HandshakeRequest;
import io.websock.engine.HandshakeResult;
import io.websock.engine.WebSocketErrorKind;
import io.websock.engine.WebSocketHandler;
import io.websock.engine.WebSocketListener;
import io.websock.engine.WebSocketMessage;
import io.websock.engine.WebSocketServerProtocolHandler;
import io.websock.engine.WebSocketSession;
import io.websock.engine.WebSocketSessionConfig;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.KeyStore;
import javax.annotation.Nullable;
import javax.net.ssl.KeyManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
  private static final Logger logger = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Exception {
    String host = System.getProperty("HOST", "localhost");
    int port = Integer.parseInt(System.getProperty("PORT", "8088"));
    String path = System.getProperty("PATH", "/echo");
    int maxMessageSize = Integer.parseInt(System.getProperty("MAX_MESSAGE_SIZE", "65536"));
    long idleTimeoutMillis = Long.parseLong(System.getProperty("IDLE_TIMEOUT_MILLIS", "30000"));
    long pingTimeoutMillis = Long.parseLong(System.getProperty("PING_TIMEOUT_MILLIS", "10000"));
    String keyStoreFile = System.getProperty("KEYSTORE");
    String keyStorePassword = System.getProperty("KEYSTORE_PASS", "");

    WebSocketSessionConfig sessionConfig =
        WebSocketSessionConfig.newBuilder()
            .maxMessageSize(maxMessageSize)
            .idleTimeoutMillis(idleTimeoutMillis)
            .pingTimeoutMillis(pingTimeoutMillis)
            .build();

    logger.info("\n==> websocket echo server\n");
    logger.info("\n==> bind address: {}:{}", host, port);
    logger.info("\n==> path: {}", path);
    logger.info("\n==> session config: {}", sessionConfig);
    logger.info("\n==> encryption: {}\n", keyStoreFile != null);

    SslContext sslContext =
        keyStoreFile != null ? serverSslContext(keyStoreFile, keyStorePassword) : null;

    EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    EventLoopGroup workerGroup = new NioEventLoopGroup();
    try {
      Channel server =
          new ServerBootstrap()
              .group(bossGroup, workerGroup)
              .channel(NioServerSocketChannel.class)
              .handler(new LoggingHandler(LogLevel.INFO))
              .childHandler(new ConnectionAcceptor(sslContext, path, sessionConfig))
              .bind(host, port)
              .sync()
              .channel();
      logger.info("\n==> Server is listening on {}:{}", host, port);
      server.closeFuture().sync();
    } finally {
      bossGroup.shutdownGracefully();
      workerGroup.shutdownGracefully();
    }
  }

  static SslContext serverSslContext(String keyStoreFile, String keyStorePassword)
      throws Exception {
    char[] password = keyStorePassword.toCharArray();
    KeyStore keyStore = KeyStore.getInstance("PKCS12");
    try (InputStream in = Files.newInputStream(Paths.get(keyStoreFile))) {
      keyStore.load(in, password);
    }
    KeyManagerFactory keyManagerFactory =
        KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    keyManagerFactory.init(keyStore, password);
    return SslContextBuilder.forServer(keyManagerFactory).build();
  }

  static class ConnectionAcceptor extends ChannelInitializer<SocketChannel> {
    private final SslContext sslContext;
    private final String path;
    private final WebSocketSessionConfig sessionConfig;

    ConnectionAcceptor(
        @Nullable SslContext sslContext, String path, WebSocketSessionConfig sessionConfig) {
      this.sslContext = sslContext;
      this.path = path;
      this.sessionConfig = sessionConfig;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
      HttpServerCodec http1Codec = new HttpServerCodec();
      HttpObjectAggregator http1Aggregator = new HttpObjectAggregator(65536);
      WebSocketServerProtocolHandler webSocketProtocolHandler =
          WebSocketServerProtocolHandler.create()
              .path(path)
              .sessionConfig(sessionConfig)
              .handshakeTimeoutMillis(15_000)
              .webSocketHandler(new EchoWebSocketHandler())
              .build();

      ChannelPipeline pipeline = ch.pipeline();
      if (sslContext != null) {
        pipeline.addLast(sslContext.newHandler(ch.alloc()));
      }
      pipeline.addLast(http1Codec).addLast(http1Aggregator).addLast(webSocketProtocolHandler);
    }
  }

  /** Sends every inbound text and binary message back to its sender. */
  static class EchoWebSocketHandler implements WebSocketHandler, WebSocketListener {

    @Override
    public WebSocketListener exchange(HandshakeRequest request, WebSocketSession session) {
      return this;
    }

    @Override
    public void onHandshakeRejected(HandshakeRequest request, HandshakeResult result) {
      logger.info("rejected upgrade request {}: {}", request.path(), result.reason());
    }

    @Override
    public void onOpen(WebSocketSession session) {
      logger.info("webSocket {} opened", session.channel());
    }

    @Override
    public void onMessage(WebSocketSession session, WebSocketMessage message) {
      if (message.isText()) {
        session.sendText(message.text());
      } else {
        session.sendBinary(message.content().retain());
      }
    }

    @Override
    public void onClose(WebSocketSession session, CloseInfo closeInfo) {
      logger.info("webSocket {} closed: {}", session.channel(), closeInfo);
    }

    @Override
    public void onError(WebSocketSession session, WebSocketErrorKind kind, Throwable cause) {
      logger.info("webSocket {} error {}: {}", session.channel(), kind, cause.getMessage());
    }
  }
}
