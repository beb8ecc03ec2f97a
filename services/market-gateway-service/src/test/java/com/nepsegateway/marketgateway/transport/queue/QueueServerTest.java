package com.nepsegateway.marketgateway.transport.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.nepsegateway.marketgateway.config.QueueProperties;
import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;

class QueueServerTest {

  private QueueServer server;

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.stop();
    }
  }

  @Test
  void answersEachRequestOverRepSocket() throws Exception {
    int port = freePort();
    QueueMessageHandler handler = mock(QueueMessageHandler.class);
    when(handler.handle("{\"route\":\"TopGainers\"}"))
        .thenReturn("{\"route\":\"TopGainers\",\"data\":[]}");
    server =
        new QueueServer(
            handler,
            new QueueProperties(true, "tcp://127.0.0.1:" + port, Duration.ofMillis(100)));

    server.start();
    assertThat(server.isRunning()).isTrue();

    try (ZContext context = new ZContext()) {
      ZMQ.Socket client = context.createSocket(SocketType.REQ);
      client.setReceiveTimeOut(5000);
      client.connect("tcp://127.0.0.1:" + port);

      client.send("{\"route\":\"TopGainers\"}");
      assertThat(client.recvStr()).isEqualTo("{\"route\":\"TopGainers\",\"data\":[]}");
    }
  }

  @Test
  void stopEndsTheServeLoop() throws Exception {
    server =
        new QueueServer(
            mock(QueueMessageHandler.class),
            new QueueProperties(true, "tcp://127.0.0.1:" + freePort(), Duration.ofMillis(100)));

    server.start();
    server.stop();

    assertThat(server.isRunning()).isFalse();
  }

  @Test
  void failedServeLoopNoLongerReportsRunning() throws Exception {
    int port = freePort();
    QueueMessageHandler handler = mock(QueueMessageHandler.class);
    when(handler.handle(anyString())).thenThrow(new IllegalStateException("serialization failed"));
    server =
        new QueueServer(
            handler,
            new QueueProperties(true, "tcp://127.0.0.1:" + port, Duration.ofMillis(100)));
    server.start();

    try (ZContext context = new ZContext()) {
      ZMQ.Socket client = context.createSocket(SocketType.REQ);
      client.connect("tcp://127.0.0.1:" + port);
      client.send("{\"route\":\"TopGainers\"}");

      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (server.isRunning() && System.nanoTime() < deadline) {
        Thread.sleep(20);
      }
    }

    assertThat(server.isRunning()).isFalse();
  }

  private static int freePort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }
}
