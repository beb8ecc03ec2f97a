package com.nepsegateway.marketgateway.transport.queue;

import com.nepsegateway.marketgateway.config.QueueProperties;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;

/**
 * ZeroMQ REP binding of the route table. A single thread serves requests strictly one at a time;
 * the receive timeout lets the loop notice shutdown.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "gateway.queue.enabled", havingValue = "true")
public class QueueServer implements SmartLifecycle {

  private final QueueMessageHandler handler;
  private final QueueProperties properties;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private ZContext context;
  private Thread serveThread;

  public QueueServer(QueueMessageHandler handler, QueueProperties properties) {
    this.handler = handler;
    this.properties = properties;
  }

  @Override
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    context = new ZContext();
    ZMQ.Socket socket = context.createSocket(SocketType.REP);
    socket.setReceiveTimeOut((int) properties.receiveTimeout().toMillis());
    socket.bind(properties.bindAddress());

    serveThread = new Thread(() -> serve(socket), "queue-rep-server");
    serveThread.setDaemon(true);
    serveThread.start();
    log.info("Queue server listening on {}", properties.bindAddress());
  }

  @Override
  public void stop() {
    // The context outlives a serve loop that died on its own, so it is released here either way.
    if (context == null) {
      return;
    }
    running.set(false);
    try {
      serveThread.join(properties.receiveTimeout().toMillis() * 2);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    context.close();
    context = null;
    log.info("Queue server stopped");
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  private void serve(ZMQ.Socket socket) {
    try {
      while (running.get()) {
        String request = socket.recvStr();
        if (request == null) {
          continue;
        }
        socket.send(handler.handle(request));
      }
    } catch (RuntimeException ex) {
      if (running.get()) {
        log.error("Queue serve loop failed: {}", ex.getMessage(), ex);
      }
    } finally {
      running.set(false);
      socket.close();
    }
  }
}
