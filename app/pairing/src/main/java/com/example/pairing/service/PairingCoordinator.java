package com.example.pairing.service;

import com.example.pairing.transport.PeerTransport;
import com.google.common.util.concurrent.Futures;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Serialises every pairing event onto one dedicated thread.
 *
 * <p>WebSocket callbacks and the periodic tick arrive on arbitrary threads. Each one is submitted
 * here as a task, so registry, pool and room state are only touched by the coordinator thread and
 * one event is fully applied before the next starts.
 */
@Component
public class PairingCoordinator {

  static final String MDC_SESSION_ID = "session_id";

  private static final Logger logger = LoggerFactory.getLogger(PairingCoordinator.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final ProtocolHandler protocolHandler;
  private final ExecutorService executor;

  public PairingCoordinator(
      ProtocolHandler protocolHandler,
      @Qualifier("pairingCoordinatorExecutor") ExecutorService executor) {
    this.protocolHandler = protocolHandler;
    this.executor = executor;
  }

  public Future<?> connect(PeerTransport transport) {
    return submit(transport, () -> protocolHandler.onConnect(transport));
  }

  public Future<?> receive(PeerTransport transport, String payload) {
    return submit(transport, () -> protocolHandler.onText(transport, payload));
  }

  public Future<?> disconnect(PeerTransport transport) {
    return submit(transport, () -> protocolHandler.onDisconnect(transport));
  }

  public Future<?> tick() {
    return submit(null, protocolHandler::onTick);
  }

  @PreDestroy
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.warn("pairing coordinator did not stop in time, forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private Future<?> submit(PeerTransport transport, Runnable event) {
    final String sessionId = transport == null ? null : transport.transportId();
    try {
      return executor.submit(() -> runEvent(sessionId, event));
    } catch (RejectedExecutionException ex) {
      // 停止処理中に届いたイベントは捨てる
      logger.debug("pairing event dropped, coordinator stopped sessionId={}", sessionId);
      return Futures.immediateCancelledFuture();
    }
  }

  private void runEvent(String sessionId, Runnable event) {
    if (sessionId != null) {
      MDC.put(MDC_SESSION_ID, sessionId);
    }
    try {
      event.run();
    } catch (RuntimeException ex) {
      // 1 件の失敗でコーディネータを止めない
      logger.error("pairing event failed sessionId={}", sessionId, ex);
    } finally {
      MDC.remove(MDC_SESSION_ID);
    }
  }
}
