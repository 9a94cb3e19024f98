package com.example.pairing.websocket;

import com.example.pairing.api.OutboundMessage;
import com.example.pairing.transport.PeerTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.MoreExecutors;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * {@link PeerTransport} over a Spring WebSocket session, writing JSON text frames.
 *
 * <p>{@link #send} only encodes and queues the frame; the socket write runs on the outbound
 * executor, one frame at a time per session in send order. A session whose current write has been
 * running longer than the send time limit, or whose queued bytes exceed the buffer limit, is
 * closed with {@link CloseStatus#SESSION_NOT_RELIABLE} and further frames are dropped.
 */
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "WebSocketSession と ObjectMapper はコンテナ管理のオブジェクトで複製できないため")
public class WebSocketPeerTransport implements PeerTransport {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketPeerTransport.class);

  private final ConcurrentWebSocketSessionDecorator session;
  private final ObjectMapper objectMapper;
  private final Executor outboundExecutor;
  private final Executor sequentialSender;
  private final long sendTimeLimitMillis;
  private final long bufferSizeLimit;
  private final AtomicLong pendingBytes = new AtomicLong();
  private final AtomicBoolean overflowed = new AtomicBoolean();

  public WebSocketPeerTransport(
      ConcurrentWebSocketSessionDecorator session,
      ObjectMapper objectMapper,
      Executor outboundExecutor) {
    this.session = session;
    this.objectMapper = objectMapper;
    this.outboundExecutor = outboundExecutor;
    this.sequentialSender = MoreExecutors.newSequentialExecutor(outboundExecutor);
    this.sendTimeLimitMillis = session.getSendTimeLimit();
    this.bufferSizeLimit = session.getBufferSizeLimit();
  }

  @Override
  public String transportId() {
    return session.getId();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen() && !overflowed.get();
  }

  @Override
  public void send(OutboundMessage message) {
    if (!isOpen()) {
      logger.debug("send skipped, session closed sessionId={} type={}", session.getId(), message.type());
      return;
    }
    final String json;
    try {
      json = objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode outbound message type=" + message.type(), ex);
    }
    final long size = json.getBytes(StandardCharsets.UTF_8).length;
    final long sendingMillis = session.getTimeSinceSendStarted();
    if (sendingMillis > sendTimeLimitMillis) {
      closeUnreliable(
          "send time limit exceeded elapsed=" + Duration.ofMillis(sendingMillis), message);
      return;
    }
    if (pendingBytes.addAndGet(size) > bufferSizeLimit) {
      pendingBytes.addAndGet(-size);
      closeUnreliable("send buffer limit exceeded pendingBytes=" + pendingBytes.get(), message);
      return;
    }
    try {
      sequentialSender.execute(() -> write(json, size, message.type()));
    } catch (RejectedExecutionException ex) {
      pendingBytes.addAndGet(-size);
      logger.debug("send rejected, outbound executor stopped sessionId={}", session.getId());
    }
  }

  private void write(String json, long size, String type) {
    try {
      session.sendMessage(new TextMessage(json));
    } catch (IOException | IllegalStateException ex) {
      logger.warn("send failed, message dropped sessionId={} type={}", session.getId(), type, ex);
    } finally {
      pendingBytes.addAndGet(-size);
    }
  }

  private void closeUnreliable(String cause, OutboundMessage message) {
    if (!overflowed.compareAndSet(false, true)) {
      return;
    }
    logger.warn(
        "slow peer, closing sessionId={} type={} cause={}", session.getId(), message.type(), cause);
    try {
      // 詰まっている送信の後ろに並べない
      outboundExecutor.execute(this::closeSession);
    } catch (RejectedExecutionException ex) {
      logger.debug("close rejected, outbound executor stopped sessionId={}", session.getId());
    }
  }

  private void closeSession() {
    try {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    } catch (IOException ex) {
      logger.warn("close failed sessionId={}", session.getId(), ex);
    }
  }
}
