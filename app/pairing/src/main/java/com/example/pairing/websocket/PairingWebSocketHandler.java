/*
 * どこで: Pairing WebSocket 入口
 * 何を: WebSocket のライフサイクルと受信テキストをコーディネータへ渡す
 * なぜ: コンテナのスレッドから状態を直接触らず、送信はコーディネータ外で行うため
 */
package com.example.pairing.websocket;

import com.example.pairing.config.PairingProperties;
import com.example.pairing.service.PairingCoordinator;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import java.util.concurrent.ExecutorService;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class PairingWebSocketHandler extends TextWebSocketHandler {

  static final String ATTRIBUTE_TRANSPORT = PairingWebSocketHandler.class.getName() + ".TRANSPORT";

  private static final Logger logger = LoggerFactory.getLogger(PairingWebSocketHandler.class);

  private final PairingCoordinator coordinator;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final ExecutorService outboundExecutor;
  private final PairingProperties properties;

  public PairingWebSocketHandler(
      PairingCoordinator coordinator,
      ObjectMapper objectMapper,
      @Qualifier("pairingOutboundExecutor") ExecutorService outboundExecutor,
      PairingProperties properties) {
    this.coordinator = coordinator;
    this.objectMapper = objectMapper;
    this.outboundExecutor = outboundExecutor;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    final ConcurrentWebSocketSessionDecorator decorated =
        new ConcurrentWebSocketSessionDecorator(
            session,
            Math.toIntExact(properties.sendTimeLimit().toMillis()),
            properties.sendBufferSizeLimit());
    final WebSocketPeerTransport transport =
        new WebSocketPeerTransport(decorated, objectMapper, outboundExecutor);
    session.getAttributes().put(ATTRIBUTE_TRANSPORT, transport);
    logger.info(
        "websocket connection established sessionId={} clientIp={}",
        session.getId(),
        session.getAttributes().get(ClientAddressHandshakeInterceptor.ATTRIBUTE_CLIENT_IP));
    coordinator.connect(transport);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    final WebSocketPeerTransport transport = transportOf(session);
    if (transport == null) {
      logger.warn("text message before connection setup sessionId={}", session.getId());
      return;
    }
    coordinator.receive(transport, message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.warn("websocket transport error sessionId={}", session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    final WebSocketPeerTransport transport = transportOf(session);
    logger.info("websocket connection closed sessionId={} status={}", session.getId(), status);
    if (transport != null) {
      coordinator.disconnect(transport);
    }
  }

  private WebSocketPeerTransport transportOf(WebSocketSession session) {
    final Object attribute = session.getAttributes().get(ATTRIBUTE_TRANSPORT);
    return attribute instanceof WebSocketPeerTransport transport ? transport : null;
  }
}
