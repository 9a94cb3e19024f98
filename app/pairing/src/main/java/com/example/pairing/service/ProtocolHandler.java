package com.example.pairing.service;

import com.example.pairing.api.MalformedInboundMessageException;
import com.example.pairing.api.OutboundMessage;
import com.example.pairing.api.request.InboundMessage;
import com.example.pairing.api.request.InboundMessageDecoder;
import com.example.pairing.model.ConnectionRecord;
import com.example.pairing.model.ConnectionState;
import com.example.pairing.model.MatchPair;
import com.example.pairing.transport.PeerTransport;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Per-connection state machine: {@code idle -> searching -> chatting -> idle}.
 *
 * <p>Every method runs one event to completion and must be called from the coordinator thread.
 * Malformed frames and protocol misuse are dropped without a reply.
 */
@Service
public class ProtocolHandler {

  static final String DISCARD_NOT_IN_ROOM = "not_in_room";

  private static final Logger logger = LoggerFactory.getLogger(ProtocolHandler.class);

  private final ConnectionRegistry registry;
  private final MatchmakingPool pool;
  private final SessionRelay sessionRelay;
  private final InboundMessageDecoder decoder;
  private final PairingMetrics metrics;

  public ProtocolHandler(
      ConnectionRegistry registry,
      MatchmakingPool pool,
      SessionRelay sessionRelay,
      InboundMessageDecoder decoder,
      PairingMetrics metrics) {
    this.registry = registry;
    this.pool = pool;
    this.sessionRelay = sessionRelay;
    this.decoder = decoder;
    this.metrics = metrics;
  }

  public ConnectionRecord onConnect(PeerTransport transport) {
    final ConnectionRecord record = registry.register(transport);
    logger.info("connection registered connectionId={}", record.connectionId());
    updateOccupancy();
    return record;
  }

  public void onText(PeerTransport transport, String payload) {
    final ConnectionRecord record = registry.lookup(transport).orElse(null);
    if (record == null) {
      logger.debug("message from unregistered transport ignored");
      return;
    }
    final InboundMessage message;
    try {
      message = decoder.decode(payload);
    } catch (MalformedInboundMessageException ex) {
      metrics.recordDiscarded(ex.reason());
      logger.debug(
          "inbound message discarded connectionId={} reason={}",
          record.connectionId(),
          ex.reason());
      return;
    }
    switch (message.type()) {
      case FIND:
        find(record, message);
        break;
      case CANCEL:
        cancel(record);
        break;
      case CHAT:
        chat(record, message.text());
        break;
      case LEAVE:
        leave(record);
        break;
      default:
        throw new IllegalStateException("unhandled inbound type: " + message.type());
    }
    updateOccupancy();
  }

  /**
   * 役割: 切断された接続の後始末を行う。
   * 動作: 状態に関わらず dequeue → room 退出 → registry 削除の順で必ず実行する。
   */
  public void onDisconnect(PeerTransport transport) {
    final Optional<ConnectionRecord> record = registry.lookup(transport);
    if (record.isEmpty()) {
      return;
    }
    pool.dequeue(record.get());
    sessionRelay.leaveRoom(record.get());
    registry.unregister(transport);
    logger.info("connection unregistered connectionId={}", record.get().connectionId());
    updateOccupancy();
  }

  public Optional<MatchPair> onTick() {
    final Optional<MatchPair> pair = pool.attemptMatch();
    updateOccupancy();
    return pair;
  }

  private void find(ConnectionRecord record, InboundMessage message) {
    pool.enqueue(record, message.preferences());
    record.transport().send(OutboundMessage.searching());
    pool.attemptMatch();
  }

  private void cancel(ConnectionRecord record) {
    if (record.state() == ConnectionState.SEARCHING) {
      pool.dequeue(record);
      record.resetToIdle();
    }
    record.transport().send(OutboundMessage.canceled());
  }

  private void chat(ConnectionRecord record, String text) {
    if (!record.inRoom()) {
      metrics.recordDiscarded(DISCARD_NOT_IN_ROOM);
      return;
    }
    sessionRelay.relay(record, text);
  }

  private void leave(ConnectionRecord record) {
    sessionRelay.leaveRoom(record);
    pool.dequeue(record);
    record.resetToIdle();
    record.transport().send(OutboundMessage.left());
  }

  private void updateOccupancy() {
    metrics.updateOccupancy(registry.size(), pool.size(), sessionRelay.size());
  }
}
