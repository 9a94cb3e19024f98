package com.example.pairing.service;

import com.example.common.RandomIds;
import com.example.pairing.api.OutboundMessage;
import com.example.pairing.api.PartnerDescriptor;
import com.example.pairing.model.ConnectionRecord;
import com.example.pairing.model.Room;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the active rooms and moves messages between the two members of a room.
 *
 * <p>Accessed only from the coordinator thread. Nothing is queued: a message whose target is gone
 * is dropped and the room is torn down.
 */
@Service
public class SessionRelay {

  static final String RELAY_DELIVERED = "delivered";
  static final String RELAY_PARTNER_GONE = "partner_gone";

  private static final Logger logger = LoggerFactory.getLogger(SessionRelay.class);

  private final Map<String, Room> rooms = new HashMap<>();
  private final PartnerDescriptor partnerDescriptor;
  private final PairingMetrics metrics;
  private final Clock clock;

  public SessionRelay(PartnerDescriptor partnerDescriptor, PairingMetrics metrics, Clock clock) {
    this.partnerDescriptor = partnerDescriptor;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: マッチした 2 接続で room を作成し、双方へ matched を通知する。
   * 動作: 両者を chatting へ遷移させ、room 参照を設定する。
   * 前提: 両者とも Pool から取り除かれており、他の room に属していない。
   */
  public Room createRoom(ConnectionRecord first, ConnectionRecord second) {
    final Room room = new Room(RandomIds.newId(), first, second, Instant.now(clock));
    if (first.inRoom() || second.inRoom()) {
      throw new IllegalStateException(
          "connection already in a room: " + (first.inRoom() ? first : second).connectionId());
    }
    rooms.put(room.roomId(), room);
    first.joinRoom(room.roomId());
    second.joinRoom(room.roomId());
    final OutboundMessage matched = OutboundMessage.matched(room.roomId(), partnerDescriptor);
    first.transport().send(matched);
    second.transport().send(matched);
    logger.info(
        "room created roomId={} first={} second={}",
        room.roomId(),
        first.connectionId(),
        second.connectionId());
    return room;
  }

  /**
   * 役割: room 内の相手へ chat を転送する。
   * 動作: 相手の transport が閉じていれば送信者へ partner_left を返して room を解体する。
   */
  public void relay(ConnectionRecord from, String text) {
    final Room room = from.inRoom() ? rooms.get(from.roomId()) : null;
    if (room == null) {
      return;
    }
    final ConnectionRecord partner = room.partnerOf(from);
    if (!partner.isOpen()) {
      from.transport().send(OutboundMessage.partnerLeft());
      leaveRoom(from);
      metrics.recordRelay(RELAY_PARTNER_GONE);
      return;
    }
    partner.transport().send(OutboundMessage.chat(text));
    metrics.recordRelay(RELAY_DELIVERED);
  }

  /**
   * 役割: 接続を room から外し、room を解体する。
   * 動作: 相手が生存していれば partner_left を送り、相手も自分も idle へ戻す。room が無ければ何もしない。
   */
  public void leaveRoom(ConnectionRecord connection) {
    if (!connection.inRoom()) {
      return;
    }
    final Room room = rooms.remove(connection.roomId());
    if (room != null && room.hasMember(connection)) {
      final ConnectionRecord partner = room.partnerOf(connection);
      if (partner.isOpen()) {
        partner.transport().send(OutboundMessage.partnerLeft());
      }
      if (room.roomId().equals(partner.roomId())) {
        partner.resetToIdle();
      }
      logger.info(
          "room closed roomId={} leaver={} partner={}",
          room.roomId(),
          connection.connectionId(),
          partner.connectionId());
    }
    connection.resetToIdle();
  }

  public Optional<Room> findRoom(String roomId) {
    return Optional.ofNullable(rooms.get(roomId));
  }

  public int size() {
    return rooms.size();
  }
}
