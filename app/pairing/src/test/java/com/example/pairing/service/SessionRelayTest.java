package com.example.pairing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.pairing.api.OutboundMessage;
import com.example.pairing.model.ConnectionRecord;
import com.example.pairing.model.ConnectionState;
import com.example.pairing.model.Room;
import com.example.pairing.support.PairingFixture;
import com.example.pairing.support.RecordingTransport;
import com.example.pairing.transport.PeerTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class SessionRelayTest {

  private PairingFixture fixture;
  private SessionRelay relay;
  private RecordingTransport transportA;
  private RecordingTransport transportB;
  private ConnectionRecord a;
  private ConnectionRecord b;

  @BeforeEach
  void setUp() {
    fixture = new PairingFixture();
    relay = fixture.relay;
    transportA = new RecordingTransport("t-a");
    transportB = new RecordingTransport("t-b");
    a = new ConnectionRecord("conn-a", transportA);
    b = new ConnectionRecord("conn-b", transportB);
  }

  @Test
  void createRoomMovesBothToChattingAndNotifiesBoth() {
    final Room room = relay.createRoom(a, b);

    assertThat(relay.findRoom(room.roomId())).contains(room);
    assertThat(a.state()).isEqualTo(ConnectionState.CHATTING);
    assertThat(b.state()).isEqualTo(ConnectionState.CHATTING);
    assertThat(a.roomId()).isEqualTo(room.roomId());
    assertThat(b.roomId()).isEqualTo(room.roomId());
    final OutboundMessage expected =
        OutboundMessage.matched(room.roomId(), PairingFixture.PARTNER);
    assertThat(transportA.received()).containsExactly(expected);
    assertThat(transportB.received()).containsExactly(expected);
  }

  @Test
  void matchedPayloadDoesNotRevealPartnerIdentity() {
    relay.createRoom(a, b);

    final OutboundMessage matched = transportA.last();
    assertThat(matched.partner().name()).isEqualTo("Partner");
    assertThat(matched.partner().badge()).isEqualTo("Online");
    assertThat(matched.id()).isNull();
    assertThat(matched.toString()).doesNotContain("conn-b");
  }

  @Test
  void createRoomRejectsSameConnectionTwice() {
    assertThatThrownBy(() -> relay.createRoom(a, a)).isInstanceOf(IllegalArgumentException.class);
    assertThat(relay.size()).isZero();
  }

  @Test
  void createRoomRejectsConnectionAlreadyInRoom() {
    relay.createRoom(a, b);
    final ConnectionRecord c = new ConnectionRecord("conn-c", new RecordingTransport("t-c"));

    assertThatThrownBy(() -> relay.createRoom(a, c)).isInstanceOf(IllegalStateException.class);
    assertThat(relay.size()).isEqualTo(1);
  }

  @Test
  void relayForwardsTextVerbatimToPartnerOnly() {
    relay.createRoom(a, b);
    transportA.clear();
    transportB.clear();

    relay.relay(a, "  hi <b>there</b> ");

    assertThat(transportB.received()).containsExactly(OutboundMessage.chat("  hi <b>there</b> "));
    assertThat(transportA.received()).isEmpty();
    assertThat(
            fixture.meterRegistry.get("pairing.relay.total").tag("result", "delivered").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void relayToClosedPartnerNotifiesSenderAndTearsRoomDown() {
    final Room room = relay.createRoom(a, b);
    transportA.clear();
    transportB.close();

    relay.relay(a, "anyone?");

    assertThat(transportA.receivedTypes()).containsExactly("partner_left");
    assertThat(relay.findRoom(room.roomId())).isEmpty();
    assertThat(a.state()).isEqualTo(ConnectionState.IDLE);
    assertThat(a.roomId()).isNull();
    assertThat(b.roomId()).isNull();
  }

  @Test
  void relayWithoutRoomDoesNothing() {
    relay.relay(a, "hello?");

    assertThat(transportA.received()).isEmpty();
    assertThat(transportB.received()).isEmpty();
  }

  @Test
  void leaveRoomNotifiesPartnerAndResetsBoth() {
    final Room room = relay.createRoom(a, b);
    transportB.clear();

    relay.leaveRoom(a);

    assertThat(transportB.receivedTypes()).containsExactly("partner_left");
    assertThat(relay.findRoom(room.roomId())).isEmpty();
    assertThat(a.state()).isEqualTo(ConnectionState.IDLE);
    assertThat(b.state()).isEqualTo(ConnectionState.IDLE);
    assertThat(a.roomId()).isNull();
    assertThat(b.roomId()).isNull();
  }

  @Test
  void leaveRoomTwiceEmitsPartnerLeftOnce() {
    relay.createRoom(a, b);
    transportB.clear();

    relay.leaveRoom(a);
    relay.leaveRoom(a);

    assertThat(transportB.receivedTypes()).containsExactly("partner_left");
    assertThat(relay.size()).isZero();
  }

  @Test
  void leaveRoomWithoutRoomIsNoop() {
    relay.leaveRoom(a);

    assertThat(a.state()).isEqualTo(ConnectionState.IDLE);
    assertThat(transportA.received()).isEmpty();
  }

  @Test
  void leaveRoomSkipsNotificationToClosedPartner() {
    final PeerTransport closedPartner = Mockito.mock(PeerTransport.class);
    when(closedPartner.transportId()).thenReturn("t-closed");
    when(closedPartner.isOpen()).thenReturn(true);
    final ConnectionRecord partner = new ConnectionRecord("conn-closed", closedPartner);
    relay.createRoom(a, partner);
    when(closedPartner.isOpen()).thenReturn(false);
    Mockito.clearInvocations(closedPartner);

    relay.leaveRoom(a);

    verify(closedPartner, never()).send(any());
    assertThat(partner.state()).isEqualTo(ConnectionState.IDLE);
    assertThat(partner.roomId()).isNull();
  }
}
