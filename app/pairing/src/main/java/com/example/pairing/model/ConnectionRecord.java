package com.example.pairing.model;

import com.example.pairing.transport.PeerTransport;
import java.util.Objects;

/**
 * Registry-owned state of one live connection.
 *
 * <p>Not thread-safe. Instances are only read and mutated from the coordinator thread.
 */
public final class ConnectionRecord {

  private final String connectionId;
  private final PeerTransport transport;
  private ConnectionState state = ConnectionState.IDLE;
  private Preferences preferences = Preferences.ANY;
  private String roomId;

  public ConnectionRecord(String connectionId, PeerTransport transport) {
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  public String connectionId() {
    return connectionId;
  }

  public PeerTransport transport() {
    return transport;
  }

  public ConnectionState state() {
    return state;
  }

  public Preferences preferences() {
    return preferences;
  }

  public String roomId() {
    return roomId;
  }

  public boolean inRoom() {
    return roomId != null;
  }

  public boolean isOpen() {
    return transport.isOpen();
  }

  public void startSearching(Preferences preferences) {
    this.preferences = preferences == null ? Preferences.ANY : preferences;
    this.state = ConnectionState.SEARCHING;
    this.roomId = null;
  }

  public void joinRoom(String roomId) {
    this.roomId = Objects.requireNonNull(roomId, "roomId");
    this.state = ConnectionState.CHATTING;
  }

  public void resetToIdle() {
    this.roomId = null;
    this.state = ConnectionState.IDLE;
  }

  @Override
  public String toString() {
    return "ConnectionRecord[connectionId=" + connectionId + ", state=" + state + ", roomId=" + roomId + "]";
  }
}
