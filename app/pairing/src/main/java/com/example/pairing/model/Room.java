package com.example.pairing.model;

import java.time.Instant;

/** An active two-party session. Members are always two distinct connections. */
public record Room(String roomId, ConnectionRecord first, ConnectionRecord second, Instant createdAt) {

  public Room {
    if (first == null || second == null) {
      throw new IllegalArgumentException("room requires two members");
    }
    if (first == second || first.connectionId().equals(second.connectionId())) {
      throw new IllegalArgumentException("room members must be distinct: " + first.connectionId());
    }
  }

  public boolean hasMember(ConnectionRecord connection) {
    return first == connection || second == connection;
  }

  public ConnectionRecord partnerOf(ConnectionRecord connection) {
    if (first == connection) {
      return second;
    }
    if (second == connection) {
      return first;
    }
    throw new IllegalArgumentException(
        "connection is not a member of room " + roomId + ": " + connection.connectionId());
  }
}
