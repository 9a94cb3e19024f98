/*
 * どこで: Pairing トランスポート層
 * 何を: 1 接続分の送信口を抽象化する
 * なぜ: WebSocket 実装とテスト用の差し替えを容易にするため
 */
package com.example.pairing.transport;

import com.example.pairing.api.OutboundMessage;

public interface PeerTransport {

  /** Transport-level identifier. Never sent to peers. */
  String transportId();

  boolean isOpen();

  /** Best effort. A closed transport or a failed write drops the message. */
  void send(OutboundMessage message);
}
