/*
 * どこで: Pairing ドメインモデル
 * 何を: マッチング待ちの 1 件を表現する
 * なぜ: 希望条件のスナップショットと enqueue 時刻をスコア計算へ渡すため
 */
package com.example.pairing.model;

import java.time.Instant;

public record PoolEntry(ConnectionRecord connection, Preferences preferences, Instant enqueuedAt) {

  public String connectionId() {
    return connection.connectionId();
  }
}
