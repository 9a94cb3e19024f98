/*
 * どこで: Pairing ドメインモデル
 * 何を: 1 回のマッチ成立結果を表現する
 * なぜ: Pool から呼び出し元へ成立内容を返すため
 */
package com.example.pairing.model;

import java.time.Instant;

public record MatchPair(
    String roomId, PoolEntry first, PoolEntry second, MatchScore score, Instant matchedAt) {}
