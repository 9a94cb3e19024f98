package com.example.pairing.service;

import com.example.pairing.model.ConnectionRecord;
import com.example.pairing.model.MatchPair;
import com.example.pairing.model.MatchScore;
import com.example.pairing.model.PoolEntry;
import com.example.pairing.model.Preferences;
import com.example.pairing.model.Room;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Connections waiting for a partner, kept in enqueue order.
 *
 * <p>Accessed only from the coordinator thread. A connection has at most one entry; re-entering
 * the pool moves it to the back.
 */
@Service
public class MatchmakingPool {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakingPool.class);

  private final Map<String, PoolEntry> entries = new LinkedHashMap<>();
  private final CompatibilityScorer scorer;
  private final SessionRelay sessionRelay;
  private final PairingMetrics metrics;
  private final Clock clock;

  public MatchmakingPool(
      CompatibilityScorer scorer, SessionRelay sessionRelay, PairingMetrics metrics, Clock clock) {
    this.scorer = scorer;
    this.sessionRelay = sessionRelay;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: 接続を searching としてプールの末尾へ追加する。
   * 動作: 既存の room 参加と Pool Entry を先に解除する (room 退出 → dequeue の順)。
   */
  public PoolEntry enqueue(ConnectionRecord connection, Preferences preferences) {
    sessionRelay.leaveRoom(connection);
    dequeue(connection);
    connection.startSearching(preferences);
    final PoolEntry entry =
        new PoolEntry(connection, connection.preferences(), Instant.now(clock));
    entries.put(connection.connectionId(), entry);
    return entry;
  }

  /** Returns true when an entry was removed; the connection is then idle. */
  public boolean dequeue(ConnectionRecord connection) {
    final PoolEntry removed = entries.remove(connection.connectionId());
    if (removed == null) {
      return false;
    }
    connection.resetToIdle();
    return true;
  }

  public boolean contains(ConnectionRecord connection) {
    return entries.containsKey(connection.connectionId());
  }

  public int size() {
    return entries.size();
  }

  /**
   * 役割: プール内で最もスコアの高いペアを 1 組だけ成立させる。
   * 動作: 閉じた接続を除去し、全ての順序なしペアを評価して合計スコアが最大のペアを選ぶ。
   *       同点は先に評価したペアを優先する。選ばれた 2 件を除去してから room を作成する。
   * 前提: 1 回の呼び出しで成立するのは最大 1 組。残りは次の tick か次の enqueue で処理される。
   */
  public Optional<MatchPair> attemptMatch() {
    purgeClosedEntries();
    if (entries.size() < 2) {
      return Optional.empty();
    }
    final Instant now = Instant.now(clock);
    final List<PoolEntry> candidates = new ArrayList<>(entries.values());
    PoolEntry bestFirst = null;
    PoolEntry bestSecond = null;
    MatchScore bestScore = null;
    for (int i = 0; i < candidates.size(); i++) {
      for (int j = i + 1; j < candidates.size(); j++) {
        final MatchScore score = scorer.score(candidates.get(i), candidates.get(j), now);
        if (bestScore == null || score.total() > bestScore.total()) {
          bestFirst = candidates.get(i);
          bestSecond = candidates.get(j);
          bestScore = score;
        }
      }
    }
    entries.remove(bestFirst.connectionId());
    entries.remove(bestSecond.connectionId());
    final Room room = sessionRelay.createRoom(bestFirst.connection(), bestSecond.connection());
    metrics.recordMatch();
    metrics.recordTimeToMatch(Duration.between(bestFirst.enqueuedAt(), now));
    metrics.recordTimeToMatch(Duration.between(bestSecond.enqueuedAt(), now));
    logger.info(
        "matched roomId={} base={} waitBonus={} remaining={}",
        room.roomId(),
        bestScore.base(),
        bestScore.waitBonus(),
        entries.size());
    return Optional.of(new MatchPair(room.roomId(), bestFirst, bestSecond, bestScore, now));
  }

  @VisibleForTesting
  int purgeClosedEntries() {
    int purged = 0;
    final Iterator<PoolEntry> iterator = entries.values().iterator();
    while (iterator.hasNext()) {
      final PoolEntry entry = iterator.next();
      if (!entry.connection().isOpen()) {
        iterator.remove();
        entry.connection().resetToIdle();
        purged++;
      }
    }
    if (purged > 0) {
      logger.debug("purged closed pool entries count={}", purged);
    }
    return purged;
  }
}
