package com.example.pairing.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class PairingMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer timeToMatchTimer;
  private final Counter matchCounter;
  private final AtomicLong connections = new AtomicLong();
  private final AtomicLong poolSize = new AtomicLong();
  private final AtomicLong activeRooms = new AtomicLong();
  private final ConcurrentMap<String, Counter> relayCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> discardedCounters = new ConcurrentHashMap<>();

  public PairingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.timeToMatchTimer =
        Timer.builder("pairing.time_to_match")
            .description("Time from entering the pool to being matched")
            .register(meterRegistry);
    this.matchCounter = Counter.builder("pairing.match.total").register(meterRegistry);
    Gauge.builder("pairing.connections.active", connections, AtomicLong::get)
        .register(meterRegistry);
    Gauge.builder("pairing.pool.size", poolSize, AtomicLong::get).register(meterRegistry);
    Gauge.builder("pairing.rooms.active", activeRooms, AtomicLong::get).register(meterRegistry);
  }

  public void updateOccupancy(long connectionCount, long poolCount, long roomCount) {
    connections.set(Math.max(0, connectionCount));
    poolSize.set(Math.max(0, poolCount));
    activeRooms.set(Math.max(0, roomCount));
  }

  public void recordMatch() {
    matchCounter.increment();
  }

  public void recordTimeToMatch(Duration waited) {
    if (waited == null || waited.isNegative()) {
      return;
    }
    timeToMatchTimer.record(waited);
  }

  public void recordRelay(String result) {
    relayCounters.computeIfAbsent(result, this::registerRelayCounter).increment();
  }

  public void recordDiscarded(String reason) {
    discardedCounters.computeIfAbsent(reason, this::registerDiscardedCounter).increment();
  }

  private Counter registerRelayCounter(String result) {
    return Counter.builder("pairing.relay.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerDiscardedCounter(String reason) {
    return Counter.builder("pairing.inbound.discarded")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }
}
