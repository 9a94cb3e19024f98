package com.example.pairing.worker;

import com.example.pairing.service.PairingCoordinator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic match attempt. Only submits a tick; the scan itself runs on the coordinator thread. */
@Component
@ConditionalOnProperty(
    name = "pairing.worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MatchmakerWorker {

  private final PairingCoordinator coordinator;

  public MatchmakerWorker(PairingCoordinator coordinator) {
    this.coordinator = coordinator;
  }

  @Scheduled(fixedDelayString = "${pairing.match-interval}")
  public void run() {
    coordinator.tick();
  }
}
