package com.nepsegateway.marketgateway.snapshot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic snapshot rebuild. Only active with gateway.snapshot.update.enabled=true. */
@Component
@Slf4j
@ConditionalOnProperty(name = "gateway.snapshot.update.enabled", havingValue = "true")
public class SnapshotUpdateScheduler {

  private final SnapshotUpdater updater;

  public SnapshotUpdateScheduler(SnapshotUpdater updater) {
    this.updater = updater;
  }

  @Scheduled(cron = "${gateway.snapshot.update.cron:0 0 6 * * *}")
  public void run() {
    boolean success = updater.update();
    if (!success) {
      log.warn("Scheduled snapshot update did not complete; keeping the previous file");
    }
  }
}
