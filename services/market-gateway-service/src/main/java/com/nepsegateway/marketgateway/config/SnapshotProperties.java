package com.nepsegateway.marketgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Location of the symbol snapshot file and the schedule of its rebuild job. */
@ConfigurationProperties(prefix = "gateway.snapshot")
public record SnapshotProperties(String path, Update update) {

  public SnapshotProperties {
    if (path == null || path.isBlank()) {
      path = "stockmap.json";
    }
    if (update == null) {
      update = new Update(false, null);
    }
  }

  public record Update(boolean enabled, String cron) {
    public Update {
      if (cron == null || cron.isBlank()) {
        cron = "0 0 6 * * *";
      }
    }
  }
}
