package com.nepsegateway.marketgateway.internal;

import com.nepsegateway.marketgateway.snapshot.SnapshotUpdater;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints, guarded by {@link InternalApiAuthFilter}. */
@RestController
@RequestMapping("/internal")
@Slf4j
public class InternalController {

  private final SnapshotUpdater snapshotUpdater;
  private final ProcessRestarter restarter;

  public InternalController(SnapshotUpdater snapshotUpdater, ProcessRestarter restarter) {
    this.snapshotUpdater = snapshotUpdater;
    this.restarter = restarter;
  }

  @PostMapping("/snapshot/update")
  public ResponseEntity<Map<String, Object>> updateSnapshot() {
    boolean success = snapshotUpdater.update();
    HttpStatus status = success ? HttpStatus.OK : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status).body(Map.of("success", success));
  }

  @PostMapping("/restart")
  public ResponseEntity<Map<String, Object>> restart() {
    log.warn("Restart requested through the internal API");
    restarter.requestRestart();
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(Map.of("status", "restarting", "exitCode", ProcessRestarter.RESTART_EXIT_CODE));
  }
}
