package com.nepsegateway.marketgateway.internal;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the Spring context and exits with {@link #RESTART_EXIT_CODE}. Runs on its own thread after
 * a short delay so the triggering request can still be answered.
 */
@Component
@Slf4j
public class ApplicationExitRestarter implements ProcessRestarter {

  private static final Duration GRACE = Duration.ofMillis(500);

  private final ApplicationContext context;

  public ApplicationExitRestarter(ApplicationContext context) {
    this.context = context;
  }

  @Override
  public void requestRestart() {
    Thread exit =
        new Thread(
            () -> {
              try {
                Thread.sleep(GRACE.toMillis());
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
              }
              log.info("Exiting with code {} for restart", RESTART_EXIT_CODE);
              System.exit(SpringApplication.exit(context, () -> RESTART_EXIT_CODE));
            },
            "restart-exit");
    exit.setDaemon(false);
    exit.start();
  }
}
