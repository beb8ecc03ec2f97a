package com.nepsegateway.marketgateway.internal;

/** Ends the current process so the external supervisor starts a fresh one. */
public interface ProcessRestarter {

  /** Exit code the supervisor treats as "restart requested". */
  int RESTART_EXIT_CODE = 3;

  void requestRestart();
}
