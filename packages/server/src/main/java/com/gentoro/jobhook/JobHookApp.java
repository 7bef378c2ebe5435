package com.gentoro.jobhook;

public class JobHookApp {

  private static final org.slf4j.Logger log =
      com.gentoro.jobhook.logging.LoggingService.getLogger(JobHookApp.class);

  public static void main(String[] args) {
    try {
      JobHook app = new JobHook(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
