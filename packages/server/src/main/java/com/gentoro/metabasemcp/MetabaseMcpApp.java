package com.gentoro.metabasemcp;

public class MetabaseMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(MetabaseMcpApp.class);

  public static void main(String[] args) {
    try {
      MetabaseMcp app = new MetabaseMcp(args);
      app.initialize();
      app.run();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
