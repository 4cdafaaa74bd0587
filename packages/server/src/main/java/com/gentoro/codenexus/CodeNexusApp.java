package com.gentoro.codenexus;

public class CodeNexusApp {

  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(CodeNexusApp.class);

  private static final String USAGE =
      """
      Usage: codenexus [--config-file <location>] [--mode server|help]

        --config-file  YAML configuration, a file path or classpath:<resource>
                       (default: classpath:application.yaml)
        --mode         server: serve MCP over stdio (default)
                       help:   print this message
      """;

  public static void main(String[] args) {
    try {
      CodeNexus app = new CodeNexus(args);
      if (app.isHelpRequested()) {
        System.err.print(USAGE);
        return;
      }
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
