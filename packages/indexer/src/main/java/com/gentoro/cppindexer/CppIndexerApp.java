package com.gentoro.cppindexer;

import com.gentoro.cppindexer.exception.ExceptionUtil;

public class CppIndexerApp {

  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(CppIndexerApp.class);

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    CppIndexer app;
    try {
      app = new CppIndexer(args);
    } catch (Exception e) {
      log.error("Invalid command line: {}", e.getMessage());
      System.err.println(StartupParameters.usage());
      return 1;
    }
    if (app.startupParameters().isHelpRequested()) {
      System.out.println(StartupParameters.usage());
      return 0;
    }
    try {
      app.initialize();
      return app.run() ? 0 : 1;
    } catch (Exception e) {
      log.error("Indexing failed: {}", ExceptionUtil.toErrorDetails(e));
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e, 0));
      return 1;
    } finally {
      app.shutdown();
    }
  }
}
