package com.gentoro.cppindexer.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.io.StringReader;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LoggingServiceTest {

  private static final String NAME = "com.gentoro.cppindexer.logging.sample";

  @AfterEach
  void reset() {
    Logger logger = (Logger) LoggingService.getLogger(LoggingServiceTest.class);
    logger.getLoggerContext().getLogger(NAME).setLevel(null);
  }

  @Test
  @DisplayName("logging.level entries are applied to Logback loggers")
  void appliesLevels() throws Exception {
    YAMLConfiguration config = new YAMLConfiguration();
    config.read(
        new StringReader(
            """
            logging:
              level:
                com.gentoro.cppindexer.logging.sample: DEBUG
                other: NOT_A_LEVEL
            """));

    LoggingService.applyConfiguration(config);

    Logger logger = (Logger) LoggingService.getLogger(LoggingServiceTest.class);
    assertEquals(Level.DEBUG, logger.getLoggerContext().getLogger(NAME).getLevel());
    assertNull(logger.getLoggerContext().getLogger("other").getLevel());
  }
}
