package com.gentoro.codenexus.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.gentoro.codenexus.ConfigurationProvider;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private Level rootLevel;

  @BeforeEach
  void rememberRoot() {
    rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
  }

  @AfterEach
  void restoreLevels() {
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
    context.getLogger("com.gentoro.codenexus.tags").setLevel(null);
    context.getLogger("com.gentoro.codenexus").setLevel(null);
  }

  @Test
  @DisplayName("configured levels are applied to root and named loggers")
  void appliesLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level.root", "WARN");
    cfg.addProperty("logging.level.com.gentoro.codenexus.tags", "debug");

    Map<String, Level> applied = LoggingService.applyConfiguration(cfg);

    assertEquals(Level.WARN, applied.get(Logger.ROOT_LOGGER_NAME));
    assertEquals(Level.DEBUG, applied.get("com.gentoro.codenexus.tags"));
    assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    assertEquals(Level.DEBUG, context.getLogger("com.gentoro.codenexus.tags").getLevel());
  }

  @Test
  @DisplayName("unknown level names and unrelated keys are ignored")
  void ignoresUnknownLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level.com.gentoro.codenexus.tags", "LOUD");
    cfg.addProperty("storage.dir-name", ".codenexus");

    assertTrue(LoggingService.applyConfiguration(cfg).isEmpty());
    assertNull(context.getLogger("com.gentoro.codenexus.tags").getLevel());
    assertTrue(LoggingService.applyConfiguration(null).isEmpty());
  }

  @Test
  @DisplayName("dotted logger names from application.yaml resolve to the package logger")
  void yamlPackageKeys() {
    Map<String, Level> applied =
        LoggingService.applyConfiguration(
            new ConfigurationProvider("classpath:application.yaml").config());

    assertEquals(Level.INFO, applied.get("com.gentoro.codenexus"));
    assertEquals(Level.INFO, context.getLogger("com.gentoro.codenexus").getLevel());
  }
}
