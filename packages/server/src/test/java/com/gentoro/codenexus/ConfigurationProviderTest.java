package com.gentoro.codenexus;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codenexus.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path dir;

  @Test
  @DisplayName("bundled application.yaml provides the documented defaults")
  void classpathDefaults() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();
    assertEquals(".codenexus", cfg.getString("storage.dir-name"));
    assertTrue(cfg.getBoolean("storage.backup.enabled"));
    assertEquals(3, cfg.getInt("relations.graph.default-depth"));
    assertEquals(10, cfg.getInt("query.suggestions.limit"));
    assertEquals("codenexus", cfg.getString("mcp.server.name"));
  }

  @Test
  @DisplayName("a YAML file on disk can override settings")
  void fileLocation() throws Exception {
    Path file = dir.resolve("custom.yaml");
    Files.writeString(file, "storage:\n  dir-name: .meta\nquery:\n  suggestions:\n    limit: 5\n");

    Configuration cfg = new ConfigurationProvider(file.toString()).config();
    assertEquals(".meta", cfg.getString("storage.dir-name"));
    assertEquals(5, cfg.getInt("query.suggestions.limit"));

    Configuration viaUri = new ConfigurationProvider(file.toUri().toString()).config();
    assertEquals(".meta", viaUri.getString("storage.dir-name"));
  }

  @Test
  @DisplayName("a missing file is a configuration error")
  void missingFile() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  @DisplayName("startup parameters default to server mode and validate the mode")
  void startupParameters() {
    StartupParameters defaults = new StartupParameters(new String[0]);
    assertEquals("server", defaults.mode());
    assertEquals("classpath:application.yaml", defaults.configFile());

    StartupParameters custom =
        new StartupParameters(new String[] {"--config-file", "/etc/cn.yaml", "--mode", "help"});
    assertEquals("/etc/cn.yaml", custom.configFile());
    assertEquals("help", custom.mode());

    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "interactive"}));
  }
}
