package com.gentoro.codenexus.project;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codenexus.exception.CodeNexusErrorCode;
import com.gentoro.codenexus.exception.ConfigException;
import com.gentoro.codenexus.exception.NotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectPathsTest {

  @TempDir Path tmp;
  private Path project;

  @BeforeEach
  void setUp() throws Exception {
    project = Files.createDirectories(tmp.resolve("project"));
    Files.createDirectories(project.resolve("src/api"));
    Files.writeString(project.resolve("src/api/handler.go"), "package api");
    Files.writeString(tmp.resolve("outside.txt"), "secret");
  }

  @Test
  @DisplayName("validateProjectPath returns the canonical directory")
  void validProject() throws Exception {
    Path root = ProjectPaths.validateProjectPath(project.toString());
    assertEquals(project.toRealPath(), root);
  }

  @Test
  @DisplayName("validateProjectPath rejects blank, missing and non-directory paths")
  void invalidProject() {
    assertThrows(ConfigException.class, () -> ProjectPaths.validateProjectPath(" "));
    NotFoundException missing =
        assertThrows(
            NotFoundException.class,
            () -> ProjectPaths.validateProjectPath(tmp.resolve("nope").toString()));
    assertEquals(CodeNexusErrorCode.FILE_NOT_FOUND, missing.getCode());
    assertThrows(
        ConfigException.class,
        () -> ProjectPaths.validateProjectPath(tmp.resolve("outside.txt").toString()));
  }

  @Test
  @DisplayName("file paths are normalized relative to the root with forward slashes")
  void normalizeFile() {
    Path root = ProjectPaths.validateProjectPath(project.toString());
    assertEquals("src/api/handler.go", ProjectPaths.resolveRelative(root, "src/api/handler.go"));
    assertEquals(
        "src/api/handler.go", ProjectPaths.resolveRelative(root, "./src/api/../api/handler.go"));
  }

  @Test
  @DisplayName("paths escaping the project root are rejected")
  void escapeRejected() {
    Path root = ProjectPaths.validateProjectPath(project.toString());
    ConfigException ex =
        assertThrows(
            ConfigException.class, () -> ProjectPaths.validateFilePath(root, "../outside.txt"));
    assertEquals(CodeNexusErrorCode.CONFIG_ERROR, ex.getCode());
  }

  @Test
  @DisplayName("missing files, directories and blank paths fail validation")
  void invalidFiles() {
    Path root = ProjectPaths.validateProjectPath(project.toString());
    assertThrows(NotFoundException.class, () -> ProjectPaths.validateFilePath(root, "src/none.go"));
    assertThrows(ConfigException.class, () -> ProjectPaths.validateFilePath(root, "src/api"));
    assertThrows(ConfigException.class, () -> ProjectPaths.validateFilePath(root, ""));
  }

  @Test
  @DisplayName("file existence checks resolve against the project root")
  void fileExistenceAgainstRoot() {
    ProjectFileSystemProbe probe = new ProjectFileSystemProbe(project);
    assertTrue(probe.exists("src/api/handler.go"));
    assertFalse(probe.exists("src/api/missing.go"));
    assertFalse(probe.exists(""));
  }
}
