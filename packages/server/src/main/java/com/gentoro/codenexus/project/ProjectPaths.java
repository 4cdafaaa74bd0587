package com.gentoro.codenexus.project;

import com.gentoro.codenexus.exception.ConfigException;
import com.gentoro.codenexus.exception.FileSystemException;
import com.gentoro.codenexus.exception.NotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Validation and normalization of project roots and project files.
 *
 * <p>Every path stored in the indices goes through {@link #normalize(Path, Path)}: relative to the
 * canonical project root, with forward slashes.
 */
public final class ProjectPaths {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(ProjectPaths.class);

  private ProjectPaths() {}

  /**
   * Validate a project root and return its canonical form.
   *
   * @throws ConfigException if the path is blank or not a directory
   * @throws NotFoundException if the path does not exist
   * @throws FileSystemException if the path cannot be resolved
   */
  public static Path validateProjectPath(String projectPath) {
    if (projectPath == null || projectPath.isBlank()) {
      throw new ConfigException("Project path must not be empty");
    }
    Path path = toPath(projectPath);
    if (!Files.exists(path)) {
      throw NotFoundException.file(projectPath);
    }
    if (!Files.isDirectory(path)) {
      throw new ConfigException("Project path must be a directory: " + projectPath);
    }
    try {
      Path canonical = path.toRealPath();
      log.debug("Validated project path: {}", canonical);
      return canonical;
    } catch (IOException e) {
      throw new FileSystemException("Cannot resolve project path: " + projectPath, e);
    }
  }

  /**
   * Validate a file path given relative to {@code projectRoot} and return its canonical form.
   *
   * @throws ConfigException if the path is blank, a directory, or outside the project
   * @throws NotFoundException if the file does not exist
   * @throws FileSystemException if the path cannot be resolved
   */
  public static Path validateFilePath(Path projectRoot, String filePath) {
    if (filePath == null || filePath.isBlank()) {
      throw new ConfigException("File path must not be empty");
    }
    Path full = projectRoot.resolve(toPath(filePath));
    if (!Files.exists(full)) {
      throw NotFoundException.file(filePath);
    }
    if (!Files.isRegularFile(full)) {
      throw new ConfigException("Path must point to a file, not a directory: " + filePath);
    }
    Path canonicalFile;
    Path canonicalRoot;
    try {
      canonicalFile = full.toRealPath();
      canonicalRoot = projectRoot.toRealPath();
    } catch (IOException e) {
      throw new FileSystemException("Cannot resolve file path: " + filePath, e);
    }
    if (!canonicalFile.startsWith(canonicalRoot)) {
      log.warn("Rejected file path outside of project root: {}", canonicalFile);
      throw new ConfigException("File path must be inside the project directory: " + filePath);
    }
    return canonicalFile;
  }

  /**
   * Project-relative form of {@code file}, using forward slashes on every platform.
   *
   * @throws ConfigException if the file is not inside the project
   */
  public static String normalize(Path projectRoot, Path file) {
    Path root;
    Path target;
    try {
      root = projectRoot.toRealPath();
      target = file.toRealPath();
    } catch (IOException e) {
      throw new FileSystemException("Cannot resolve path: " + file, e);
    }
    if (!target.startsWith(root)) {
      throw new ConfigException("File path is not inside the project directory: " + file);
    }
    return root.relativize(target).toString().replace('\\', '/');
  }

  /** Validates {@code filePath} and returns its normalized relative form in one step. */
  public static String resolveRelative(Path projectRoot, String filePath) {
    return normalize(projectRoot, validateFilePath(projectRoot, filePath));
  }

  private static Path toPath(String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException e) {
      throw new ConfigException("Invalid path: " + value, e);
    }
  }
}
