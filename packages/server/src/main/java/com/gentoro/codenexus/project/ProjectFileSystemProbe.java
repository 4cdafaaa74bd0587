package com.gentoro.codenexus.project;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/** {@link FileSystemProbe} resolving relative paths against a project root on the local disk. */
public class ProjectFileSystemProbe implements FileSystemProbe {
  private final Path root;

  public ProjectFileSystemProbe(Path root) {
    this.root = Objects.requireNonNull(root, "root must not be null");
  }

  @Override
  public boolean exists(String relativePath) {
    if (relativePath == null || relativePath.isBlank()) return false;
    try {
      return Files.exists(root.resolve(relativePath));
    } catch (InvalidPathException e) {
      return false;
    }
  }

  public Path root() {
    return root;
  }
}
