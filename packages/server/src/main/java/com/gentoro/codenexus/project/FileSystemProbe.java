package com.gentoro.codenexus.project;

/**
 * Existence check for project files. Used to gate mutations and to drive cleanup passes; the
 * indices never read file contents.
 */
@FunctionalInterface
public interface FileSystemProbe {

  /**
   * @param relativePath normalized, project-relative path with forward slashes
   * @return {@code true} if the file currently exists
   */
  boolean exists(String relativePath);
}
