package com.gentoro.codenexus.project;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Process-wide map from canonical project root to its {@link ProjectContext}.
 *
 * <p>Lookup and first-time construction happen under one hold of the registry lock, so concurrent
 * first access to the same root builds exactly one context.
 */
public class ProjectRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(ProjectRegistry.class);

  private final Object lock = new Object();
  private final Map<Path, ProjectContext> contexts = new HashMap<>();
  private final Configuration config;

  public ProjectRegistry(Configuration config) {
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  /**
   * Return the context of {@code projectPath}, creating and loading it on first use.
   *
   * @throws com.gentoro.codenexus.exception.CodeNexusException if the path is not a usable project
   *     directory or its data cannot be loaded
   */
  public ProjectContext getOrCreate(String projectPath) {
    Path root = ProjectPaths.validateProjectPath(projectPath);
    synchronized (lock) {
      ProjectContext existing = contexts.get(root);
      if (existing != null) {
        return existing;
      }
      ProjectContext context = new ProjectContext(root, config);
      context.initialize();
      contexts.put(root, context);
      log.info("Registered project {}", root);
      return context;
    }
  }

  public List<Path> projects() {
    synchronized (lock) {
      return contexts.keySet().stream().sorted().toList();
    }
  }
}
