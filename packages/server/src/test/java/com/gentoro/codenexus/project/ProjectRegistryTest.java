package com.gentoro.codenexus.project;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectRegistryTest {

  @TempDir Path project;

  @Test
  @DisplayName("concurrent first access builds a single context")
  void concurrentGetOrCreate() throws Exception {
    ProjectRegistry registry = new ProjectRegistry(new BaseConfiguration());
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<ProjectContext>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<ProjectContext> task =
            () -> {
              start.await();
              return registry.getOrCreate(project.toString());
            };
        futures.add(pool.submit(task));
      }
      start.countDown();

      ProjectContext first = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<ProjectContext> future : futures) {
        assertSame(first, future.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(List.of(project.toRealPath()), registry.projects());
  }

  @Test
  @DisplayName("equivalent spellings of a root share one context")
  void canonicalKey() throws Exception {
    Files.createDirectories(project.resolve("sub"));
    ProjectRegistry registry = new ProjectRegistry(new BaseConfiguration());

    ProjectContext direct = registry.getOrCreate(project.toString());
    ProjectContext indirect = registry.getOrCreate(project.resolve("sub/..").toString());
    assertSame(direct, indirect);
  }

  @Test
  @DisplayName("the data directory follows storage.dir-name")
  void dataDirectory() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("storage.dir-name", ".meta");
    ProjectContext context = new ProjectRegistry(config).getOrCreate(project.toString());

    assertTrue(Files.isDirectory(context.root().resolve(".meta")));
    assertTrue(Files.isRegularFile(context.root().resolve(".meta/tags.json")));
  }

  @Test
  @DisplayName("graph depth falls back to the default and is clamped to the maximum")
  void graphDepth() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("relations.graph.max-depth", 4);
    ProjectContext context = new ProjectRegistry(config).getOrCreate(project.toString());

    assertEquals(ProjectContext.DEFAULT_GRAPH_DEPTH, context.graphDepth(null));
    assertEquals(4, context.graphDepth(50));
    assertEquals(1, context.graphDepth(-2));
  }
}
