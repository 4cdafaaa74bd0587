package com.gentoro.codenexus;

import com.gentoro.codenexus.exception.ExceptionUtil;
import com.gentoro.codenexus.exception.StateException;
import com.gentoro.codenexus.mcp.CodeNexusTools;
import com.gentoro.codenexus.mcp.McpServer;
import com.gentoro.codenexus.project.ProjectRegistry;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application context: configuration, the project registry, the tool surface and the server. */
public class CodeNexus {

  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(CodeNexus.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ProjectRegistry projectRegistry;
  private CodeNexusTools tools;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public CodeNexus(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public boolean isHelpRequested() {
    return "help".equalsIgnoreCase(startupParameters.mode());
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.codenexus.logging.LoggingService.applyConfiguration(configuration());

    this.projectRegistry = new ProjectRegistry(configuration());
    this.tools = new CodeNexusTools(projectRegistry);
    this.mcpServer = new McpServer(this);

    try {
      mcpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw ExceptionUtil.rethrowIfUnchecked(
          e, t -> new StateException("Could not start MCP server", t));
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "codenexus-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (mcpServer != null) {
          mcpServer.close();
        }
      } catch (RuntimeException e) {
        log.warn("Error while stopping MCP server", e);
      } finally {
        log.info("CodeNexus stopped");
        shutdownLatch.countDown();
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("CodeNexus not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ProjectRegistry projectRegistry() {
    return projectRegistry;
  }

  public CodeNexusTools tools() {
    return tools;
  }
}
