package com.gentoro.metabasemcp;

import com.gentoro.metabasemcp.dashboard.DashboardComposer;
import com.gentoro.metabasemcp.exception.ConfigException;
import com.gentoro.metabasemcp.exception.NetworkException;
import com.gentoro.metabasemcp.exception.StateException;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.gateway.MetabaseGateway;
import com.gentoro.metabasemcp.http.EmbeddedJettyServer;
import com.gentoro.metabasemcp.mcp.McpServer;
import com.gentoro.metabasemcp.mcp.McpServlet;
import com.gentoro.metabasemcp.mcp.StdioTransport;
import com.gentoro.metabasemcp.mcp.ToolRegistry;
import com.gentoro.metabasemcp.metric.MetricDiscovery;
import com.gentoro.metabasemcp.metric.MetricService;
import com.gentoro.metabasemcp.tools.CardTools;
import com.gentoro.metabasemcp.tools.CollectionTools;
import com.gentoro.metabasemcp.tools.DashboardTools;
import com.gentoro.metabasemcp.tools.DatabaseTools;
import com.gentoro.metabasemcp.tools.MetricTools;
import com.gentoro.metabasemcp.tools.QueryTools;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

public class MetabaseMcp {

  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(MetabaseMcp.class);

  static final String VERSION = "0.1.0";
  static final String TRANSPORT_STDIO = "stdio";
  static final String TRANSPORT_HTTP = "http";

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private MetabaseGateway gateway;
  private ToolRegistry toolRegistry;
  private McpServer mcpServer;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public MetabaseMcp(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.metabasemcp.logging.LoggingService.applyConfiguration(configuration());

    MetabaseSettings settings = MetabaseSettings.from(configuration());
    log.info("Connecting to Metabase with {}", settings);
    this.gateway = new MetabaseGateway(settings);
    this.toolRegistry = createToolRegistry(gateway);
    this.mcpServer = new McpServer(toolRegistry, VERSION);
    log.info("Registered {} tools", toolRegistry.list().size());
  }

  /** Every tool the server offers, bound to {@code gateway}. */
  public static ToolRegistry createToolRegistry(Gateway gateway) {
    ToolRegistry registry = new ToolRegistry();
    registry.registerAll(
        new DatabaseTools(gateway),
        new QueryTools(gateway),
        new CardTools(gateway),
        new CollectionTools(gateway),
        new MetricTools(new MetricDiscovery(gateway), new MetricService(gateway)),
        new DashboardTools(gateway, new DashboardComposer(gateway)));
    return registry;
  }

  /** Serve on the selected transport until stdin closes or a shutdown signal arrives. */
  public void run() {
    String transport = transport();
    log.info("Starting Metabase MCP server with {} transport", transport);
    registerShutdownHook();
    switch (transport) {
      case TRANSPORT_STDIO -> runStdio();
      case TRANSPORT_HTTP -> runHttp();
      default -> {
        shutdown();
        throw new ConfigException("Invalid transport: " + transport);
      }
    }
  }

  String transport() {
    String transport = startupParameters.transport();
    if (transport == null) {
      transport = configuration().getString("mcp.transport", TRANSPORT_STDIO);
    }
    transport = transport.trim().toLowerCase(Locale.ROOT);
    return "sse".equals(transport) ? TRANSPORT_HTTP : transport;
  }

  private void runStdio() {
    try {
      new StdioTransport(mcpServer, System.in, System.out).run();
    } catch (IOException e) {
      throw new NetworkException("stdio transport failed", e);
    } finally {
      shutdown();
    }
  }

  private void runHttp() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    String contextPath = configuration().getString("http.mcp.context-path", "/mcp");
    httpServer
        .getContextHandler()
        .addServlet(new ServletHolder(new McpServlet(mcpServer)), contextPath);
    try {
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
    log.info(
        "MCP endpoint available at http://{}:{}{}",
        configuration().getString("http.hostname", "0.0.0.0"),
        httpServer.getPort(),
        contextPath);
    waitShutdownSignal();
  }

  private void registerShutdownHook() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "metabase-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
  }

  /** Block the current thread until {@link #shutdown()} runs. */
  public void waitShutdownSignal() {
    registerShutdownHook();
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down");
      try {
        closeQuietly(httpServer);
        closeQuietly(gateway);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}: {}", closeable.getClass().getSimpleName(), e.getMessage());
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("MetabaseMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ToolRegistry toolRegistry() {
    return toolRegistry;
  }

  public McpServer mcpServer() {
    return mcpServer;
  }
}
