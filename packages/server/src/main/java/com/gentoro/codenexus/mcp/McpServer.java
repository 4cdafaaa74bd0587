package com.gentoro.codenexus.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.codenexus.CodeNexus;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MCP server exposing {@link CodeNexusTools} over stdio.
 *
 * <p>Stdout carries the protocol, so logging must stay on stderr (see {@code logback.xml}).
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>mcp.server.name</b> (string) – server name reported to clients; default: "codenexus"
 *   <li><b>mcp.server.version</b> (string) – server version reported to clients; default: "0.1.0"
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(McpServer.class);

  private static final String INSTRUCTIONS =
      "CodeNexus manages code files through tags, comments and file relations."
          + " Every tool takes the absolute project_path of the project root.";

  private final CodeNexus codeNexus;
  private McpSyncServer mcpServer;

  public McpServer(CodeNexus codeNexus) {
    this.codeNexus = codeNexus;
  }

  /** Build the MCP server and start serving on stdin/stdout. */
  public void start() {
    String serverName = codeNexus.configuration().getString("mcp.server.name", "codenexus");
    String serverVersion = codeNexus.configuration().getString("mcp.server.version", "0.1.0");

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    var transport = new StdioServerTransportProvider(json);

    List<McpServerFeatures.SyncToolSpecification> specifications = new ArrayList<>();
    for (ToolDefinition definition : codeNexus.tools().definitions()) {
      specifications.add(toSpecification(definition));
    }

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(transport)
            .serverInfo(serverName, serverVersion)
            .instructions(INSTRUCTIONS)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(specifications)
            .build();

    log.info(
        "MCP server {} {} listening on stdio with {} tools",
        serverName,
        serverVersion,
        specifications.size());
  }

  private McpServerFeatures.SyncToolSpecification toSpecification(ToolDefinition definition) {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(definition.name())
                .description(definition.description())
                .inputSchema(
                    new McpSchema.JsonSchema(
                        "object",
                        definition.schemaProperties(),
                        definition.requiredParameters(),
                        false,
                        Collections.emptyMap(),
                        Collections.emptyMap()))
                .build())
        .callHandler(
            (srv, request) -> {
              log.debug("Tool call {}", definition.name());
              ToolResponse response =
                  codeNexus.tools().call(definition.name(), request.arguments());
              return new McpSchema.CallToolResult(response.content(), response.error());
            })
        .build();
  }

  @Override
  public void close() {
    if (mcpServer != null) {
      try {
        mcpServer.closeGracefully();
      } finally {
        mcpServer = null;
      }
    }
  }
}
