package com.gentoro.codenexus.mcp;

/**
 * Serves one tool call. The returned value is serialized to JSON as the tool's text content;
 * thrown {@link com.gentoro.codenexus.exception.CodeNexusException}s become error responses.
 */
@FunctionalInterface
public interface ToolHandler {
  Object handle(ToolArguments arguments);
}
