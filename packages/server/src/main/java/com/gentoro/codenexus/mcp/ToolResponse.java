package com.gentoro.codenexus.mcp;

/** Text content of a tool result and whether it reports an error. */
public record ToolResponse(String content, boolean error) {}
