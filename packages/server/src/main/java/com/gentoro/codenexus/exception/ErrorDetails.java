package com.gentoro.codenexus.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO to expose structured error information to logs or MCP responses. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final CodeNexusErrorCode code;
  public final String suggestion;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      String type,
      String message,
      CodeNexusErrorCode code,
      String suggestion,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.suggestion = suggestion;
    this.context = context;
    this.timestamp = timestamp;
  }
}
