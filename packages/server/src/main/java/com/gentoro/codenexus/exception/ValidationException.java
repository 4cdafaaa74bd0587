package com.gentoro.codenexus.exception;

import java.util.Map;

/** Malformed tag or query supplied by the caller. */
public class ValidationException extends CodeNexusException {
  public ValidationException(CodeNexusErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }

  public static ValidationException tagFormat(String tag) {
    return new ValidationException(
        CodeNexusErrorCode.INVALID_TAG_FORMAT,
        "Invalid tag format: '" + tag + "', expected type:value",
        Map.of("tag", String.valueOf(tag)));
  }

  public static ValidationException querySyntax(String query, String reason) {
    return new ValidationException(
        CodeNexusErrorCode.INVALID_QUERY_SYNTAX,
        "Invalid query syntax: " + reason,
        Map.of("query", String.valueOf(query)));
  }
}
