package com.gentoro.codenexus.exception;

/**
 * Canonical error codes for CodeNexus. Codes are stable and safe to expose to MCP clients; each one
 * carries a short recovery hint returned alongside the error message.
 */
public enum CodeNexusErrorCode {
  FILE_NOT_FOUND("Check that the file path is correct and relative to the project root"),
  INVALID_TAG_FORMAT("Use the type:value format, e.g. category:api"),
  INVALID_QUERY_SYNTAX("Check the query syntax; AND, OR, NOT, parentheses and * are supported"),
  RELATION_ALREADY_EXISTS("The relation already exists; remove it before adding it again"),
  RELATION_NOT_FOUND("Add the relation first"),
  TAG_NOT_FOUND("Add the tag to the file first"),

  // I/O and configuration
  STORAGE_ERROR("Check file permissions and available disk space"),
  SERIALIZATION_ERROR("The data file is malformed; inspect or restore it from the .bak copy"),
  FILESYSTEM_ERROR("Check file system permissions"),
  CONFIG_ERROR("Check the supplied arguments and configuration"),
  INTERNAL_ERROR("Retry the operation or report the problem");

  private final String suggestion;

  CodeNexusErrorCode(String suggestion) {
    this.suggestion = suggestion;
  }

  public String suggestion() {
    return suggestion;
  }
}
