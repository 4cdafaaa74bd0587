package com.gentoro.codenexus.exception;

/** Invalid argument or configuration (blank paths, blank descriptions, bad settings). */
public class ConfigException extends CodeNexusException {
  public ConfigException(String message) {
    super(CodeNexusErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(CodeNexusErrorCode.CONFIG_ERROR, message, cause);
  }
}
