package com.gentoro.codenexus.exception;

import java.util.Map;

/** Reading or writing a snapshot file failed. */
public class IoException extends CodeNexusException {
  public IoException(String message, Throwable cause) {
    super(CodeNexusErrorCode.STORAGE_ERROR, message, cause);
  }

  public IoException(String message, Map<String, ?> context, Throwable cause) {
    super(CodeNexusErrorCode.STORAGE_ERROR, message, context, cause);
  }
}
