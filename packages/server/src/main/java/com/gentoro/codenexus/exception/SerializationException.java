package com.gentoro.codenexus.exception;

import java.util.Map;

/** JSON/YAML serialization or deserialization failure. */
public class SerializationException extends CodeNexusException {
  public SerializationException(String message, Throwable cause) {
    super(CodeNexusErrorCode.SERIALIZATION_ERROR, message, cause);
  }

  public SerializationException(String message, Map<String, ?> context, Throwable cause) {
    super(CodeNexusErrorCode.SERIALIZATION_ERROR, message, context, cause);
  }
}
