package com.gentoro.codenexus.exception;

/** Component used before initialization or otherwise in an illegal state. */
public class StateException extends CodeNexusException {
  public StateException(String message) {
    super(CodeNexusErrorCode.INTERNAL_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(CodeNexusErrorCode.INTERNAL_ERROR, message, cause);
  }
}
