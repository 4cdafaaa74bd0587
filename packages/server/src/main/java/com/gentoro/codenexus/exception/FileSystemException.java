package com.gentoro.codenexus.exception;

/** A path could not be resolved or inspected on the local file system. */
public class FileSystemException extends CodeNexusException {
  public FileSystemException(String message, Throwable cause) {
    super(CodeNexusErrorCode.FILESYSTEM_ERROR, message, cause);
  }
}
