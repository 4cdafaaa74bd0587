package com.gentoro.codenexus.exception;

import java.util.Map;

/** Relation between the same ordered pair of files already exists. */
public class AlreadyExistsException extends CodeNexusException {
  public AlreadyExistsException(String source, String target) {
    super(
        CodeNexusErrorCode.RELATION_ALREADY_EXISTS,
        "Relation already exists: " + source + " -> " + target,
        Map.of("source", source, "target", target));
  }
}
