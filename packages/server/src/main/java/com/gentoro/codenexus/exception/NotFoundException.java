package com.gentoro.codenexus.exception;

import java.util.Map;

/** A file, tag or relation the caller referred to does not exist. */
public class NotFoundException extends CodeNexusException {
  public NotFoundException(CodeNexusErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }

  public static NotFoundException file(String path) {
    return new NotFoundException(
        CodeNexusErrorCode.FILE_NOT_FOUND, "File not found: " + path, Map.of("file", path));
  }

  public static NotFoundException tag(String tag, String file) {
    return new NotFoundException(
        CodeNexusErrorCode.TAG_NOT_FOUND,
        "Tag not found: " + tag + " on file " + file,
        Map.of("tag", tag, "file", file));
  }

  public static NotFoundException relation(String source, String target) {
    return new NotFoundException(
        CodeNexusErrorCode.RELATION_NOT_FOUND,
        "Relation not found: " + source + " -> " + target,
        Map.of("source", source, "target", target));
  }
}
