package com.gentoro.codenexus.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Serialized form of the comment store: file path to comment text. */
public record CommentsSnapshot(@JsonProperty("file_comments") Map<String, String> fileComments) {
  public CommentsSnapshot {
    fileComments = fileComments == null ? Map.of() : fileComments;
  }

  public static CommentsSnapshot empty() {
    return new CommentsSnapshot(Map.of());
  }
}
