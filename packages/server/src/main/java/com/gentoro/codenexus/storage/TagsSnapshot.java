package com.gentoro.codenexus.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/** Serialized form of the tag index: file path to its tags. Order inside a list is irrelevant. */
public record TagsSnapshot(@JsonProperty("file_tags") Map<String, List<String>> fileTags) {
  public TagsSnapshot {
    fileTags = fileTags == null ? Map.of() : fileTags;
  }

  public static TagsSnapshot empty() {
    return new TagsSnapshot(Map.of());
  }
}
