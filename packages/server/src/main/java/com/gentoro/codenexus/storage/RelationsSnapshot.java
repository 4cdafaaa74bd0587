package com.gentoro.codenexus.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.codenexus.model.Relation;
import java.util.List;
import java.util.Map;

/** Serialized form of the relation graph: source path to its outgoing relations. */
public record RelationsSnapshot(
    @JsonProperty("file_relations") Map<String, List<Relation>> fileRelations) {
  public RelationsSnapshot {
    fileRelations = fileRelations == null ? Map.of() : fileRelations;
  }

  public static RelationsSnapshot empty() {
    return new RelationsSnapshot(Map.of());
  }
}
