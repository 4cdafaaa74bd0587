package com.gentoro.codenexus.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Everything known about a single file. {@code comment} is null when the file has none. */
public record FileInfo(
    String path,
    List<String> tags,
    String comment,
    List<Relation> relations,
    @JsonProperty("incoming_relations") List<Relation> incomingRelations) {}
