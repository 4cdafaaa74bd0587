package com.gentoro.codenexus.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record TagStats(
    @JsonProperty("tag_types") Map<String, List<String>> tagTypes,
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("total_tags") int totalTags) {}
