package com.gentoro.codenexus.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SystemStatus(
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("tagged_files") int taggedFiles,
    @JsonProperty("commented_files") int commentedFiles,
    @JsonProperty("total_relations") int totalRelations,
    @JsonProperty("tag_stats") TagStats tagStats) {}
