package com.gentoro.codenexus.model;

import java.util.List;

public record QueryResult(List<String> files, int total) {
  public static QueryResult of(List<String> files) {
    return new QueryResult(List.copyOf(files), files.size());
  }
}
