package com.gentoro.codenexus.query;

import java.util.Map;
import java.util.Set;

/**
 * Read-only view of a tag index as seen by the query evaluator.
 *
 * @param tagToFiles full tag string to the files carrying it
 * @param universe every file with at least one tag; the domain of {@code NOT}
 */
public record TagIndexView(Map<String, ? extends Set<String>> tagToFiles, Set<String> universe) {

  public Set<String> filesWithTag(String tag) {
    Set<String> files = tagToFiles.get(tag);
    return files == null ? Set.of() : files;
  }
}
