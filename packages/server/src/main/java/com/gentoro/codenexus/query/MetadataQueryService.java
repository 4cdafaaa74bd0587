package com.gentoro.codenexus.query;

import com.gentoro.codenexus.comments.CommentStore;
import com.gentoro.codenexus.exception.CodeNexusException;
import com.gentoro.codenexus.model.FileInfo;
import com.gentoro.codenexus.model.QueryResult;
import com.gentoro.codenexus.model.Relation;
import com.gentoro.codenexus.model.RelationMatch;
import com.gentoro.codenexus.model.SystemStatus;
import com.gentoro.codenexus.model.TagStats;
import com.gentoro.codenexus.relations.RelationGraph;
import com.gentoro.codenexus.tags.TagIndex;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-side facade over the tag index, the relation graph and the comment store of one project.
 *
 * <p>Each manager is locked on its own while it is read, so a composite answer may mix states
 * observed at slightly different moments.
 */
public class MetadataQueryService {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(MetadataQueryService.class);

  private final TagIndex tags;
  private final RelationGraph relations;
  private final CommentStore comments;
  private final int suggestionsLimit;

  public MetadataQueryService(
      TagIndex tags, RelationGraph relations, CommentStore comments, int suggestionsLimit) {
    this.tags = Objects.requireNonNull(tags, "tags must not be null");
    this.relations = Objects.requireNonNull(relations, "relations must not be null");
    this.comments = Objects.requireNonNull(comments, "comments must not be null");
    this.suggestionsLimit = suggestionsLimit;
  }

  /**
   * Validate and evaluate a tag query.
   *
   * @throws com.gentoro.codenexus.exception.ValidationException if the query fails the syntax
   *     check
   */
  public QueryResult executeTagQuery(String query) {
    if (query == null || query.isBlank()) {
      return QueryResult.of(List.of());
    }
    QueryEngine.validateQuerySyntax(query);
    return QueryResult.of(tags.queryFilesByTags(query));
  }

  public FileInfo getFileInfo(String file) {
    return new FileInfo(
        file,
        tags.getFileTags(file),
        comments.getComment(file).orElse(null),
        relations.getOutgoing(file),
        relations.getIncoming(file));
  }

  /**
   * Combine a tag query with a relation description search. Files matching both are returned;
   * when the tag query is absent or matches nothing, the sources of matching relations are used
   * on their own.
   */
  public QueryResult executeComplexQuery(String tagQuery, String relationKeyword) {
    List<String> result = new ArrayList<>();
    if (tagQuery != null) {
      result.addAll(tags.queryFilesByTags(tagQuery));
    }
    if (relationKeyword != null) {
      Set<String> sources = new TreeSet<>();
      for (RelationMatch match : relations.queryByDescription(relationKeyword)) {
        sources.add(match.source());
      }
      if (result.isEmpty()) {
        result.addAll(sources);
      } else {
        result.retainAll(sources);
      }
    }
    return QueryResult.of(List.copyOf(new TreeSet<>(result)));
  }

  public SystemStatus getSystemStatus() {
    TagIndex.Stats tagStats = tags.getStats();
    CommentStore.Stats commentStats = comments.getStats();
    RelationGraph.Stats relationStats = relations.getStats();
    Map<String, List<String>> allTags = tags.getAllTags();

    int totalFiles =
        Math.max(
            tagStats.taggedFiles(),
            Math.max(commentStats.comments(), relationStats.filesWithRelations()));
    return new SystemStatus(
        totalFiles,
        tagStats.taggedFiles(),
        commentStats.comments(),
        relationStats.totalRelations(),
        new TagStats(allTags, tagStats.taggedFiles(), tagStats.distinctTags()));
  }

  /** Files whose comment or outgoing relation descriptions contain {@code keyword}. */
  public List<FileInfo> searchFiles(String keyword) {
    Set<String> files = new TreeSet<>(comments.searchComments(keyword).keySet());
    for (RelationMatch match : relations.queryByDescription(keyword)) {
      files.add(match.source());
    }
    List<FileInfo> result = new ArrayList<>(files.size());
    for (String file : files) {
      result.add(getFileInfo(file));
    }
    return result;
  }

  /**
   * Files sharing at least one tag with {@code file}, or linked to it in either direction.
   *
   * @return at most {@code maxResults} paths, ascending, never including {@code file} itself
   */
  public List<String> getRelatedFiles(String file, int maxResults) {
    Set<String> related = new TreeSet<>();
    for (String tag : tags.getFileTags(file)) {
      related.addAll(tags.getFilesWithTag(tag));
    }
    for (Relation relation : relations.getOutgoing(file)) {
      related.add(relation.target());
    }
    for (Relation relation : relations.getIncoming(file)) {
      related.add(relation.target());
    }
    related.remove(file);
    return related.stream().limit(Math.max(0, maxResults)).toList();
  }

  /** File information for each path; a path that cannot be read is logged and skipped. */
  public List<FileInfo> getBatchFileInfo(Collection<String> files) {
    List<FileInfo> result = new ArrayList<>();
    for (String file : files) {
      try {
        result.add(getFileInfo(file));
      } catch (CodeNexusException e) {
        log.debug("Skipping file info for {}: {}", file, e.getMessage());
      }
    }
    return result;
  }

  /**
   * Completions for a partially typed tag. A tag is suggested when its type starts with {@code
   * partial} or the full {@code type:value} text contains it.
   */
  public List<String> getQuerySuggestions(String partial) {
    if (partial == null || partial.isEmpty()) {
      return List.of();
    }
    Set<String> suggestions = new TreeSet<>();
    tags.getAllTags()
        .forEach(
            (type, values) -> {
              boolean typeMatches = type.startsWith(partial);
              for (String value : values) {
                String tag = type + ":" + value;
                if (typeMatches || tag.contains(partial)) {
                  suggestions.add(tag);
                }
              }
            });
    return suggestions.stream().limit(suggestionsLimit).toList();
  }
}
