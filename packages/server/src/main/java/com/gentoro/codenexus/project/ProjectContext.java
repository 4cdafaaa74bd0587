package com.gentoro.codenexus.project;

import com.gentoro.codenexus.comments.CommentStore;
import com.gentoro.codenexus.query.MetadataQueryService;
import com.gentoro.codenexus.relations.RelationGraph;
import com.gentoro.codenexus.storage.ProjectStorage;
import com.gentoro.codenexus.tags.TagIndex;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Everything CodeNexus keeps for one project root: the storage gateway, the three managers and
 * the facade composing them. Built once per canonical root by {@link ProjectRegistry}.
 */
public class ProjectContext {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(ProjectContext.class);

  public static final String DEFAULT_DATA_DIR = ".codenexus";
  public static final int DEFAULT_GRAPH_DEPTH = 3;
  public static final int DEFAULT_MAX_GRAPH_DEPTH = 10;
  public static final int DEFAULT_SUGGESTIONS_LIMIT = 10;

  private final Path root;
  private final ProjectStorage storage;
  private final TagIndex tagIndex;
  private final RelationGraph relationGraph;
  private final CommentStore commentStore;
  private final MetadataQueryService queryService;
  private final int defaultGraphDepth;
  private final int maxGraphDepth;

  /**
   * @param root canonical project root, as returned by {@link ProjectPaths#validateProjectPath}
   */
  public ProjectContext(Path root, Configuration config) {
    this.root = Objects.requireNonNull(root, "root must not be null");
    Objects.requireNonNull(config, "config must not be null");

    String dirName = config.getString("storage.dir-name", DEFAULT_DATA_DIR);
    boolean backup = config.getBoolean("storage.backup.enabled", true);
    this.defaultGraphDepth = config.getInt("relations.graph.default-depth", DEFAULT_GRAPH_DEPTH);
    this.maxGraphDepth = config.getInt("relations.graph.max-depth", DEFAULT_MAX_GRAPH_DEPTH);

    FileSystemProbe probe = new ProjectFileSystemProbe(root);
    this.storage = new ProjectStorage(root.resolve(dirName), backup);
    this.tagIndex = new TagIndex(storage.tags(), probe);
    this.relationGraph = new RelationGraph(storage.relations(), probe);
    this.commentStore = new CommentStore(storage.comments(), probe);
    this.queryService =
        new MetadataQueryService(
            tagIndex,
            relationGraph,
            commentStore,
            config.getInt("query.suggestions.limit", DEFAULT_SUGGESTIONS_LIMIT));
  }

  /** Create the data directory if needed and load all three datasets. */
  public void initialize() {
    storage.initialize();
    tagIndex.initialize();
    relationGraph.initialize();
    commentStore.initialize();
    log.info("Project context ready: {}", root);
  }

  /**
   * Validate a file path given by a caller and return the project-relative form the indices use.
   */
  public String relativePath(String filePath) {
    return ProjectPaths.resolveRelative(root, filePath);
  }

  /** Clamp a requested traversal depth to {@code [1, max-depth]}; null means the default. */
  public int graphDepth(Integer requested) {
    int depth = requested == null ? defaultGraphDepth : requested;
    return Math.max(1, Math.min(depth, maxGraphDepth));
  }

  public Path root() {
    return root;
  }

  public ProjectStorage storage() {
    return storage;
  }

  public TagIndex tags() {
    return tagIndex;
  }

  public RelationGraph relations() {
    return relationGraph;
  }

  public CommentStore comments() {
    return commentStore;
  }

  public MetadataQueryService queryService() {
    return queryService;
  }
}
