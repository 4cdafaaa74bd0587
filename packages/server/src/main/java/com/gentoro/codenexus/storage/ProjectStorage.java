package com.gentoro.codenexus.storage;

import java.nio.file.Path;

/**
 * The three snapshot stores of one project, all living in the project's data directory
 * ({@code <project>/.codenexus} by default).
 */
public class ProjectStorage {
  public static final String TAGS_FILE = "tags.json";
  public static final String RELATIONS_FILE = "relations.json";
  public static final String COMMENTS_FILE = "comments.json";

  private final Path dataDir;
  private final JsonSnapshotStore<TagsSnapshot> tags;
  private final JsonSnapshotStore<RelationsSnapshot> relations;
  private final JsonSnapshotStore<CommentsSnapshot> comments;

  public ProjectStorage(Path dataDir, boolean backupEnabled) {
    this.dataDir = dataDir;
    this.tags =
        new JsonSnapshotStore<>(
            dataDir.resolve(TAGS_FILE), TagsSnapshot.class, TagsSnapshot::empty, backupEnabled);
    this.relations =
        new JsonSnapshotStore<>(
            dataDir.resolve(RELATIONS_FILE),
            RelationsSnapshot.class,
            RelationsSnapshot::empty,
            backupEnabled);
    this.comments =
        new JsonSnapshotStore<>(
            dataDir.resolve(COMMENTS_FILE),
            CommentsSnapshot.class,
            CommentsSnapshot::empty,
            backupEnabled);
  }

  /** Create the data directory and default files for whichever datasets are missing. */
  public void initialize() {
    tags.initialize();
    relations.initialize();
    comments.initialize();
  }

  public Path dataDir() {
    return dataDir;
  }

  public SnapshotStore<TagsSnapshot> tags() {
    return tags;
  }

  public SnapshotStore<RelationsSnapshot> relations() {
    return relations;
  }

  public SnapshotStore<CommentsSnapshot> comments() {
    return comments;
  }
}
