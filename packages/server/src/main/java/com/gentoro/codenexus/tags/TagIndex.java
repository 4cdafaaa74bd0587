package com.gentoro.codenexus.tags;

import com.gentoro.codenexus.exception.NotFoundException;
import com.gentoro.codenexus.exception.ValidationException;
import com.gentoro.codenexus.project.FileSystemProbe;
import com.gentoro.codenexus.query.QueryEngine;
import com.gentoro.codenexus.query.TagIndexView;
import com.gentoro.codenexus.storage.SnapshotStore;
import com.gentoro.codenexus.storage.TagsSnapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * In-memory tag index for one project.
 *
 * <p>Owns {@code file -> tags} and keeps two derived indices in step with it: {@code type ->
 * values} and {@code tag -> files}. A single lock guards reads and writes; a mutation is written
 * through to the {@link SnapshotStore} before the lock is released. When the write fails the
 * in-memory change is undone and the storage error propagates.
 */
public class TagIndex {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(TagIndex.class);

  private final Object lock = new Object();
  private final SnapshotStore<TagsSnapshot> store;
  private final FileSystemProbe probe;

  private final Map<String, Set<String>> fileTags = new HashMap<>();
  private final Map<String, Set<String>> tagTypes = new HashMap<>();
  private final Map<String, Set<String>> tagToFiles = new HashMap<>();

  /** Counts exposed through {@link TagIndex#getStats()}. */
  public record Stats(int taggedFiles, int distinctTags, int tagTypes) {}

  public TagIndex(SnapshotStore<TagsSnapshot> store, FileSystemProbe probe) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.probe = Objects.requireNonNull(probe, "probe must not be null");
  }

  /** Replace the in-memory state with the stored snapshot. */
  public void initialize() {
    TagsSnapshot snapshot = store.load();
    synchronized (lock) {
      fileTags.clear();
      tagTypes.clear();
      tagToFiles.clear();
      snapshot
          .fileTags()
          .forEach(
              (file, tags) -> {
                if (tags == null) return;
                for (String tag : tags) {
                  if (!isValidTag(tag)) {
                    log.warn("Skipping malformed stored tag '{}' on {}", tag, file);
                    continue;
                  }
                  if (fileTags.computeIfAbsent(file, k -> new TreeSet<>()).add(tag)) {
                    index(tag, file);
                  }
                }
              });
      log.info("Tag index loaded: {} tagged files", fileTags.size());
    }
  }

  /**
   * Check that {@code tag} has the form {@code type:value}: exactly one colon, both sides
   * non-empty.
   *
   * @throws ValidationException with {@code INVALID_TAG_FORMAT}
   */
  public static void validateTag(String tag) {
    if (!isValidTag(tag)) {
      throw ValidationException.tagFormat(tag);
    }
  }

  static boolean isValidTag(String tag) {
    if (tag == null) return false;
    int sep = tag.indexOf(':');
    return sep > 0 && sep < tag.length() - 1 && tag.indexOf(':', sep + 1) < 0;
  }

  /**
   * Add tags to a file. All tags are validated before anything changes; tags the file already
   * carries are skipped.
   *
   * @return the tags that were newly added, in request order
   * @throws NotFoundException if the file does not exist
   * @throws ValidationException if any tag is malformed
   */
  public List<String> addTags(String file, Collection<String> tags) {
    Objects.requireNonNull(tags, "tags must not be null");
    synchronized (lock) {
      if (!probe.exists(file)) {
        throw NotFoundException.file(file);
      }
      for (String tag : tags) {
        validateTag(tag);
      }

      Set<String> current = fileTags.get(file);
      Set<String> added = new LinkedHashSet<>();
      for (String tag : tags) {
        if (current == null || !current.contains(tag)) {
          added.add(tag);
        }
      }
      if (added.isEmpty()) {
        log.debug("Tags of {} unchanged", file);
        return List.of();
      }

      for (String tag : added) {
        insert(file, tag);
      }
      persist(() -> added.forEach(tag -> delete(file, tag)));
      log.info("Added {} tag(s) to {}: {}", added.size(), file, added);
      return List.copyOf(added);
    }
  }

  /**
   * Remove tags from a file. Every requested tag must be present; the check runs before anything
   * is removed.
   *
   * @return the removed tags, in request order
   * @throws NotFoundException {@code FILE_NOT_FOUND} if the file has no tags at all, {@code
   *     TAG_NOT_FOUND} if a requested tag is not on the file
   * @throws ValidationException if a requested tag is null
   */
  public List<String> removeTags(String file, Collection<String> tags) {
    Objects.requireNonNull(tags, "tags must not be null");
    synchronized (lock) {
      Set<String> current = fileTags.get(file);
      if (current == null) {
        throw NotFoundException.file(file);
      }
      for (String tag : tags) {
        if (tag == null) {
          throw ValidationException.tagFormat(null);
        }
        if (!current.contains(tag)) {
          throw NotFoundException.tag(tag, file);
        }
      }

      Set<String> removed = new LinkedHashSet<>(tags);
      if (removed.isEmpty()) {
        return List.of();
      }
      for (String tag : removed) {
        delete(file, tag);
      }
      persist(() -> removed.forEach(tag -> insert(file, tag)));
      log.info("Removed {} tag(s) from {}: {}", removed.size(), file, removed);
      return List.copyOf(removed);
    }
  }

  /** Tags of {@code file} in ascending order; empty for unknown files. */
  public List<String> getFileTags(String file) {
    synchronized (lock) {
      Set<String> tags = fileTags.get(file);
      return tags == null ? List.of() : List.copyOf(tags);
    }
  }

  /** Tag types in use, each mapped to its values in ascending order. */
  public Map<String, List<String>> getAllTags() {
    synchronized (lock) {
      Map<String, List<String>> result = new TreeMap<>();
      tagTypes.forEach((type, values) -> result.put(type, List.copyOf(new TreeSet<>(values))));
      return result;
    }
  }

  /**
   * Evaluate a tag query. See {@link com.gentoro.codenexus.query.QueryParser} for the syntax.
   *
   * @return matching files in ascending order
   */
  public List<String> queryFilesByTags(String query) {
    synchronized (lock) {
      return QueryEngine.query(
          query,
          new TagIndexView(
              Collections.unmodifiableMap(tagToFiles),
              Collections.unmodifiableSet(fileTags.keySet())));
    }
  }

  /**
   * Files carrying exactly {@code tag}. The tag is matched literally, so {@code *}, parentheses
   * and operator words in it have no query meaning.
   */
  public List<String> getFilesWithTag(String tag) {
    synchronized (lock) {
      Set<String> files = tagToFiles.get(tag);
      return files == null ? List.of() : List.copyOf(files);
    }
  }

  /** Files with at least one tag, ascending. */
  public List<String> getTaggedFiles() {
    synchronized (lock) {
      return List.copyOf(new TreeSet<>(fileTags.keySet()));
    }
  }

  public Stats getStats() {
    synchronized (lock) {
      return new Stats(fileTags.size(), tagToFiles.size(), tagTypes.size());
    }
  }

  /**
   * Drop every entry whose file no longer exists.
   *
   * @return number of files removed from the index
   */
  public int cleanupMissingFiles() {
    synchronized (lock) {
      Map<String, Set<String>> dropped = new HashMap<>();
      for (String file : new ArrayList<>(fileTags.keySet())) {
        if (!probe.exists(file)) {
          Set<String> tags = new TreeSet<>(fileTags.get(file));
          tags.forEach(tag -> delete(file, tag));
          dropped.put(file, tags);
          log.debug("Dropped tags of missing file {}", file);
        }
      }
      if (dropped.isEmpty()) {
        return 0;
      }
      persist(() -> dropped.forEach((file, tags) -> tags.forEach(tag -> insert(file, tag))));
      log.info("Removed tags of {} missing file(s)", dropped.size());
      return dropped.size();
    }
  }

  private void insert(String file, String tag) {
    if (fileTags.computeIfAbsent(file, k -> new TreeSet<>()).add(tag)) {
      index(tag, file);
    }
  }

  private void delete(String file, String tag) {
    Set<String> tags = fileTags.get(file);
    if (tags == null || !tags.remove(tag)) return;
    if (tags.isEmpty()) {
      fileTags.remove(file);
    }
    unindex(tag, file);
  }

  private void index(String tag, String file) {
    int sep = tag.indexOf(':');
    tagTypes
        .computeIfAbsent(tag.substring(0, sep), k -> new TreeSet<>())
        .add(tag.substring(sep + 1));
    tagToFiles.computeIfAbsent(tag, k -> new TreeSet<>()).add(file);
  }

  private void unindex(String tag, String file) {
    Set<String> files = tagToFiles.get(tag);
    if (files == null) return;
    files.remove(file);
    if (!files.isEmpty()) return;

    tagToFiles.remove(tag);
    int sep = tag.indexOf(':');
    String type = tag.substring(0, sep);
    Set<String> values = tagTypes.get(type);
    if (values != null) {
      values.remove(tag.substring(sep + 1));
      if (values.isEmpty()) {
        tagTypes.remove(type);
      }
    }
  }

  private void persist(Runnable rollback) {
    try {
      store.save(snapshot());
    } catch (RuntimeException e) {
      rollback.run();
      log.error("Failed to persist tag index, in-memory change rolled back", e);
      throw e;
    }
  }

  private TagsSnapshot snapshot() {
    Map<String, List<String>> data = new TreeMap<>();
    fileTags.forEach((file, tags) -> data.put(file, new ArrayList<>(tags)));
    return new TagsSnapshot(data);
  }
}
