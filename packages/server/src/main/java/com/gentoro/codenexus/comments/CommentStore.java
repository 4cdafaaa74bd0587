package com.gentoro.codenexus.comments;

import com.gentoro.codenexus.exception.ConfigException;
import com.gentoro.codenexus.exception.NotFoundException;
import com.gentoro.codenexus.project.FileSystemProbe;
import com.gentoro.codenexus.storage.CommentsSnapshot;
import com.gentoro.codenexus.storage.SnapshotStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/** One free-text comment per file, persisted as a whole on every change. */
public class CommentStore {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(CommentStore.class);

  private final Object lock = new Object();
  private final SnapshotStore<CommentsSnapshot> store;
  private final FileSystemProbe probe;
  private final Map<String, String> comments = new HashMap<>();

  public record Stats(int comments, long totalChars) {}

  public CommentStore(SnapshotStore<CommentsSnapshot> store, FileSystemProbe probe) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.probe = Objects.requireNonNull(probe, "probe must not be null");
  }

  public void initialize() {
    CommentsSnapshot snapshot = store.load();
    synchronized (lock) {
      comments.clear();
      snapshot
          .fileComments()
          .forEach(
              (file, text) -> {
                if (text != null && !text.isBlank()) comments.put(file, text);
              });
      log.info("Comments loaded: {} commented files", comments.size());
    }
  }

  /**
   * Attach a comment to a file that has none yet.
   *
   * @throws NotFoundException if the file does not exist
   * @throws ConfigException if the text is blank or the file already has a comment
   */
  public void addComment(String file, String text) {
    synchronized (lock) {
      checkWritable(file, text);
      if (comments.containsKey(file)) {
        throw new ConfigException(
            "File already has a comment, use update_file_comment to change it: " + file);
      }
      comments.put(file, text);
      persist(() -> comments.remove(file));
      log.info("Added comment to {}", file);
    }
  }

  /** Set the comment of a file, replacing any existing one. */
  public void updateComment(String file, String text) {
    synchronized (lock) {
      checkWritable(file, text);
      String previous = comments.put(file, text);
      if (text.equals(previous)) {
        log.debug("Comment of {} unchanged", file);
        return;
      }
      persist(() -> restore(file, previous));
      log.info("{} comment of {}", previous == null ? "Added" : "Updated", file);
    }
  }

  /**
   * @throws NotFoundException if the file has no comment
   */
  public void deleteComment(String file) {
    synchronized (lock) {
      String previous = comments.remove(file);
      if (previous == null) {
        throw NotFoundException.file(file);
      }
      persist(() -> comments.put(file, previous));
      log.info("Deleted comment of {}", file);
    }
  }

  public Optional<String> getComment(String file) {
    synchronized (lock) {
      return Optional.ofNullable(comments.get(file));
    }
  }

  /** Comments of the given files that have one, in request order. */
  public Map<String, String> getComments(Collection<String> files) {
    synchronized (lock) {
      Map<String, String> result = new LinkedHashMap<>();
      for (String file : files) {
        String text = comments.get(file);
        if (text != null) result.put(file, text);
      }
      return result;
    }
  }

  public boolean hasComment(String file) {
    synchronized (lock) {
      return comments.containsKey(file);
    }
  }

  public List<String> getCommentedFiles() {
    synchronized (lock) {
      return comments.keySet().stream().sorted().toList();
    }
  }

  /**
   * Files whose comment contains {@code keyword}, ignoring case.
   *
   * @return file to comment, ordered by path
   */
  public Map<String, String> searchComments(String keyword) {
    String needle = keyword == null ? "" : keyword.toLowerCase(Locale.ROOT);
    synchronized (lock) {
      Map<String, String> result = new TreeMap<>();
      comments.forEach(
          (file, text) -> {
            if (text.toLowerCase(Locale.ROOT).contains(needle)) result.put(file, text);
          });
      return result;
    }
  }

  /**
   * Drop comments of files that no longer exist.
   *
   * @return number of comments removed
   */
  public int cleanupInvalidComments() {
    synchronized (lock) {
      Map<String, String> dropped = new HashMap<>();
      for (String file : new ArrayList<>(comments.keySet())) {
        if (!probe.exists(file)) {
          dropped.put(file, comments.remove(file));
          log.debug("Dropped comment of missing file {}", file);
        }
      }
      if (dropped.isEmpty()) {
        return 0;
      }
      persist(() -> comments.putAll(dropped));
      log.info("Removed comments of {} missing file(s)", dropped.size());
      return dropped.size();
    }
  }

  /** All comments, ordered by path. */
  public Map<String, String> exportComments() {
    synchronized (lock) {
      return new TreeMap<>(comments);
    }
  }

  /**
   * Merge comments into the store, overwriting existing ones. Entries for missing files or with
   * blank text are skipped.
   *
   * @return number of comments imported
   */
  public int importComments(Map<String, String> imported) {
    Objects.requireNonNull(imported, "imported must not be null");
    synchronized (lock) {
      Map<String, String> previous = new HashMap<>(comments);
      int count = 0;
      for (Map.Entry<String, String> entry : imported.entrySet()) {
        String file = entry.getKey();
        String text = entry.getValue();
        if (text == null || text.isBlank()) {
          log.debug("Skipping blank imported comment for {}", file);
          continue;
        }
        if (!probe.exists(file)) {
          log.warn("Skipping imported comment for missing file {}", file);
          continue;
        }
        comments.put(file, text);
        count++;
      }
      if (count == 0) {
        return 0;
      }
      persist(
          () -> {
            comments.clear();
            comments.putAll(previous);
          });
      log.info("Imported {} comment(s)", count);
      return count;
    }
  }

  public Stats getStats() {
    synchronized (lock) {
      long chars = comments.values().stream().mapToLong(String::length).sum();
      return new Stats(comments.size(), chars);
    }
  }

  private void checkWritable(String file, String text) {
    if (!probe.exists(file)) {
      throw NotFoundException.file(file);
    }
    if (text == null || text.isBlank()) {
      throw new ConfigException("Comment must not be empty");
    }
  }

  private void restore(String file, String previous) {
    if (previous == null) {
      comments.remove(file);
    } else {
      comments.put(file, previous);
    }
  }

  private void persist(Runnable rollback) {
    try {
      store.save(new CommentsSnapshot(new TreeMap<>(comments)));
    } catch (RuntimeException e) {
      rollback.run();
      log.error("Failed to persist comments, in-memory change rolled back", e);
      throw e;
    }
  }
}
