package com.gentoro.codenexus.relations;

import com.gentoro.codenexus.exception.AlreadyExistsException;
import com.gentoro.codenexus.exception.ConfigException;
import com.gentoro.codenexus.exception.NotFoundException;
import com.gentoro.codenexus.model.Relation;
import com.gentoro.codenexus.model.RelationMatch;
import com.gentoro.codenexus.project.FileSystemProbe;
import com.gentoro.codenexus.storage.RelationsSnapshot;
import com.gentoro.codenexus.storage.SnapshotStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Directed, described relations between the files of one project.
 *
 * <p>Outgoing relations are the source of truth; the incoming index ({@code target -> (source,
 * description)}) is derived from them and updated in the same critical section. At most one
 * relation exists per ordered {@code (source, target)} pair. Self-relations are allowed.
 *
 * <p>As with {@link com.gentoro.codenexus.tags.TagIndex}, one lock guards reads and writes and a
 * failed write-through restores the previous in-memory state.
 */
public class RelationGraph {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(RelationGraph.class);

  private final Object lock = new Object();
  private final SnapshotStore<RelationsSnapshot> store;
  private final FileSystemProbe probe;

  private final Map<String, List<Relation>> outgoing = new HashMap<>();
  // target -> relations whose `target` field holds the source file
  private final Map<String, List<Relation>> incoming = new HashMap<>();

  public record Stats(int filesWithRelations, int totalRelations, int filesWithIncoming) {}

  public RelationGraph(SnapshotStore<RelationsSnapshot> store, FileSystemProbe probe) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.probe = Objects.requireNonNull(probe, "probe must not be null");
  }

  public void initialize() {
    RelationsSnapshot snapshot = store.load();
    synchronized (lock) {
      outgoing.clear();
      snapshot
          .fileRelations()
          .forEach(
              (source, relations) -> {
                if (relations == null) return;
                List<Relation> kept = new ArrayList<>();
                Set<String> targets = new HashSet<>();
                for (Relation relation : relations) {
                  if (relation == null || relation.target() == null) continue;
                  if (!targets.add(relation.target())) {
                    log.warn(
                        "Skipping duplicate stored relation {} -> {}", source, relation.target());
                    continue;
                  }
                  kept.add(relation);
                }
                if (!kept.isEmpty()) outgoing.put(source, kept);
              });
      rebuildIncoming();
      log.info("Relation graph loaded: {} files with relations", outgoing.size());
    }
  }

  /**
   * Add a relation from {@code source} to {@code target}.
   *
   * @throws NotFoundException if either file does not exist
   * @throws ConfigException if the description is blank
   * @throws AlreadyExistsException if a relation between the same ordered pair exists
   */
  public void addRelation(String source, String target, String description) {
    synchronized (lock) {
      if (!probe.exists(source)) throw NotFoundException.file(source);
      if (!probe.exists(target)) throw NotFoundException.file(target);
      if (description == null || description.isBlank()) {
        throw new ConfigException("Relation description must not be empty");
      }
      if (indexOf(source, target) >= 0) {
        throw new AlreadyExistsException(source, target);
      }

      outgoing
          .computeIfAbsent(source, k -> new ArrayList<>())
          .add(new Relation(target, description));
      incoming
          .computeIfAbsent(target, k -> new ArrayList<>())
          .add(new Relation(source, description));
      persist(() -> unlink(source, target));
      log.info("Added relation {} -> {} ({})", source, target, description);
    }
  }

  /**
   * Remove the relation from {@code source} to {@code target}.
   *
   * @throws NotFoundException with {@code RELATION_NOT_FOUND} if there is no such relation
   */
  public void removeRelation(String source, String target) {
    synchronized (lock) {
      int idx = indexOf(source, target);
      if (idx < 0) {
        throw NotFoundException.relation(source, target);
      }
      int incomingIdx = indexOfIncoming(target, source);
      Relation removed = unlink(source, target);
      persist(
          () -> {
            outgoing.computeIfAbsent(source, k -> new ArrayList<>()).add(idx, removed);
            List<Relation> in = incoming.computeIfAbsent(target, k -> new ArrayList<>());
            int at = Math.min(Math.max(incomingIdx, 0), in.size());
            in.add(at, new Relation(source, removed.description()));
          });
      log.info("Removed relation {} -> {}", source, target);
    }
  }

  /** Relations starting at {@code file}, in insertion order. */
  public List<Relation> getOutgoing(String file) {
    synchronized (lock) {
      List<Relation> relations = outgoing.get(file);
      return relations == null ? List.of() : List.copyOf(relations);
    }
  }

  /** Relations ending at {@code file}; each entry's {@code target} is the source file. */
  public List<Relation> getIncoming(String file) {
    synchronized (lock) {
      List<Relation> relations = incoming.get(file);
      return relations == null ? List.of() : List.copyOf(relations);
    }
  }

  public boolean hasRelation(String source, String target) {
    synchronized (lock) {
      return indexOf(source, target) >= 0;
    }
  }

  /**
   * Relations whose description contains {@code keyword}, ignoring case.
   *
   * @return matches ordered by source path, then insertion order
   */
  public List<RelationMatch> queryByDescription(String keyword) {
    String needle = keyword == null ? "" : keyword.toLowerCase(Locale.ROOT);
    synchronized (lock) {
      List<RelationMatch> matches = new ArrayList<>();
      new TreeMap<>(outgoing)
          .forEach(
              (source, relations) -> {
                for (Relation relation : relations) {
                  if (relation.description().toLowerCase(Locale.ROOT).contains(needle)) {
                    matches.add(new RelationMatch(source, relation));
                  }
                }
              });
      matches.sort(Comparator.comparing(RelationMatch::source));
      return matches;
    }
  }

  /**
   * Forward neighbourhood of {@code file}, up to {@code maxDepth} hops.
   *
   * <p>The start file is at depth 0 and a file at depth {@code d} is expanded only when {@code d <
   * maxDepth}. Each file is expanded at most once. Relations closing a cycle back to a file on the
   * current path are left out, and files left without relations are not listed, so a cycle {@code
   * A -> B -> C -> A} yields {@code {A: [B], B: [C]}} while a diamond {@code A -> B, A -> C, B ->
   * D, C -> D} keeps both {@code B -> D} and {@code C -> D}.
   *
   * @return file to its reported outgoing relations, in traversal order
   */
  public Map<String, List<Relation>> getRelationGraph(String file, int maxDepth) {
    synchronized (lock) {
      Map<String, List<Relation>> graph = new LinkedHashMap<>();
      expand(file, 0, maxDepth, graph, new HashSet<>(), new HashSet<>());
      return graph;
    }
  }

  private void expand(
      String file,
      int depth,
      int maxDepth,
      Map<String, List<Relation>> graph,
      Set<String> expanded,
      Set<String> path) {
    if (depth >= maxDepth || !expanded.add(file)) {
      return;
    }
    List<Relation> relations = outgoing.get(file);
    if (relations == null) {
      return;
    }
    path.add(file);
    List<Relation> reported = new ArrayList<>();
    for (Relation relation : relations) {
      if (!path.contains(relation.target())) {
        reported.add(relation);
      }
    }
    if (!reported.isEmpty()) {
      graph.put(file, List.copyOf(reported));
      for (Relation relation : reported) {
        expand(relation.target(), depth + 1, maxDepth, graph, expanded, path);
      }
    }
    path.remove(file);
  }

  /**
   * Remove relations whose source or target no longer exists. A missing source loses all its
   * relations; a missing target only loses the relations pointing at it.
   *
   * @return number of relations removed
   */
  public int cleanupInvalidRelations() {
    synchronized (lock) {
      Map<String, List<Relation>> previous = copyOutgoing();
      int removed = 0;
      for (String source : new ArrayList<>(outgoing.keySet())) {
        List<Relation> relations = outgoing.get(source);
        if (!probe.exists(source)) {
          removed += relations.size();
          outgoing.remove(source);
          log.debug("Dropped all relations of missing file {}", source);
          continue;
        }
        int before = relations.size();
        relations.removeIf(
            relation -> {
              boolean missing = !probe.exists(relation.target());
              if (missing) {
                log.debug("Dropped relation to missing file {} -> {}", source, relation.target());
              }
              return missing;
            });
        removed += before - relations.size();
        if (relations.isEmpty()) {
          outgoing.remove(source);
        }
      }

      if (removed == 0) {
        return 0;
      }
      rebuildIncoming();
      persist(
          () -> {
            outgoing.clear();
            outgoing.putAll(previous);
            rebuildIncoming();
          });
      log.info("Removed {} invalid relation(s)", removed);
      return removed;
    }
  }

  /** Files that have at least one outgoing relation, ascending. */
  public List<String> getRelatedFiles() {
    synchronized (lock) {
      return outgoing.keySet().stream().sorted().toList();
    }
  }

  public Stats getStats() {
    synchronized (lock) {
      int total = outgoing.values().stream().mapToInt(List::size).sum();
      return new Stats(outgoing.size(), total, incoming.size());
    }
  }

  private int indexOf(String source, String target) {
    List<Relation> relations = outgoing.get(source);
    if (relations == null) return -1;
    for (int i = 0; i < relations.size(); i++) {
      if (relations.get(i).target().equals(target)) return i;
    }
    return -1;
  }

  private int indexOfIncoming(String target, String source) {
    List<Relation> relations = incoming.get(target);
    if (relations == null) return -1;
    for (int i = 0; i < relations.size(); i++) {
      if (relations.get(i).target().equals(source)) return i;
    }
    return -1;
  }

  /** Removes the pair from both indices, pruning empty entries, and returns the outgoing entry. */
  private Relation unlink(String source, String target) {
    Relation removed = null;
    List<Relation> out = outgoing.get(source);
    if (out != null) {
      int idx = indexOf(source, target);
      if (idx >= 0) removed = out.remove(idx);
      if (out.isEmpty()) outgoing.remove(source);
    }
    List<Relation> in = incoming.get(target);
    if (in != null) {
      int idx = indexOfIncoming(target, source);
      if (idx >= 0) in.remove(idx);
      if (in.isEmpty()) incoming.remove(target);
    }
    return removed;
  }

  private void rebuildIncoming() {
    incoming.clear();
    outgoing.forEach(
        (source, relations) -> {
          for (Relation relation : relations) {
            incoming
                .computeIfAbsent(relation.target(), k -> new ArrayList<>())
                .add(new Relation(source, relation.description()));
          }
        });
  }

  private Map<String, List<Relation>> copyOutgoing() {
    Map<String, List<Relation>> copy = new HashMap<>();
    outgoing.forEach((source, relations) -> copy.put(source, new ArrayList<>(relations)));
    return copy;
  }

  private void persist(Runnable rollback) {
    try {
      store.save(snapshot());
    } catch (RuntimeException e) {
      rollback.run();
      log.error("Failed to persist relation graph, in-memory change rolled back", e);
      throw e;
    }
  }

  private RelationsSnapshot snapshot() {
    Map<String, List<Relation>> data = new TreeMap<>();
    outgoing.forEach((source, relations) -> data.put(source, List.copyOf(relations)));
    return new RelationsSnapshot(data);
  }
}
