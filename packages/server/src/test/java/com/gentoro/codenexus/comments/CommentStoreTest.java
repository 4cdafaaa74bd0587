package com.gentoro.codenexus.comments;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.codenexus.exception.CodeNexusErrorCode;
import com.gentoro.codenexus.exception.ConfigException;
import com.gentoro.codenexus.exception.IoException;
import com.gentoro.codenexus.exception.NotFoundException;
import com.gentoro.codenexus.storage.CommentsSnapshot;
import com.gentoro.codenexus.storage.InMemorySnapshotStore;
import com.gentoro.codenexus.storage.SnapshotStore;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommentStoreTest {

  private final Set<String> existing = new HashSet<>(Set.of("a.go", "b.go", "c.go"));
  private InMemorySnapshotStore<CommentsSnapshot> store;
  private CommentStore comments;

  @BeforeEach
  void setUp() {
    store = new InMemorySnapshotStore<>(CommentsSnapshot.empty());
    comments = new CommentStore(store, existing::contains);
    comments.initialize();
  }

  @Test
  @DisplayName("addComment refuses to overwrite, updateComment replaces")
  void addThenUpdate() {
    comments.addComment("a.go", "entry point");
    ConfigException ex =
        assertThrows(ConfigException.class, () -> comments.addComment("a.go", "other"));
    assertEquals(CodeNexusErrorCode.CONFIG_ERROR, ex.getCode());

    comments.updateComment("a.go", "main entry point");
    assertEquals(Optional.of("main entry point"), comments.getComment("a.go"));
    assertEquals(Map.of("a.go", "main entry point"), store.last().fileComments());

    comments.updateComment("b.go", "created by update");
    assertEquals(List.of("a.go", "b.go"), comments.getCommentedFiles());
  }

  @Test
  @DisplayName("blank text and missing files are rejected")
  void validation() {
    assertThrows(ConfigException.class, () -> comments.addComment("a.go", " "));
    assertThrows(ConfigException.class, () -> comments.updateComment("a.go", null));
    NotFoundException ex =
        assertThrows(NotFoundException.class, () -> comments.addComment("ghost.go", "text"));
    assertEquals(CodeNexusErrorCode.FILE_NOT_FOUND, ex.getCode());
    assertEquals(0, store.saveCount());
  }

  @Test
  @DisplayName("deleteComment removes an existing comment and fails otherwise")
  void deleteComment() {
    comments.addComment("a.go", "entry point");
    comments.deleteComment("a.go");
    assertFalse(comments.hasComment("a.go"));
    assertThrows(NotFoundException.class, () -> comments.deleteComment("a.go"));
  }

  @Test
  @DisplayName("searchComments matches case-insensitively, ordered by path")
  void search() {
    comments.addComment("b.go", "Handles HTTP routing");
    comments.addComment("a.go", "http client");
    comments.addComment("c.go", "database");

    Map<String, String> found = comments.searchComments("HTTP");
    assertEquals(List.of("a.go", "b.go"), List.copyOf(found.keySet()));
    assertEquals(Map.of("a.go", "http client"), comments.getComments(List.of("a.go", "ghost")));
  }

  @Test
  @DisplayName("import skips blank text and missing files, export returns everything")
  void importExport() {
    Map<String, String> imported = new LinkedHashMap<>();
    imported.put("a.go", "imported");
    imported.put("b.go", "  ");
    imported.put("ghost.go", "lost");

    assertEquals(1, comments.importComments(imported));
    assertEquals(Map.of("a.go", "imported"), comments.exportComments());
    assertEquals(new CommentStore.Stats(1, "imported".length()), comments.getStats());
  }

  @Test
  @DisplayName("cleanup drops comments of deleted files")
  void cleanup() {
    comments.addComment("a.go", "keep");
    comments.addComment("c.go", "drop");
    existing.remove("c.go");

    assertEquals(1, comments.cleanupInvalidComments());
    assertEquals(List.of("a.go"), comments.getCommentedFiles());
    assertEquals(0, comments.cleanupInvalidComments());
  }

  @Test
  @DisplayName("a failed save restores the previous comment")
  @SuppressWarnings("unchecked")
  void rollbackOnSaveFailure() {
    SnapshotStore<CommentsSnapshot> failing = mock(SnapshotStore.class);
    when(failing.load()).thenReturn(new CommentsSnapshot(Map.of("a.go", "original")));
    doThrow(new IoException("denied", new java.io.IOException("denied")))
        .when(failing)
        .save(any());
    CommentStore guarded = new CommentStore(failing, existing::contains);
    guarded.initialize();

    assertThrows(IoException.class, () -> guarded.updateComment("a.go", "changed"));
    assertEquals(Optional.of("original"), guarded.getComment("a.go"));
    assertThrows(IoException.class, () -> guarded.addComment("b.go", "new"));
    assertFalse(guarded.hasComment("b.go"));
    assertThrows(IoException.class, () -> guarded.deleteComment("a.go"));
    assertEquals(Optional.of("original"), guarded.getComment("a.go"));
  }
}
