package com.gentoro.codenexus.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codenexus.exception.CodeNexusErrorCode;
import com.gentoro.codenexus.exception.SerializationException;
import com.gentoro.codenexus.model.Relation;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonSnapshotStoreTest {

  @TempDir Path dir;

  private JsonSnapshotStore<TagsSnapshot> tagsStore() {
    return new JsonSnapshotStore<>(
        dir.resolve(ProjectStorage.TAGS_FILE), TagsSnapshot.class, TagsSnapshot::empty);
  }

  @Test
  @DisplayName("missing or blank files load as the empty snapshot")
  void missingAndBlank() throws Exception {
    JsonSnapshotStore<TagsSnapshot> store = tagsStore();
    assertTrue(store.load().fileTags().isEmpty());

    Files.writeString(store.file(), "  \n", StandardCharsets.UTF_8);
    assertTrue(store.load().fileTags().isEmpty());
  }

  @Test
  @DisplayName("saved snapshots load back with the documented JSON shape")
  void saveAndLoad() throws Exception {
    JsonSnapshotStore<TagsSnapshot> store = tagsStore();
    store.save(new TagsSnapshot(Map.of("src/main.go", List.of("category:api", "lang:go"))));

    String json = Files.readString(store.file(), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"file_tags\""), json);
    assertEquals(List.of("category:api", "lang:go"), store.load().fileTags().get("src/main.go"));
  }

  @Test
  @DisplayName("relations snapshot uses target and description fields")
  void relationsShape() throws Exception {
    JsonSnapshotStore<RelationsSnapshot> store =
        new JsonSnapshotStore<>(
            dir.resolve(ProjectStorage.RELATIONS_FILE),
            RelationsSnapshot.class,
            RelationsSnapshot::empty);
    Files.writeString(
        store.file(),
        "{\"file_relations\":{\"a.go\":[{\"target\":\"b.go\",\"description\":\"uses\"}]}}",
        StandardCharsets.UTF_8);

    assertEquals(List.of(new Relation("b.go", "uses")), store.load().fileRelations().get("a.go"));
  }

  @Test
  @DisplayName("corrupt content surfaces as SERIALIZATION_ERROR")
  void corruptFile() throws Exception {
    JsonSnapshotStore<TagsSnapshot> store = tagsStore();
    Files.writeString(store.file(), "{ not json", StandardCharsets.UTF_8);

    SerializationException ex = assertThrows(SerializationException.class, store::load);
    assertEquals(CodeNexusErrorCode.SERIALIZATION_ERROR, ex.getCode());
    assertEquals("load", ex.getContext().get("operation"));
  }

  @Test
  @DisplayName("the previous content is kept as a backup on overwrite")
  void backupOnSecondSave() throws Exception {
    JsonSnapshotStore<TagsSnapshot> store = tagsStore();
    store.save(new TagsSnapshot(Map.of("a.go", List.of("v:1"))));
    assertFalse(Files.exists(store.backupFile()));

    store.save(new TagsSnapshot(Map.of("a.go", List.of("v:2"))));
    assertTrue(Files.exists(store.backupFile()));
    assertTrue(Files.readString(store.backupFile(), StandardCharsets.UTF_8).contains("v:1"));
    assertEquals(List.of("v:2"), store.load().fileTags().get("a.go"));
  }

  @Test
  @DisplayName("ProjectStorage.initialize creates the data directory and default files")
  void projectStorageInitialize() {
    ProjectStorage storage = new ProjectStorage(dir.resolve(".codenexus"), true);
    storage.initialize();

    assertTrue(Files.isRegularFile(dir.resolve(".codenexus").resolve(ProjectStorage.TAGS_FILE)));
    assertTrue(
        Files.isRegularFile(dir.resolve(".codenexus").resolve(ProjectStorage.RELATIONS_FILE)));
    assertTrue(
        Files.isRegularFile(dir.resolve(".codenexus").resolve(ProjectStorage.COMMENTS_FILE)));
    assertTrue(storage.comments().load().fileComments().isEmpty());
  }
}
