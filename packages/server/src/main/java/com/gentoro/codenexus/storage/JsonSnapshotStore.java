package com.gentoro.codenexus.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.codenexus.exception.IoException;
import com.gentoro.codenexus.exception.SerializationException;
import com.gentoro.codenexus.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link SnapshotStore} backed by a single pretty-printed JSON file.
 *
 * <p>Before an existing file is overwritten it is copied to {@code <name>.bak} (for example {@code
 * tags.json.bak}). A failed backup is logged and does not prevent the save. The new content is
 * written to a temporary sibling first and then moved over the target.
 */
public class JsonSnapshotStore<T> implements SnapshotStore<T> {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(JsonSnapshotStore.class);

  private final Path file;
  private final Class<T> type;
  private final Supplier<T> emptySnapshot;
  private final boolean backupEnabled;
  private final ObjectMapper mapper;

  public JsonSnapshotStore(Path file, Class<T> type, Supplier<T> emptySnapshot) {
    this(file, type, emptySnapshot, true);
  }

  public JsonSnapshotStore(
      Path file, Class<T> type, Supplier<T> emptySnapshot, boolean backupEnabled) {
    this.file = Objects.requireNonNull(file, "file must not be null");
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.emptySnapshot = Objects.requireNonNull(emptySnapshot, "emptySnapshot must not be null");
    this.backupEnabled = backupEnabled;
    this.mapper = JacksonUtility.getJsonMapper();
  }

  public Path file() {
    return file;
  }

  public Path backupFile() {
    return file.resolveSibling(file.getFileName() + ".bak");
  }

  /** Create the parent directory and write an empty snapshot if the file does not exist yet. */
  public void initialize() {
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
      if (!Files.exists(file)) {
        write(emptySnapshot.get());
        log.debug("Created default data file: {}", file);
      }
    } catch (IOException e) {
      throw new IoException("Failed to initialize data file: " + file, context("initialize"), e);
    }
  }

  @Override
  public T load() {
    if (!Files.exists(file)) {
      return emptySnapshot.get();
    }
    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to read data file {}: {}", file, e.getMessage());
      throw new IoException("Failed to read data file: " + file, context("load"), e);
    }
    if (content.isBlank()) {
      return emptySnapshot.get();
    }
    try {
      T snapshot = mapper.readValue(content, type);
      return snapshot == null ? emptySnapshot.get() : snapshot;
    } catch (JsonProcessingException e) {
      log.error("Failed to parse data file {}: {}", file, e.getOriginalMessage());
      throw new SerializationException("Failed to parse data file: " + file, context("load"), e);
    }
  }

  @Override
  public void save(T snapshot) {
    if (backupEnabled && Files.exists(file)) {
      Path backup = backupFile();
      try {
        Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
      } catch (IOException e) {
        log.warn("Failed to create backup {}: {}", backup, e.getMessage());
      }
    }
    try {
      write(snapshot);
    } catch (IOException e) {
      log.error("Failed to write data file {}: {}", file, e.getMessage());
      throw new IoException("Failed to write data file: " + file, context("save"), e);
    }
    log.debug("Saved snapshot to {}", file);
  }

  private void write(T snapshot) throws IOException {
    String json;
    try {
      json = mapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Failed to serialize snapshot for: " + file, context("save"), e);
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    Files.writeString(tmp, json, StandardCharsets.UTF_8);
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
  }

  private Map<String, Object> context(String operation) {
    return Map.of("file", file.toString(), "operation", operation);
  }
}
