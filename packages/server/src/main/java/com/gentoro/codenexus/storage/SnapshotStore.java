package com.gentoro.codenexus.storage;

/**
 * Whole-snapshot persistence for one dataset. Implementations replace the stored snapshot on every
 * {@link #save(Object)}; there is no partial update.
 *
 * @param <T> snapshot type
 */
public interface SnapshotStore<T> {

  /**
   * Load the current snapshot.
   *
   * @return the stored snapshot, or the empty default when nothing is stored yet
   * @throws com.gentoro.codenexus.exception.SerializationException if stored data cannot be parsed
   * @throws com.gentoro.codenexus.exception.IoException if the store cannot be read
   */
  T load();

  /**
   * Replace the stored snapshot.
   *
   * @throws com.gentoro.codenexus.exception.SerializationException if the snapshot cannot be
   *     serialized
   * @throws com.gentoro.codenexus.exception.IoException if the store cannot be written
   */
  void save(T snapshot);
}
