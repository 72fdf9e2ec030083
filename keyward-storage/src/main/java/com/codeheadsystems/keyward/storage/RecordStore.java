package com.codeheadsystems.keyward.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;

/**
 * JSON record storage under a data directory, encrypted at rest with a master-password key.
 * <p>
 * Filenames are relative to {@link #root()}. Every operation that reads or writes record content
 * fails with {@code ENCRYPTION_NOT_INITIALIZED} until {@link #openSession(String)} succeeds.
 * Implementations must be thread-safe.
 */
public interface RecordStore extends AutoCloseable {

  /**
   * Derives the master key and migrates any plaintext files found under the root.
   *
   * @param password the master password
   * @return what the migration sweep did
   */
  MigrationReport openSession(String password);

  boolean isOpen();

  Path root();

  /**
   * Serializes and seals a value under the session key.
   *
   * @param data any Jackson-serializable value
   * @return base64 of the sealed token
   */
  String encryptRecord(Object data);

  /**
   * Reverses {@link #encryptRecord(Object)}.
   *
   * @param data the base64 text
   * @return the JSON tree
   */
  JsonNode decryptRecord(String data);

  void save(String filename, Object data);

  /**
   * Loads a record.
   *
   * @param filename     relative file name
   * @param type         target type
   * @param defaultValue returned only when the file does not exist
   * @param <T>          target type
   * @return the stored value, the legacy payload of a plaintext file, or the default
   */
  <T> T load(String filename, TypeReference<T> type, T defaultValue);

  <T> T load(String filename, Class<T> type, T defaultValue);

  /**
   * Rewrites a plaintext file in encrypted form.
   *
   * @return true if the file was rewritten
   */
  boolean migrate(String filename);

  MigrationReport migrateDirectory();

  /**
   * Overwrites the file with random bytes and unlinks it.
   *
   * @return true if a file was deleted
   */
  boolean secureDelete(String filename);

  /**
   * Securely deletes every file under the root except the directory lock.
   */
  WipeReport secureDeleteAll();

  boolean isEncrypted(String filename);

  boolean exists(String filename);

  /**
   * Re-encrypts every encrypted file under a key derived from {@code newPassword}.
   *
   * @param oldPassword the current master password
   * @param newPassword the replacement
   * @return per-file outcome
   */
  RotationReport rotatePassword(String oldPassword, String newPassword);

  /**
   * Wipes the session key and releases the directory lock.
   */
  @Override
  void close();
}
