package com.codeheadsystems.keyward.storage;

import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import java.nio.file.Path;

/**
 * Settings for {@link EncryptedFileStore}.
 *
 * @param root           data directory holding every managed file
 * @param kdfIterations  PBKDF2 iterations for the master key
 * @param deletePasses   overwrite passes for secure deletion
 * @param formatVersion  version written into each file wrapper
 * @param randomProvider source of salts, IVs and overwrite bytes
 */
public record StorageOptions(Path root,
                             int kdfIterations,
                             int deletePasses,
                             String formatVersion,
                             RandomProvider randomProvider) {

  public StorageOptions {
    if (root == null) {
      throw new IllegalArgumentException("Storage root must not be null");
    }
    if (kdfIterations < 1) {
      throw new IllegalArgumentException("KDF iterations must be positive: " + kdfIterations);
    }
    if (deletePasses < 1) {
      throw new IllegalArgumentException("Delete passes must be positive: " + deletePasses);
    }
  }
}
