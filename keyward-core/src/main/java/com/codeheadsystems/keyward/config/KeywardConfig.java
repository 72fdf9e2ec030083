package com.codeheadsystems.keyward.config;

import com.codeheadsystems.keyward.crypto.Primitives;
import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import com.codeheadsystems.keyward.model.EncryptedFileRecord;
import com.codeheadsystems.keyward.storage.StorageOptions;
import java.nio.file.Path;

/**
 * Runtime configuration for a keyward instance.
 *
 * @param dataDirectory        directory holding key rings, salt and all other managed files
 * @param masterKdfIterations  PBKDF2 iterations for the master password
 * @param keyWrapKdfIterations PBKDF2 iterations for private key passphrases and backup passwords
 * @param defaultKeyBits       RSA modulus size used when the caller does not give one
 * @param deletePasses         overwrite passes for secure deletion
 * @param formatVersion        version written into stored file wrappers
 * @param randomProvider       source of keys, salts and IVs
 */
public record KeywardConfig(Path dataDirectory,
                            int masterKdfIterations,
                            int keyWrapKdfIterations,
                            int defaultKeyBits,
                            int deletePasses,
                            String formatVersion,
                            RandomProvider randomProvider) {

  public static final int DEFAULT_KEY_BITS = 2048;
  public static final int DEFAULT_DELETE_PASSES = 3;

  public KeywardConfig {
    if (dataDirectory == null) {
      throw new IllegalArgumentException("Data directory must not be null");
    }
    if (masterKdfIterations < 1 || keyWrapKdfIterations < 1) {
      throw new IllegalArgumentException("KDF iterations must be positive");
    }
    if (defaultKeyBits < 1024) {
      throw new IllegalArgumentException("Default key size must be at least 1024 bits: " + defaultKeyBits);
    }
    if (deletePasses < 1) {
      throw new IllegalArgumentException("Delete passes must be positive: " + deletePasses);
    }
    if (formatVersion == null || formatVersion.isBlank()) {
      formatVersion = EncryptedFileRecord.CURRENT_VERSION;
    }
    if (randomProvider == null) {
      randomProvider = new RandomProvider();
    }
  }

  /**
   * Production settings: 100000 PBKDF2 iterations, 2048-bit keys, three delete passes.
   */
  public static KeywardConfig defaults(final Path dataDirectory) {
    return new KeywardConfig(dataDirectory,
        Primitives.PBKDF2_DEFAULT_ITERATIONS,
        Primitives.PBKDF2_DEFAULT_ITERATIONS,
        DEFAULT_KEY_BITS,
        DEFAULT_DELETE_PASSES,
        EncryptedFileRecord.CURRENT_VERSION,
        new RandomProvider());
  }

  /**
   * Cheap KDF and small keys so tests run quickly. Never use for real data.
   */
  public static KeywardConfig forTesting(final Path dataDirectory) {
    return new KeywardConfig(dataDirectory, 1_000, 1_000, 1024, 1,
        EncryptedFileRecord.CURRENT_VERSION, new RandomProvider());
  }

  public KeywardConfig withDataDirectory(final Path directory) {
    return new KeywardConfig(directory, masterKdfIterations, keyWrapKdfIterations, defaultKeyBits,
        deletePasses, formatVersion, randomProvider);
  }

  public KeywardConfig withDeletePasses(final int passes) {
    return new KeywardConfig(dataDirectory, masterKdfIterations, keyWrapKdfIterations, defaultKeyBits,
        passes, formatVersion, randomProvider);
  }

  public StorageOptions storageOptions() {
    return new StorageOptions(dataDirectory, masterKdfIterations, deletePasses, formatVersion, randomProvider);
  }
}
