package com.codeheadsystems.keyward.storage;

import com.codeheadsystems.keyward.crypto.Primitives;
import com.codeheadsystems.keyward.crypto.SealedToken;
import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the 32-byte master key from the master password and the directory salt.
 * <p>
 * The salt is 32 random bytes in {@value #SALT_FILE}, created on first use and never rotated,
 * so a password change re-derives against the same salt.
 */
public class MasterKeyDeriver {

  public static final String SALT_FILE = ".encryption_salt";
  public static final int SALT_SIZE = 32;

  private static final Logger log = LoggerFactory.getLogger(MasterKeyDeriver.class);

  private final Path saltFile;
  private final int iterations;
  private final RandomProvider randomProvider;

  public MasterKeyDeriver(final Path root, final int iterations, final RandomProvider randomProvider) {
    log.info("MasterKeyDeriver({}, {})", root, iterations);
    this.saltFile = root.resolve(SALT_FILE);
    this.iterations = iterations;
    this.randomProvider = randomProvider;
  }

  /**
   * Derives the master key, creating the salt if this directory has none yet.
   *
   * @param password the master password
   * @return a fresh 32-byte key the caller owns
   */
  public byte[] deriveKey(final String password) {
    if (password == null) {
      throw new IllegalArgumentException("Master password must not be null");
    }
    return Primitives.pbkdf2Sha256(password, salt(), iterations, SealedToken.KEY_SIZE);
  }

  byte[] salt() {
    try {
      if (Files.exists(saltFile)) {
        byte[] salt = Files.readAllBytes(saltFile);
        if (salt.length == 0) {
          throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Salt file is empty: " + saltFile);
        }
        return salt;
      }
      byte[] salt = randomProvider.randomBytes(SALT_SIZE);
      Files.createDirectories(saltFile.getParent());
      try {
        Files.write(saltFile, salt, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        log.info("Created master key salt in {}", saltFile.getParent());
        return salt;
      } catch (FileAlreadyExistsException e) {
        // Another writer won the race; use its salt.
        return Files.readAllBytes(saltFile);
      }
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to read or create salt file", e);
    }
  }
}
