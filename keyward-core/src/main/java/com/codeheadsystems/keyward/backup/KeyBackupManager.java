package com.codeheadsystems.keyward.backup;

import com.codeheadsystems.keyward.armor.ArmorCodec;
import com.codeheadsystems.keyward.config.KeywardConfig;
import com.codeheadsystems.keyward.crypto.CryptoOperationException;
import com.codeheadsystems.keyward.crypto.PassphraseKeyWrap;
import com.codeheadsystems.keyward.crypto.Primitives;
import com.codeheadsystems.keyward.crypto.SealedToken;
import com.codeheadsystems.keyward.crypto.common.ByteUtils;
import com.codeheadsystems.keyward.keys.KeyStoreManager;
import com.codeheadsystems.keyward.model.KeySummary;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Password-protected export and restore of every key in the rings.
 * <p>
 * Backup format: {@code base64(salt(16) || token)} where {@code token} is a {@link SealedToken}
 * over the {@link BackupDocument} JSON, keyed by PBKDF2-SHA256(backupPassword, salt).
 */
@Singleton
public class KeyBackupManager {

  private static final Logger log = LoggerFactory.getLogger(KeyBackupManager.class);
  private static final int SALT_SIZE = PassphraseKeyWrap.SALT_SIZE;

  private final KeyStoreManager keyStore;
  private final KeywardConfig config;
  private final ObjectMapper mapper;

  @Inject
  public KeyBackupManager(final KeyStoreManager keyStore, final KeywardConfig config, final ObjectMapper mapper) {
    log.info("KeyBackupManager()");
    this.keyStore = keyStore;
    this.config = config;
    this.mapper = mapper;
  }

  /**
   * Exports all public keys, and all private keys that unlock with {@code keyPassphrase}, into a
   * sealed backup.
   */
  public BackupResult createBackup(final String backupPassword, final String keyPassphrase) {
    if (backupPassword == null || backupPassword.isEmpty()) {
      throw new IllegalArgumentException("Backup password must not be empty");
    }
    List<BackupDocument.Entry> publicEntries = new ArrayList<>();
    for (KeySummary summary : keyStore.listKeys(false)) {
      String armored = ArmorCodec.encode(keyStore.exportPublicKey(summary.fingerprint()));
      publicEntries.add(new BackupDocument.Entry(summary.fingerprint(), armored, summary));
    }
    List<BackupDocument.Entry> privateEntries = new ArrayList<>();
    int skipped = 0;
    for (KeySummary summary : keyStore.listKeys(true)) {
      try {
        String armored = ArmorCodec.encode(keyStore.exportPrivateKey(summary.fingerprint(), keyPassphrase));
        privateEntries.add(new BackupDocument.Entry(summary.fingerprint(), armored, summary));
      } catch (KeywardException e) {
        skipped++;
        log.warn("Private key {} left out of backup: {}", summary.keyId(), e.getMessage());
      }
    }
    BackupDocument document = new BackupDocument(BackupDocument.CURRENT_VERSION,
        Instant.now().getEpochSecond(), publicEntries, privateEntries);

    byte[] salt = config.randomProvider().randomBytes(SALT_SIZE);
    byte[] key = deriveKey(backupPassword, salt);
    try {
      String token = SealedToken.seal(key, mapper.writeValueAsBytes(document), config.randomProvider());
      String blob = Base64.getEncoder().encodeToString(
          ByteUtils.concat(salt, token.getBytes(StandardCharsets.US_ASCII)));
      log.info("Backup created with {} public and {} private key(s)", publicEntries.size(), privateEntries.size());
      return new BackupResult(blob, publicEntries.size(), privateEntries.size(), skipped);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize backup", e);
    } finally {
      ByteUtils.wipe(key);
    }
  }

  public RestoreResult restoreBackup(final String encryptedBackup, final String backupPassword) {
    return restoreBackup(encryptedBackup, backupPassword, null);
  }

  /**
   * Imports every key in a backup. Restored private keys are wrapped under {@code keyPassphrase}
   * when one is given.
   *
   * @throws KeywardException {@link ErrorKind#INVALID_BACKUP} for a malformed blob,
   *                          {@link ErrorKind#DECRYPTION_FAILURE} for a wrong password
   */
  public RestoreResult restoreBackup(final String encryptedBackup, final String backupPassword,
                                     final String keyPassphrase) {
    BackupDocument document = open(encryptedBackup, backupPassword);
    int importedPublic = 0;
    int importedPrivate = 0;
    int failed = 0;
    for (BackupDocument.Entry entry : document.publicKeys()) {
      if (restoreEntry(entry, null)) {
        importedPublic++;
      } else {
        failed++;
      }
    }
    for (BackupDocument.Entry entry : document.privateKeys()) {
      if (restoreEntry(entry, keyPassphrase)) {
        importedPrivate++;
      } else {
        failed++;
      }
    }
    log.info("Restored {} public and {} private key(s), {} failure(s)", importedPublic, importedPrivate, failed);
    return new RestoreResult(importedPublic, importedPrivate, failed);
  }

  private boolean restoreEntry(final BackupDocument.Entry entry, final String keyPassphrase) {
    try {
      keyStore.importKey(entry.keyData(), keyPassphrase, entry.metadata());
      return true;
    } catch (KeywardException e) {
      log.warn("Backup entry {} not restored: {}", entry.fingerprint(), e.getMessage());
      return false;
    }
  }

  private BackupDocument open(final String encryptedBackup, final String backupPassword) {
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(encryptedBackup == null ? "" : encryptedBackup.trim());
    } catch (IllegalArgumentException e) {
      throw new KeywardException(ErrorKind.INVALID_BACKUP, "Backup is not valid base64", e);
    }
    if (raw.length <= SALT_SIZE) {
      throw new KeywardException(ErrorKind.INVALID_BACKUP, "Backup is too short");
    }
    byte[] salt = ByteUtils.slice(raw, 0, SALT_SIZE);
    String token = new String(ByteUtils.slice(raw, SALT_SIZE, raw.length - SALT_SIZE), StandardCharsets.US_ASCII);
    if (!SealedToken.isWellFormed(token)) {
      throw new KeywardException(ErrorKind.INVALID_BACKUP, "Backup content is malformed");
    }
    byte[] key = deriveKey(backupPassword == null ? "" : backupPassword, salt);
    byte[] json;
    try {
      json = SealedToken.open(key, token);
    } catch (CryptoOperationException e) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, "Backup password is incorrect", e);
    } finally {
      ByteUtils.wipe(key);
    }
    try {
      return mapper.readValue(json, BackupDocument.class);
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.INVALID_BACKUP, "Backup content cannot be decoded", e);
    }
  }

  private byte[] deriveKey(final String password, final byte[] salt) {
    return Primitives.pbkdf2Sha256(password, salt, config.keyWrapKdfIterations(), SealedToken.KEY_SIZE);
  }
}
