package com.codeheadsystems.keyward;

import com.codeheadsystems.keyward.armor.ArmorCodec;
import com.codeheadsystems.keyward.backup.BackupResult;
import com.codeheadsystems.keyward.backup.KeyBackupManager;
import com.codeheadsystems.keyward.backup.RestoreResult;
import com.codeheadsystems.keyward.config.KeywardConfig;
import com.codeheadsystems.keyward.envelope.EnvelopeManager;
import com.codeheadsystems.keyward.keys.KeyGenerationResult;
import com.codeheadsystems.keyward.keys.KeyStoreManager;
import com.codeheadsystems.keyward.model.KeySummary;
import com.codeheadsystems.keyward.model.OperationResult;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import com.codeheadsystems.keyward.storage.EncryptedFileStore;
import com.codeheadsystems.keyward.storage.MigrationReport;
import com.codeheadsystems.keyward.storage.RecordStore;
import com.codeheadsystems.keyward.storage.RotationReport;
import com.codeheadsystems.keyward.storage.WipeReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Every operation returns an {@link OperationResult}; expected failures are reported
 * through {@link OperationResult#errorKind()} and never thrown.
 * <p>
 * Call {@link #unlock(String)} before anything else; until then operations fail with
 * {@link ErrorKind#ENCRYPTION_NOT_INITIALIZED}.
 */
@Singleton
public class Keyward implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Keyward.class);

  private final RecordStore store;
  private final KeyStoreManager keyStore;
  private final EnvelopeManager envelopes;
  private final KeyBackupManager backups;

  @Inject
  public Keyward(final RecordStore store,
                 final KeyStoreManager keyStore,
                 final EnvelopeManager envelopes,
                 final KeyBackupManager backups) {
    log.info("Keyward({})", store.root());
    this.store = store;
    this.keyStore = keyStore;
    this.envelopes = envelopes;
    this.backups = backups;
  }

  /**
   * Wires a complete instance over the configured data directory.
   */
  public static Keyward create(final KeywardConfig config) {
    ObjectMapper mapper = new ObjectMapper();
    RecordStore store = new EncryptedFileStore(config.storageOptions(), mapper);
    KeyStoreManager keyStore = new KeyStoreManager(store, config);
    return new Keyward(store,
        keyStore,
        new EnvelopeManager(keyStore, config, mapper),
        new KeyBackupManager(keyStore, config, mapper));
  }

  // ── Session ──────────────────────────────────────────────────────────────

  /**
   * Opens the master session, migrates plaintext files and loads the key rings. A wrong password is
   * rejected by the store before any file is migrated. If the rings still cannot be read the
   * session is closed again.
   */
  public OperationResult<MigrationReport> unlock(final String masterPassword) {
    return run("unlock", () -> {
      MigrationReport report = store.openSession(masterPassword);
      try {
        keyStore.load();
      } catch (RuntimeException e) {
        close();
        throw e;
      }
      return report;
    });
  }

  public OperationResult<RotationReport> changeMasterPassword(final String oldPassword, final String newPassword) {
    return run("changeMasterPassword", () -> store.rotatePassword(oldPassword, newPassword));
  }

  @Override
  public void close() {
    keyStore.unload();
    store.close();
  }

  // ── Keys ─────────────────────────────────────────────────────────────────

  public OperationResult<KeyGenerationResult> generateKey(final String name, final String email,
                                                          final String passphrase) {
    return run("generateKey", () -> keyStore.generateKey(name, email, passphrase));
  }

  public OperationResult<KeyGenerationResult> generateKey(final String name, final String email,
                                                          final String passphrase, final int bits) {
    return run("generateKey", () -> keyStore.generateKey(name, email, passphrase, bits));
  }

  public OperationResult<List<KeySummary>> listKeys(final boolean secret) {
    return run("listKeys", () -> {
      requireSession();
      return keyStore.listKeys(secret);
    });
  }

  public OperationResult<String> exportPublicKey(final String fingerprint) {
    return run("exportPublicKey", () -> {
      requireSession();
      return ArmorCodec.encode(keyStore.exportPublicKey(fingerprint));
    });
  }

  public OperationResult<String> exportPrivateKey(final String fingerprint, final String passphrase) {
    return run("exportPrivateKey", () -> {
      requireSession();
      return ArmorCodec.encode(keyStore.exportPrivateKey(fingerprint, passphrase));
    });
  }

  public OperationResult<String> importKey(final String armored) {
    return run("importKey", () -> keyStore.importKey(armored));
  }

  public OperationResult<String> importKey(final String armored, final String passphrase) {
    return run("importKey", () -> keyStore.importKey(armored, passphrase));
  }

  public OperationResult<Void> deleteKey(final String fingerprint, final boolean secret) {
    return run("deleteKey", () -> {
      keyStore.deleteKey(fingerprint, secret);
      return null;
    });
  }

  // ── Messages ─────────────────────────────────────────────────────────────

  public OperationResult<String> encryptMessage(final String plaintext, final List<String> recipients) {
    return run("encryptMessage", () -> {
      requireSession();
      return envelopes.encryptMessage(plaintext, recipients);
    });
  }

  public OperationResult<String> decryptMessage(final String armored, final String passphrase) {
    return run("decryptMessage", () -> {
      requireSession();
      return envelopes.decryptMessage(armored, passphrase);
    });
  }

  // ── Backup and wipe ──────────────────────────────────────────────────────

  public OperationResult<BackupResult> createBackup(final String backupPassword, final String keyPassphrase) {
    return run("createBackup", () -> {
      requireSession();
      return backups.createBackup(backupPassword, keyPassphrase);
    });
  }

  public OperationResult<RestoreResult> restoreBackup(final String encryptedBackup, final String backupPassword) {
    return restoreBackup(encryptedBackup, backupPassword, null);
  }

  public OperationResult<RestoreResult> restoreBackup(final String encryptedBackup, final String backupPassword,
                                                      final String keyPassphrase) {
    return run("restoreBackup", () -> {
      requireSession();
      return backups.restoreBackup(encryptedBackup, backupPassword, keyPassphrase);
    });
  }

  /**
   * Clears the rings, securely deletes every file in the data directory and closes the session.
   */
  public OperationResult<WipeReport> emergencyDeleteAll() {
    return run("emergencyDeleteAll", () -> {
      keyStore.wipe();
      WipeReport report = store.secureDeleteAll();
      close();
      return report;
    });
  }

  // ── Internals ────────────────────────────────────────────────────────────

  private void requireSession() {
    if (!store.isOpen()) {
      throw KeywardException.notInitialized();
    }
  }

  private <T> OperationResult<T> run(final String operation, final Supplier<T> action) {
    try {
      return OperationResult.ok(action.get());
    } catch (KeywardException e) {
      log.debug("{}() failed: {} {}", operation, e.kind(), e.getMessage());
      return OperationResult.failure(e);
    } catch (IllegalArgumentException e) {
      log.debug("{}() rejected: {}", operation, e.getMessage());
      return OperationResult.failure(ErrorKind.INVALID_ARGUMENT, e.getMessage());
    } catch (RuntimeException e) {
      log.error("{}() failed unexpectedly", operation, e);
      return OperationResult.failure(ErrorKind.STORAGE_FAILURE, operation + " failed: " + e.getMessage());
    }
  }
}
