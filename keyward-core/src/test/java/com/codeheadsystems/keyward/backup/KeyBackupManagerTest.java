package com.codeheadsystems.keyward.backup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keyward.config.KeywardConfig;
import com.codeheadsystems.keyward.keys.KeyStoreManager;
import com.codeheadsystems.keyward.model.KeySummary;
import com.codeheadsystems.keyward.model.PrivateKeyFormat;
import com.codeheadsystems.keyward.model.PrivateKeyRecord;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import com.codeheadsystems.keyward.storage.EncryptedFileStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyBackupManagerTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir
  Path dir;

  private EncryptedFileStore store;
  private KeyStoreManager keys;
  private KeyBackupManager backups;

  @BeforeEach
  void setUp() {
    open("source");
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  private void open(final String name) {
    if (store != null) {
      store.close();
    }
    KeywardConfig config = KeywardConfig.forTesting(dir.resolve(name));
    store = new EncryptedFileStore(config.storageOptions(), MAPPER);
    store.openSession("master");
    keys = new KeyStoreManager(store, config);
    keys.load();
    backups = new KeyBackupManager(keys, config, MAPPER);
  }

  private static ErrorKind kindOf(Throwable t) {
    return ((KeywardException) t).kind();
  }

  @Test
  void backup_restoresIntoFreshDirectory_withMetadata() {
    String alice = keys.generateKey("Alice", "a@x.com", "pw").fingerprint();
    KeySummary before = keys.listKeys(false).get(0);

    BackupResult backup = backups.createBackup("backup-pw", "pw");
    assertThat(backup.publicKeys()).isEqualTo(1);
    assertThat(backup.privateKeys()).isEqualTo(1);
    assertThat(backup.skipped()).isZero();

    open("restored");
    RestoreResult restored = backups.restoreBackup(backup.encryptedBackup(), "backup-pw", "new-pw");

    assertThat(restored).isEqualTo(new RestoreResult(1, 1, 0));
    assertThat(keys.listKeys(false)).singleElement().isEqualTo(before);
    PrivateKeyRecord record = keys.privateKeys().get(0);
    assertThat(record.fingerprint()).isEqualTo(alice);
    assertThat(record.privateKeyFormat()).isEqualTo(PrivateKeyFormat.WRAPPED);
    assertThat(keys.unlockPrivateKey(record, "new-pw")).isNotNull();
  }

  @Test
  void createBackup_skipsPrivateKeysThatDoNotUnlock() {
    keys.generateKey("Alice", "a@x.com", "pw");
    keys.generateKey("Bob", "b@x.com", "other");

    BackupResult backup = backups.createBackup("backup-pw", "pw");

    assertThat(backup.publicKeys()).isEqualTo(2);
    assertThat(backup.privateKeys()).isEqualTo(1);
    assertThat(backup.skipped()).isEqualTo(1);
  }

  @Test
  void createBackup_requiresPassword() {
    assertThatThrownBy(() -> backups.createBackup("", "pw"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void restoreBackup_wrongPassword() {
    keys.generateKey("Alice", "a@x.com", "pw");
    String blob = backups.createBackup("backup-pw", "pw").encryptedBackup();

    assertThatThrownBy(() -> backups.restoreBackup(blob, "nope"))
        .hasMessage("Backup password is incorrect")
        .extracting(KeyBackupManagerTest::kindOf).isEqualTo(ErrorKind.DECRYPTION_FAILURE);
  }

  @Test
  void restoreBackup_malformedBlob() {
    String shortBlob = Base64.getEncoder().encodeToString(new byte[8]);
    String notAToken = Base64.getEncoder().encodeToString(new byte[200]);

    for (String blob : new String[]{"%%%", shortBlob, notAToken}) {
      assertThatThrownBy(() -> backups.restoreBackup(blob, "backup-pw"))
          .extracting(KeyBackupManagerTest::kindOf).isEqualTo(ErrorKind.INVALID_BACKUP);
    }
  }
}
