package com.codeheadsystems.keyward.keys;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keyward.armor.ArmorCodec;
import com.codeheadsystems.keyward.config.KeywardConfig;
import com.codeheadsystems.keyward.crypto.Fingerprints;
import com.codeheadsystems.keyward.crypto.Pem;
import com.codeheadsystems.keyward.model.ArmorBlock;
import com.codeheadsystems.keyward.model.ArmorType;
import com.codeheadsystems.keyward.model.KeySummary;
import com.codeheadsystems.keyward.model.PrivateKeyFormat;
import com.codeheadsystems.keyward.model.PrivateKeyRecord;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import com.codeheadsystems.keyward.storage.EncryptedFileStore;
import com.codeheadsystems.keyward.storage.RecordStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KeyStoreManagerTest {

  private static final String MASTER = "master";

  @TempDir
  Path dir;

  private EncryptedFileStore store;
  private KeyStoreManager manager;

  @BeforeEach
  void setUp() {
    open(dir.resolve("main"));
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  private void open(Path root) {
    KeywardConfig config = KeywardConfig.forTesting(root);
    store = new EncryptedFileStore(config.storageOptions(), new ObjectMapper());
    store.openSession(MASTER);
    manager = new KeyStoreManager(store, config);
    manager.load();
  }

  private void reopen(Path root) {
    store.close();
    open(root);
  }

  private static ErrorKind kindOf(Throwable t) {
    return ((KeywardException) t).kind();
  }

  @Test
  void generateKey_withoutSession_failsNotInitialized() {
    store.close();
    assertThatThrownBy(() -> manager.generateKey("Alice", "a@x.com", "pw1"))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.ENCRYPTION_NOT_INITIALIZED);
  }

  @Test
  void generateKey_storesBothHalves() {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");

    assertThat(result.fingerprint()).matches("([0-9A-F]{4} ){9}[0-9A-F]{4}");
    assertThat(result.fingerprint().replace(" ", "")).endsWith(result.keyId());

    List<KeySummary> publicKeys = manager.listKeys(false);
    assertThat(publicKeys).singleElement().satisfies(k -> {
      assertThat(k.uids()).containsExactly("Alice <a@x.com>");
      assertThat(k.trust()).isEqualTo("ultimate");
      assertThat(k.length()).isEqualTo("1024");
      assertThat(k.algo()).isEqualTo("RSA");
      assertThat(k.expires()).isEmpty();
    });
    assertThat(manager.privateKeys()).singleElement()
        .extracting(PrivateKeyRecord::privateKeyFormat).isEqualTo(PrivateKeyFormat.WRAPPED);
  }

  @Test
  void fingerprint_isComputedOverStoredPublicPem() {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");
    String pem = manager.publicKey(result.fingerprint()).orElseThrow().publicKey();
    assertThat(Fingerprints.fingerprint(pem)).isEqualTo(result.fingerprint());
  }

  @Test
  void rings_persistAcrossReopen_inInsertionOrder() {
    String carol = manager.generateKey("Carol", "c@x.com", "pw").fingerprint();
    String alice = manager.generateKey("Alice", "a@x.com", "pw").fingerprint();

    reopen(dir.resolve("main"));

    assertThat(manager.listKeys(false)).extracting(KeySummary::fingerprint).containsExactly(carol, alice);
    assertThat(manager.listKeys(true)).extracting(KeySummary::fingerprint).containsExactly(carol, alice);
  }

  @Test
  void exportPublicKey_armorsBase64Pem() {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");

    ArmorBlock block = manager.exportPublicKey(result.fingerprint());

    assertThat(block.label()).isEqualTo("PUBLIC KEY BLOCK");
    String pem = new String(Base64.getDecoder().decode(block.payload()), StandardCharsets.UTF_8);
    assertThat(pem).isEqualTo(manager.publicKey(result.fingerprint()).orElseThrow().publicKey());
  }

  @Test
  void export_unknownFingerprint_isKeyNotFound() {
    assertThatThrownBy(() -> manager.exportPublicKey("0000"))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.KEY_NOT_FOUND);
    assertThatThrownBy(() -> manager.exportPrivateKey("0000", "pw"))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.KEY_NOT_FOUND);
  }

  @Test
  void exportPrivateKey_wrongPassphrase_failsAndLeavesStoredKeyIntact() {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");
    String before = manager.privateKeys().get(0).privateKey();

    assertThatThrownBy(() -> manager.exportPrivateKey(result.fingerprint(), "wrong"))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.DECRYPTION_FAILURE);

    assertThat(manager.privateKeys().get(0).privateKey()).isEqualTo(before);
    assertThat(manager.exportPrivateKey(result.fingerprint(), "pw1").label()).isEqualTo("PRIVATE KEY BLOCK");
  }

  @Test
  void importPrivateKey_withoutPassphrase_keepsFingerprint_andStoresEncodedPem() {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");
    String armored = ArmorCodec.encode(manager.exportPrivateKey(result.fingerprint(), "pw1"));

    reopen(dir.resolve("other"));
    String imported = manager.importKey(armored);

    assertThat(imported).isEqualTo(result.fingerprint());
    KeySummary summary = manager.listKeys(false).get(0);
    assertThat(summary.uids()).containsExactly(KeyStoreManager.IMPORTED_UID);
    assertThat(summary.trust()).isEqualTo("unknown");
    assertThat(summary.length()).isEqualTo("1024");
    PrivateKeyRecord record = manager.privateKeys().get(0);
    assertThat(record.privateKeyFormat()).isEqualTo(PrivateKeyFormat.ENCODED_PEM);
    assertThat(manager.unlockPrivateKey(record, "anything")).isNotNull();
  }

  @Test
  void importPrivateKey_withPassphrase_wrapsIt() {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");
    String armored = ArmorCodec.encode(manager.exportPrivateKey(result.fingerprint(), "pw1"));

    reopen(dir.resolve("other"));
    manager.importKey(armored, "fresh");

    PrivateKeyRecord record = manager.privateKeys().get(0);
    assertThat(record.privateKeyFormat()).isEqualTo(PrivateKeyFormat.WRAPPED);
    assertThatThrownBy(() -> manager.unlockPrivateKey(record, "pw1"))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.DECRYPTION_FAILURE);
    assertThat(manager.unlockPrivateKey(record, "fresh")).isNotNull();
  }

  @Test
  void importPublicKey_addsOnlyPublicRecord() {
    KeyGenerationResult result = manager.generateKey("Bob", "b@x.com", "pw");
    String armored = ArmorCodec.encode(manager.exportPublicKey(result.fingerprint()));

    reopen(dir.resolve("other"));

    assertThat(manager.importKey(armored)).isEqualTo(result.fingerprint());
    assertThat(manager.listKeys(false)).hasSize(1);
    assertThat(manager.listKeys(true)).isEmpty();
  }

  @Test
  void importKey_sameFingerprintTwice_replacesRecord() {
    KeyGenerationResult result = manager.generateKey("Bob", "b@x.com", "pw");
    String armored = ArmorCodec.encode(manager.exportPublicKey(result.fingerprint()));

    manager.importKey(armored);

    assertThat(manager.listKeys(false)).singleElement()
        .extracting(KeySummary::trust).isEqualTo("unknown");
  }

  @Test
  void importKey_invalidKeyData_isCorrupt() {
    String notAKey = ArmorCodec.encode(ArmorBlock.of(ArmorType.PUBLIC_KEY_BLOCK,
        Base64.getEncoder().encodeToString("hello".getBytes(StandardCharsets.UTF_8))));

    assertThatThrownBy(() -> manager.importKey(notAKey))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.CORRUPT_KEY_DATA);
    assertThatThrownBy(() -> manager.importKey("no armor here"))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.INVALID_ARMOR_FORMAT);
    assertThat(manager.listKeys(false)).isEmpty();
  }

  @Test
  void importKey_nonRsaKeys_areCorrupt() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(256);
    KeyPair ecPair = generator.generateKeyPair();
    String publicBlock = ArmorCodec.encode(ArmorBlock.of(ArmorType.PUBLIC_KEY_BLOCK,
        Base64.getEncoder().encodeToString(Pem.encodePublicKey(ecPair.getPublic()).getBytes(StandardCharsets.UTF_8))));
    String privateBlock = ArmorCodec.encode(ArmorBlock.of(ArmorType.PRIVATE_KEY_BLOCK,
        Base64.getEncoder().encodeToString(Pem.encodePrivateKey(ecPair.getPrivate()).getBytes(StandardCharsets.UTF_8))));

    assertThatThrownBy(() -> manager.importKey(publicBlock))
        .isInstanceOf(KeywardException.class)
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.CORRUPT_KEY_DATA);
    assertThatThrownBy(() -> manager.importKey(privateBlock, "pw"))
        .isInstanceOf(KeywardException.class)
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.CORRUPT_KEY_DATA);
    assertThat(manager.listKeys(false)).isEmpty();
    assertThat(manager.listKeys(true)).isEmpty();
  }

  @Test
  void deleteKey_removesOneRingEntry() {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");

    manager.deleteKey(result.fingerprint(), true);

    assertThat(manager.listKeys(true)).isEmpty();
    assertThat(manager.listKeys(false)).hasSize(1);
    assertThatThrownBy(() -> manager.deleteKey(result.fingerprint(), true))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.KEY_NOT_FOUND);

    reopen(dir.resolve("main"));
    assertThat(manager.listKeys(true)).isEmpty();
  }

  @Test
  void load_classifiesLegacyUntaggedPrivateKeys() throws Exception {
    KeyGenerationResult result = manager.generateKey("Alice", "a@x.com", "pw1");
    String pem = Pem.encodePrivateKey(manager.unlockPrivateKey(manager.privateKeys().get(0), "pw1"));
    store.close();

    Path legacyRoot = dir.resolve("legacy");
    Files.createDirectories(legacyRoot);
    String encoded = Base64.getEncoder().encodeToString(pem.getBytes(StandardCharsets.UTF_8));
    Files.writeString(legacyRoot.resolve(KeyStoreManager.PRIVATE_KEYS_FILE),
        "{\"" + result.fingerprint() + "\":{\"fingerprint\":\"" + result.fingerprint() + "\",\"keyid\":\""
            + result.keyId() + "\",\"uids\":[\"Imported Key\"],\"length\":\"2048\",\"algo\":\"RSA\","
            + "\"created\":1,\"expires\":\"\",\"trust\":\"unknown\",\"private_key\":\"" + encoded + "\"}}");

    open(legacyRoot);

    PrivateKeyRecord record = manager.privateKeys().get(0);
    assertThat(record.privateKeyFormat()).isEqualTo(PrivateKeyFormat.ENCODED_PEM);
    assertThat(store.isEncrypted(KeyStoreManager.PRIVATE_KEYS_FILE)).isTrue();
    assertThat(manager.unlockPrivateKey(record, "")).isNotNull();
  }

  @Test
  void wipe_clearsAndPersistsEmptyRings() {
    manager.generateKey("Alice", "a@x.com", "pw1");

    manager.wipe();
    reopen(dir.resolve("main"));

    assertThat(manager.listKeys(false)).isEmpty();
    assertThat(manager.listKeys(true)).isEmpty();
  }

  @Test
  void generateKey_persistFailure_leavesRingUnchanged() {
    RecordStore failing = mock(RecordStore.class);
    when(failing.isOpen()).thenReturn(true);
    doThrow(new KeywardException(ErrorKind.STORAGE_FAILURE, "disk full")).when(failing).save(anyString(), any());
    KeyStoreManager broken = new KeyStoreManager(failing, KeywardConfig.forTesting(dir.resolve("mock")));

    assertThatThrownBy(() -> broken.generateKey("Alice", "a@x.com", "pw1"))
        .extracting(KeyStoreManagerTest::kindOf).isEqualTo(ErrorKind.STORAGE_FAILURE);

    assertThat(broken.listKeys(false)).isEmpty();
    assertThat(broken.listKeys(true)).isEmpty();
  }
}
