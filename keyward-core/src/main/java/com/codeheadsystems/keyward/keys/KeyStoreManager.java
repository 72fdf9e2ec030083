package com.codeheadsystems.keyward.keys;

import com.codeheadsystems.keyward.armor.ArmorCodec;
import com.codeheadsystems.keyward.config.KeywardConfig;
import com.codeheadsystems.keyward.crypto.CryptoOperationException;
import com.codeheadsystems.keyward.crypto.Fingerprints;
import com.codeheadsystems.keyward.crypto.PassphraseKeyWrap;
import com.codeheadsystems.keyward.crypto.Pem;
import com.codeheadsystems.keyward.crypto.Primitives;
import com.codeheadsystems.keyward.model.ArmorBlock;
import com.codeheadsystems.keyward.model.ArmorType;
import com.codeheadsystems.keyward.model.KeyRing;
import com.codeheadsystems.keyward.model.KeySummary;
import com.codeheadsystems.keyward.model.PrivateKeyFormat;
import com.codeheadsystems.keyward.model.PrivateKeyRecord;
import com.codeheadsystems.keyward.model.PublicKeyRecord;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import com.codeheadsystems.keyward.storage.RecordStore;
import com.fasterxml.jackson.core.type.TypeReference;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the key rings: generation, listing, export, import and deletion of RSA keys.
 * <p>
 * Every mutation runs under one lock and is persisted to {@value #PUBLIC_KEYS_FILE} and
 * {@value #PRIVATE_KEYS_FILE} before the lock is released. If persisting fails the in-memory rings
 * are restored to their previous contents.
 */
@Singleton
public class KeyStoreManager {

  public static final String PUBLIC_KEYS_FILE = "public_keys.json";
  public static final String PRIVATE_KEYS_FILE = "private_keys.json";
  public static final String IMPORTED_UID = "Imported Key";

  private static final Logger log = LoggerFactory.getLogger(KeyStoreManager.class);
  private static final TypeReference<LinkedHashMap<String, PublicKeyRecord>> PUBLIC_RING =
      new TypeReference<>() {
      };
  private static final TypeReference<LinkedHashMap<String, PrivateKeyRecord>> PRIVATE_RING =
      new TypeReference<>() {
      };

  private final RecordStore store;
  private final KeywardConfig config;
  private final PassphraseKeyWrap keyWrap;
  private final ReentrantLock lock = new ReentrantLock();
  private KeyRing ring = new KeyRing();

  @Inject
  public KeyStoreManager(final RecordStore store, final KeywardConfig config) {
    log.info("KeyStoreManager({})", store.root());
    this.store = store;
    this.config = config;
    this.keyWrap = new PassphraseKeyWrap(config.keyWrapKdfIterations(), config.randomProvider());
  }

  // ─── Lifecycle ─────────────────────────────────────────────────────────────

  /**
   * Loads both rings from the store. Untagged private keys are classified here, and the rings are
   * written back when any tag was added.
   */
  public void load() {
    withLock(() -> {
      Map<String, PublicKeyRecord> publicKeys = store.load(PUBLIC_KEYS_FILE, PUBLIC_RING, new LinkedHashMap<>());
      Map<String, PrivateKeyRecord> privateKeys = store.load(PRIVATE_KEYS_FILE, PRIVATE_RING, new LinkedHashMap<>());
      boolean classified = false;
      for (Map.Entry<String, PrivateKeyRecord> entry : privateKeys.entrySet()) {
        PrivateKeyRecord record = entry.getValue();
        if (record.privateKeyFormat() == null) {
          try {
            entry.setValue(record.withFormat(PrivateKeyFormatClassifier.classify(record.privateKey())));
            classified = true;
          } catch (KeywardException e) {
            log.warn("Private key {} has unusable key data: {}", entry.getKey(), e.getMessage());
          }
        }
      }
      ring = new KeyRing(publicKeys, privateKeys);
      if (classified) {
        persist();
      }
      log.info("Loaded {} public and {} private key(s)", publicKeys.size(), privateKeys.size());
      return null;
    });
  }

  /**
   * Drops the in-memory rings without touching storage.
   */
  public void unload() {
    withLock(() -> {
      ring = new KeyRing();
      return null;
    });
  }

  /**
   * Clears both rings and persists the empty rings.
   */
  public void wipe() {
    mutate(() -> {
      ring.clear();
      return null;
    });
    log.warn("Key rings wiped");
  }

  // ─── Generation and listing ────────────────────────────────────────────────

  public KeyGenerationResult generateKey(final String name, final String email, final String passphrase) {
    return generateKey(name, email, passphrase, config.defaultKeyBits());
  }

  /**
   * Generates an RSA key pair, wraps the private key under {@code passphrase} and stores both halves.
   *
   * @throws KeywardException with {@link ErrorKind#ENCRYPTION_NOT_INITIALIZED} when no session is open
   */
  public KeyGenerationResult generateKey(final String name, final String email, final String passphrase,
                                         final int bits) {
    log.debug("generateKey({} bits)", bits);
    if (passphrase == null) {
      throw new IllegalArgumentException("Passphrase must not be null");
    }
    if (!store.isOpen()) {
      throw KeywardException.notInitialized();
    }
    Primitives.RsaKeyPairPem pair = Primitives.generateRsaKeyPair(bits, config.randomProvider());
    String fingerprint = Fingerprints.fingerprint(pair.publicPem());
    String keyId = Fingerprints.keyId(fingerprint);
    long created = Instant.now().getEpochSecond();
    List<String> uids = List.of(name + " <" + email + ">");
    String length = Integer.toString(bits);

    PublicKeyRecord publicRecord = new PublicKeyRecord(fingerprint, keyId, uids, length,
        PublicKeyRecord.ALGO_RSA, created, "", PublicKeyRecord.TRUST_ULTIMATE, pair.publicPem());
    PrivateKeyRecord privateRecord = new PrivateKeyRecord(fingerprint, keyId, uids, length,
        PublicKeyRecord.ALGO_RSA, created, "", PublicKeyRecord.TRUST_ULTIMATE,
        keyWrap.wrap(pair.privatePem(), passphrase), PrivateKeyFormat.WRAPPED);
    mutate(() -> {
      putBoth(publicRecord, Optional.of(privateRecord));
      return null;
    });
    log.info("Generated key {}", keyId);
    return new KeyGenerationResult(fingerprint, keyId);
  }

  /**
   * Snapshot of one ring in insertion order.
   *
   * @param secret true for the private ring
   */
  public List<KeySummary> listKeys(final boolean secret) {
    return withLock(() -> ring.summaries(secret));
  }

  public Optional<PublicKeyRecord> publicKey(final String fingerprint) {
    return withLock(() -> ring.publicKey(fingerprint));
  }

  public List<PrivateKeyRecord> privateKeys() {
    return withLock(() -> ring.privateKeys());
  }

  // ─── Export ────────────────────────────────────────────────────────────────

  public ArmorBlock exportPublicKey(final String fingerprint) {
    PublicKeyRecord record = publicKey(fingerprint)
        .orElseThrow(() -> KeywardException.keyNotFound(fingerprint));
    return ArmorBlock.of(ArmorType.PUBLIC_KEY_BLOCK, encode(record.publicKey()));
  }

  /**
   * Exports the unwrapped private key. The stored payload is left as it is.
   *
   * @throws KeywardException with {@link ErrorKind#DECRYPTION_FAILURE} on a wrong passphrase
   */
  public ArmorBlock exportPrivateKey(final String fingerprint, final String passphrase) {
    PrivateKeyRecord record = withLock(() -> ring.privateKey(fingerprint))
        .orElseThrow(() -> KeywardException.keyNotFound(fingerprint));
    String pem = Pem.encodePrivateKey(unlockPrivateKey(record, passphrase));
    return ArmorBlock.of(ArmorType.PRIVATE_KEY_BLOCK, encode(pem));
  }

  // ─── Import ────────────────────────────────────────────────────────────────

  public String importKey(final String armored) {
    return importKey(armored, null, null);
  }

  public String importKey(final String armored, final String passphrase) {
    return importKey(armored, passphrase, null);
  }

  /**
   * Imports an armored public or private key.
   * <p>
   * A private key is wrapped under {@code passphrase} when one is given and otherwise kept as
   * base64 PEM with no protection beyond the at-rest layer. When {@code metadata} is given its uids,
   * trust and creation time replace the import defaults.
   *
   * @param armored    armored key block
   * @param passphrase optional passphrase for an imported private key
   * @param metadata   optional metadata, as carried in backups
   * @return the fingerprint
   * @throws KeywardException with {@link ErrorKind#CORRUPT_KEY_DATA} when the block holds no valid key
   */
  public String importKey(final String armored, final String passphrase, final KeySummary metadata) {
    ArmorBlock block = ArmorCodec.decode(armored);
    String pem = decodePem(block.payload());
    boolean isPrivate = block.isPrivateKey();
    String publicPem;
    int bits;
    try {
      if (isPrivate) {
        publicPem = Pem.publicPemFor(Pem.parsePrivateKey(pem));
      } else {
        publicPem = pem;
      }
      // Only RSA keys have a modulus; anything else is rejected here.
      bits = Pem.keyLength(Pem.parsePublicKey(publicPem));
    } catch (CryptoOperationException e) {
      throw new KeywardException(ErrorKind.CORRUPT_KEY_DATA, "Invalid key data: " + e.getMessage(), e);
    }

    String fingerprint = Fingerprints.fingerprint(publicPem);
    String keyId = Fingerprints.keyId(fingerprint);
    String length = Integer.toString(bits);
    List<String> uids = metadata != null && !metadata.uids().isEmpty() ? metadata.uids() : List.of(IMPORTED_UID);
    long created = metadata != null && metadata.created() > 0 ? metadata.created() : Instant.now().getEpochSecond();
    String trust = metadata != null && metadata.trust() != null ? metadata.trust() : PublicKeyRecord.TRUST_UNKNOWN;

    PublicKeyRecord publicRecord = new PublicKeyRecord(fingerprint, keyId, uids, length,
        PublicKeyRecord.ALGO_RSA, created, "", trust, publicPem);
    Optional<PrivateKeyRecord> privateRecord = Optional.empty();
    if (isPrivate) {
      boolean wrap = passphrase != null && !passphrase.isEmpty();
      String payload = wrap ? keyWrap.wrap(pem, passphrase) : encode(pem);
      PrivateKeyFormat format = wrap ? PrivateKeyFormat.WRAPPED : PrivateKeyFormat.ENCODED_PEM;
      if (!wrap) {
        log.warn("Private key {} imported without a passphrase", keyId);
      }
      privateRecord = Optional.of(new PrivateKeyRecord(fingerprint, keyId, uids, length,
          PublicKeyRecord.ALGO_RSA, created, "", trust, payload, format));
    }
    Optional<PrivateKeyRecord> toStore = privateRecord;
    mutate(() -> {
      putBoth(publicRecord, toStore);
      return null;
    });
    log.info("Imported {} key {}", isPrivate ? "private" : "public", keyId);
    return fingerprint;
  }

  // ─── Deletion ──────────────────────────────────────────────────────────────

  /**
   * Removes one ring entry.
   *
   * @param secret true to remove from the private ring
   * @throws KeywardException with {@link ErrorKind#KEY_NOT_FOUND} when absent
   */
  public void deleteKey(final String fingerprint, final boolean secret) {
    mutate(() -> {
      Optional<?> removed = secret ? ring.removePrivate(fingerprint) : ring.removePublic(fingerprint);
      if (removed.isEmpty()) {
        throw KeywardException.keyNotFound(fingerprint);
      }
      return null;
    });
    log.debug("deleteKey({}, secret={})", fingerprint, secret);
  }

  // ─── Unlock ────────────────────────────────────────────────────────────────

  /**
   * Recovers the private key from a stored record.
   *
   * @throws KeywardException with {@link ErrorKind#DECRYPTION_FAILURE} when a wrapped payload does not
   *                          open under {@code passphrase}, or {@link ErrorKind#CORRUPT_KEY_DATA} when
   *                          the payload cannot be read
   */
  public PrivateKey unlockPrivateKey(final PrivateKeyRecord record, final String passphrase) {
    PrivateKeyFormat format = record.privateKeyFormat() != null
        ? record.privateKeyFormat()
        : PrivateKeyFormatClassifier.classify(record.privateKey());
    String pem = switch (format) {
      case WRAPPED -> {
        try {
          yield keyWrap.unwrap(record.privateKey(), passphrase);
        } catch (CryptoOperationException e) {
          throw new KeywardException(ErrorKind.DECRYPTION_FAILURE,
              "Failed to decrypt private key: wrong passphrase or damaged key", e);
        }
      }
      case PLAIN_PEM -> record.privateKey();
      case ENCODED_PEM -> decodePem(record.privateKey());
    };
    try {
      return Pem.parsePrivateKey(pem);
    } catch (CryptoOperationException e) {
      throw new KeywardException(ErrorKind.CORRUPT_KEY_DATA, "Stored private key is not valid PEM", e);
    }
  }

  // ─── Internals ─────────────────────────────────────────────────────────────

  private void putBoth(final PublicKeyRecord publicRecord, final Optional<PrivateKeyRecord> privateRecord) {
    ring.putPublic(publicRecord).ifPresent(previous ->
        log.warn("Fingerprint {} already present; replacing the public key record", publicRecord.fingerprint()));
    privateRecord.ifPresent(record -> ring.putPrivate(record).ifPresent(previous ->
        log.warn("Fingerprint {} already present; replacing the private key record", record.fingerprint())));
  }

  private <T> T withLock(final Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private <T> T mutate(final Supplier<T> action) {
    return withLock(() -> {
      KeyRing before = new KeyRing(ring.publicKeyMap(), ring.privateKeyMap());
      try {
        T result = action.get();
        persist();
        return result;
      } catch (RuntimeException e) {
        ring = before;
        throw e;
      }
    });
  }

  private void persist() {
    store.save(PUBLIC_KEYS_FILE, ring.publicKeyMap());
    store.save(PRIVATE_KEYS_FILE, ring.privateKeyMap());
  }

  private static String encode(final String pem) {
    return Base64.getEncoder().encodeToString(pem.getBytes(StandardCharsets.UTF_8));
  }

  private static String decodePem(final String base64) {
    try {
      return new String(Base64.getDecoder().decode(base64.trim()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new KeywardException(ErrorKind.CORRUPT_KEY_DATA, "Key data is not valid base64", e);
    }
  }
}
