package com.codeheadsystems.keyward.storage;

import com.codeheadsystems.keyward.crypto.CryptoOperationException;
import com.codeheadsystems.keyward.crypto.SealedToken;
import com.codeheadsystems.keyward.crypto.common.ByteUtils;
import com.codeheadsystems.keyward.model.EncryptedFileRecord;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RecordStore} writing one JSON file per record.
 * <p>
 * On disk every file is {@code {"version":..,"encrypted":true,"data":base64(token)}} where the
 * token is a {@link SealedToken} over the record's JSON. Files without {@code "encrypted":true}
 * are legacy plaintext and are read as-is until migrated.
 * <p>
 * File operations and password rotation all hold this instance's monitor, so no record is written
 * under the old key while a rotation is in progress.
 */
@Singleton
public class EncryptedFileStore implements RecordStore {

  private static final Logger log = LoggerFactory.getLogger(EncryptedFileStore.class);

  private static final String ROTATING_SUFFIX = ".rotating";
  private static final int OVERWRITE_CHUNK = 8192;

  private final StorageOptions options;
  private final ObjectMapper mapper;
  private final MasterKeyDeriver deriver;
  private final Path root;

  private volatile MasterKeySession session;
  private DataDirectoryLock directoryLock;

  @Inject
  public EncryptedFileStore(final StorageOptions options, final ObjectMapper mapper) {
    log.info("EncryptedFileStore({})", options.root());
    this.options = options;
    this.mapper = mapper;
    this.root = options.root().toAbsolutePath().normalize();
    this.deriver = new MasterKeyDeriver(root, options.kdfIterations(), options.randomProvider());
  }

  @Override
  public Path root() {
    return root;
  }

  // ─── Session ───────────────────────────────────────────────────────────────

  /**
   * Derives the master key and, when the directory already holds encrypted files, checks that at
   * least one of them opens under it. Plaintext files are migrated only after that check passes.
   *
   * @throws KeywardException with {@link ErrorKind#DECRYPTION_FAILURE} when no stored file opens
   */
  @Override
  public synchronized MigrationReport openSession(final String password) {
    boolean lockedHere = directoryLock == null;
    if (lockedHere) {
      directoryLock = DataDirectoryLock.acquire(root);
    }
    byte[] key = deriver.deriveKey(password);
    try {
      verifyAgainstStoredFiles(key);
      replaceSession(new MasterKeySession(key));
    } catch (RuntimeException e) {
      if (lockedHere) {
        releaseLock();
      }
      throw e;
    } finally {
      ByteUtils.wipe(key);
    }
    log.info("Master session opened for {}", root);
    MigrationReport report = migrateDirectory();
    if (!report.migrated().isEmpty()) {
      log.info("Migrated {} plaintext file(s) to encrypted form", report.migrated().size());
    }
    return report;
  }

  @Override
  public boolean isOpen() {
    MasterKeySession current = session;
    return current != null && !current.isClosed();
  }

  @Override
  public synchronized void close() {
    replaceSession(null);
    releaseLock();
    log.info("Master session closed for {}", root);
  }

  private void releaseLock() {
    if (directoryLock != null) {
      directoryLock.close();
      directoryLock = null;
    }
  }

  private void verifyAgainstStoredFiles(final byte[] key) {
    int encrypted = 0;
    for (Path path : jsonFiles()) {
      String name = relative(path);
      if (!isEncrypted(name)) {
        continue;
      }
      encrypted++;
      try {
        decryptRecord(key, readDocument(path).path("data").asText(null));
        return;
      } catch (KeywardException e) {
        log.debug("Master key does not open {}: {}", name, e.getMessage());
      }
    }
    if (encrypted > 0) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE,
          "Master password is incorrect: none of " + encrypted + " stored file(s) could be decrypted");
    }
  }

  private void replaceSession(final MasterKeySession next) {
    MasterKeySession previous = session;
    session = next;
    if (previous != null) {
      previous.close();
    }
  }

  private byte[] sessionKey() {
    MasterKeySession current = session;
    if (current == null || current.isClosed()) {
      throw KeywardException.notInitialized();
    }
    return current.key();
  }

  // ─── Record encryption ─────────────────────────────────────────────────────

  @Override
  public String encryptRecord(final Object data) {
    return encryptRecord(sessionKey(), data);
  }

  @Override
  public JsonNode decryptRecord(final String data) {
    return decryptRecord(sessionKey(), data);
  }

  String encryptRecord(final byte[] key, final Object data) {
    try {
      byte[] json = mapper.writeValueAsBytes(data);
      String token = SealedToken.seal(key, json, options.randomProvider());
      return Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.US_ASCII));
    } catch (JsonProcessingException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to serialize record", e);
    }
  }

  JsonNode decryptRecord(final byte[] key, final String data) {
    byte[] payload;
    try {
      String token = new String(Base64.getDecoder().decode(data == null ? "" : data.trim()),
          StandardCharsets.US_ASCII);
      payload = SealedToken.open(key, token);
    } catch (CryptoOperationException | IllegalArgumentException e) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, "Failed to decrypt data: " + e.getMessage(), e);
    }
    try {
      return mapper.readTree(payload);
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, "Decrypted data is not valid JSON", e);
    }
  }

  // ─── Files ─────────────────────────────────────────────────────────────────

  @Override
  public synchronized void save(final String filename, final Object data) {
    byte[] key = sessionKey();
    writeEncrypted(resolve(filename), encryptRecord(key, data));
    log.debug("save({})", filename);
  }

  @Override
  public synchronized <T> T load(final String filename, final TypeReference<T> type, final T defaultValue) {
    JsonNode payload = loadPayload(filename);
    if (payload == null) {
      return defaultValue;
    }
    try {
      return mapper.convertValue(payload, type);
    } catch (IllegalArgumentException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Stored data has an unexpected shape: " + filename, e);
    }
  }

  @Override
  public synchronized <T> T load(final String filename, final Class<T> type, final T defaultValue) {
    JsonNode payload = loadPayload(filename);
    if (payload == null) {
      return defaultValue;
    }
    try {
      return mapper.convertValue(payload, type);
    } catch (IllegalArgumentException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Stored data has an unexpected shape: " + filename, e);
    }
  }

  private JsonNode loadPayload(final String filename) {
    byte[] key = sessionKey();
    Path path = resolve(filename);
    if (!Files.exists(path)) {
      log.debug("load({}): absent", filename);
      return null;
    }
    JsonNode document = readDocument(path);
    if (!isEncryptedDocument(document)) {
      log.debug("load({}): plaintext", filename);
      return legacyPayload(document);
    }
    return decryptRecord(key, document.path("data").asText(null));
  }

  @Override
  public synchronized boolean migrate(final String filename) {
    byte[] key = sessionKey();
    Path path = resolve(filename);
    if (!Files.exists(path)) {
      return false;
    }
    JsonNode document = readDocument(path);
    if (isEncryptedDocument(document)) {
      return false;
    }
    writeEncrypted(path, encryptRecord(key, legacyPayload(document)));
    log.debug("migrate({})", filename);
    return true;
  }

  @Override
  public synchronized MigrationReport migrateDirectory() {
    sessionKey();
    List<String> migrated = new ArrayList<>();
    Map<String, String> failed = new LinkedHashMap<>();
    for (Path path : jsonFiles()) {
      String name = relative(path);
      try {
        if (migrate(name)) {
          migrated.add(name);
        }
      } catch (KeywardException e) {
        log.warn("Failed to migrate {}: {}", name, e.getMessage());
        failed.put(name, e.getMessage());
      }
    }
    return new MigrationReport(migrated, failed);
  }

  @Override
  public synchronized boolean secureDelete(final String filename) {
    sessionKey();
    Path path = resolve(filename);
    if (!Files.isRegularFile(path)) {
      return false;
    }
    overwriteAndDelete(path);
    log.debug("secureDelete({})", filename);
    return true;
  }

  @Override
  public synchronized WipeReport secureDeleteAll() {
    sessionKey();
    List<String> deleted = new ArrayList<>();
    Map<String, String> failed = new LinkedHashMap<>();
    for (Path path : regularFiles()) {
      if (path.getFileName().toString().equals(DataDirectoryLock.LOCK_FILE)) {
        continue;
      }
      String name = relative(path);
      try {
        overwriteAndDelete(path);
        deleted.add(name);
      } catch (KeywardException e) {
        log.warn("Failed to securely delete {}: {}", name, e.getMessage());
        failed.put(name, e.getMessage());
      }
    }
    log.info("secureDeleteAll(): deleted {} file(s), {} failure(s)", deleted.size(), failed.size());
    return new WipeReport(deleted, failed);
  }

  @Override
  public boolean isEncrypted(final String filename) {
    Path path = resolve(filename);
    if (!Files.isRegularFile(path)) {
      return false;
    }
    try {
      return isEncryptedDocument(mapper.readTree(path.toFile()));
    } catch (IOException e) {
      log.debug("isEncrypted({}): unreadable as JSON ({})", filename, e.getMessage());
      return false;
    }
  }

  @Override
  public boolean exists(final String filename) {
    return Files.exists(resolve(filename));
  }

  // ─── Password rotation ─────────────────────────────────────────────────────

  @Override
  public synchronized RotationReport rotatePassword(final String oldPassword, final String newPassword) {
    MasterKeySession current = session;
    sessionKey();
    byte[] oldKey = deriver.deriveKey(oldPassword);
    byte[] newKey = null;
    try {
      verifyKey(oldKey);
      if (!current.matches(oldKey)) {
        throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, "Old password is incorrect");
      }

      // Phase 1: decrypt everything before anything is rewritten.
      Map<String, JsonNode> staged = new LinkedHashMap<>();
      Map<String, String> failed = new LinkedHashMap<>();
      List<Path> encryptedFiles = jsonFiles().stream()
          .filter(p -> isEncrypted(relative(p)))
          .collect(Collectors.toList());
      for (Path path : encryptedFiles) {
        String name = relative(path);
        try {
          staged.put(name, decryptRecord(oldKey, readDocument(path).path("data").asText(null)));
        } catch (KeywardException e) {
          log.warn("Rotation cannot read {}: {}", name, e.getMessage());
          failed.put(name, e.getMessage());
        }
      }
      if (!encryptedFiles.isEmpty() && staged.isEmpty()) {
        throw new KeywardException(ErrorKind.DECRYPTION_FAILURE,
            "Old password is incorrect: no stored file could be decrypted");
      }

      // Phase 2: write each file beside the original, then swap it in.
      newKey = deriver.deriveKey(newPassword);
      List<String> rotated = new ArrayList<>();
      for (Map.Entry<String, JsonNode> entry : staged.entrySet()) {
        Path target = resolve(entry.getKey());
        Path staging = target.resolveSibling(target.getFileName() + ROTATING_SUFFIX);
        try {
          writeDocument(staging, encryptRecord(newKey, entry.getValue()));
          moveIntoPlace(staging, target);
          rotated.add(entry.getKey());
        } catch (KeywardException e) {
          log.warn("Rotation cannot rewrite {}: {}", entry.getKey(), e.getMessage());
          failed.put(entry.getKey(), e.getMessage());
        }
      }
      replaceSession(new MasterKeySession(newKey));
      log.info("Master password changed: {} file(s) rotated, {} failure(s)", rotated.size(), failed.size());
      return new RotationReport(rotated, failed);
    } finally {
      ByteUtils.wipe(oldKey);
      if (newKey != null) {
        ByteUtils.wipe(newKey);
      }
    }
  }

  private void verifyKey(final byte[] key) {
    ObjectNode sample = mapper.createObjectNode();
    sample.put("test", "verification");
    sample.put("timestamp", 12345);
    if (!sample.equals(decryptRecord(key, encryptRecord(key, sample)))) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, "Old password is incorrect");
    }
  }

  // ─── Internals ─────────────────────────────────────────────────────────────

  private Path resolve(final String filename) {
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("Filename must not be blank");
    }
    Path path = root.resolve(filename).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new IllegalArgumentException("Filename escapes the data directory: " + filename);
    }
    return path;
  }

  private String relative(final Path path) {
    return root.relativize(path).toString();
  }

  private JsonNode readDocument(final Path path) {
    try {
      return mapper.readTree(path.toFile());
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to read " + relative(path), e);
    }
  }

  private static boolean isEncryptedDocument(final JsonNode document) {
    return document != null && document.isObject() && document.path("encrypted").asBoolean(false);
  }

  private static JsonNode legacyPayload(final JsonNode document) {
    return document.isObject() && document.has("data") ? document.get("data") : document;
  }

  private void writeEncrypted(final Path target, final String data) {
    Path temp;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to create temp file for " + relative(target), e);
    }
    writeDocument(temp, data);
    moveIntoPlace(temp, target);
  }

  private void writeDocument(final Path path, final String data) {
    EncryptedFileRecord record = new EncryptedFileRecord(options.formatVersion(), true, data);
    try {
      Files.createDirectories(path.getParent());
      mapper.writeValue(path.toFile(), record);
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to write " + relative(path), e);
    }
  }

  private void moveIntoPlace(final Path source, final Path target) {
    try {
      try {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to replace " + relative(target), e);
    }
  }

  private void overwriteAndDelete(final Path path) {
    try {
      long size = Files.size(path);
      try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
        for (int pass = 0; pass < options.deletePasses(); pass++) {
          channel.position(0);
          long remaining = size;
          while (remaining > 0) {
            int chunk = (int) Math.min(remaining, OVERWRITE_CHUNK);
            ByteBuffer buffer = ByteBuffer.wrap(options.randomProvider().randomBytes(chunk));
            while (buffer.hasRemaining()) {
              channel.write(buffer);
            }
            remaining -= chunk;
          }
          channel.force(true);
        }
      }
      Files.delete(path);
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to securely delete " + relative(path), e);
    }
  }

  private List<Path> jsonFiles() {
    return regularFiles().stream()
        .filter(p -> {
          String name = p.getFileName().toString();
          return name.endsWith(".json") && !name.startsWith(".");
        })
        .collect(Collectors.toList());
  }

  private List<Path> regularFiles() {
    if (!Files.isDirectory(root)) {
      return List.of();
    }
    try (Stream<Path> walk = Files.walk(root)) {
      return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to list " + root, e);
    }
  }
}
