package com.codeheadsystems.keyward.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory public and private key rings, each mapping fingerprint to record in insertion order.
 * <p>
 * Not thread safe; the owner serializes access.
 */
public class KeyRing {

  private final LinkedHashMap<String, PublicKeyRecord> publicKeys = new LinkedHashMap<>();
  private final LinkedHashMap<String, PrivateKeyRecord> privateKeys = new LinkedHashMap<>();

  public KeyRing() {
  }

  public KeyRing(final Map<String, PublicKeyRecord> publicKeys,
                 final Map<String, PrivateKeyRecord> privateKeys) {
    this.publicKeys.putAll(publicKeys);
    this.privateKeys.putAll(privateKeys);
  }

  /**
   * Inserts or replaces the public record for its fingerprint.
   *
   * @return the record that was replaced, if any
   */
  public Optional<PublicKeyRecord> putPublic(final PublicKeyRecord record) {
    return Optional.ofNullable(publicKeys.put(record.fingerprint(), record));
  }

  public Optional<PrivateKeyRecord> putPrivate(final PrivateKeyRecord record) {
    return Optional.ofNullable(privateKeys.put(record.fingerprint(), record));
  }

  public Optional<PublicKeyRecord> publicKey(final String fingerprint) {
    return Optional.ofNullable(publicKeys.get(fingerprint));
  }

  public Optional<PrivateKeyRecord> privateKey(final String fingerprint) {
    return Optional.ofNullable(privateKeys.get(fingerprint));
  }

  public Optional<PublicKeyRecord> removePublic(final String fingerprint) {
    return Optional.ofNullable(publicKeys.remove(fingerprint));
  }

  public Optional<PrivateKeyRecord> removePrivate(final String fingerprint) {
    return Optional.ofNullable(privateKeys.remove(fingerprint));
  }

  public List<PublicKeyRecord> publicKeys() {
    return List.copyOf(publicKeys.values());
  }

  public List<PrivateKeyRecord> privateKeys() {
    return List.copyOf(privateKeys.values());
  }

  /**
   * Read-only view suitable for serialization to {@code public_keys.json}.
   */
  public Map<String, PublicKeyRecord> publicKeyMap() {
    return Collections.unmodifiableMap(publicKeys);
  }

  public Map<String, PrivateKeyRecord> privateKeyMap() {
    return Collections.unmodifiableMap(privateKeys);
  }

  public List<KeySummary> summaries(final boolean secret) {
    List<KeySummary> out = new ArrayList<>();
    if (secret) {
      privateKeys.values().forEach(r -> out.add(r.summary()));
    } else {
      publicKeys.values().forEach(r -> out.add(r.summary()));
    }
    return out;
  }

  public void clear() {
    publicKeys.clear();
    privateKeys.clear();
  }

  public boolean isEmpty() {
    return publicKeys.isEmpty() && privateKeys.isEmpty();
  }
}
