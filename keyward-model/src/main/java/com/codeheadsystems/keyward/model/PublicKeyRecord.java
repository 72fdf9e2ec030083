package com.codeheadsystems.keyward.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Persisted public half of a key pair, keyed by fingerprint in {@code public_keys.json}.
 *
 * @param fingerprint 40 upper-case hex digits in groups of four
 * @param keyId       trailing 16 hex digits of the fingerprint
 * @param uids        user ids, {@code "Name <email>"} for generated keys
 * @param length      modulus size in bits, kept as text
 * @param algo        always {@code RSA}
 * @param created     creation time in epoch seconds
 * @param expires     empty when the key never expires; stored but not enforced
 * @param trust       {@code ultimate} for generated keys, {@code unknown} for imports
 * @param publicKey   SubjectPublicKeyInfo PEM
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublicKeyRecord(@JsonProperty("fingerprint") String fingerprint,
                              @JsonProperty("keyid") String keyId,
                              @JsonProperty("uids") List<String> uids,
                              @JsonProperty("length") String length,
                              @JsonProperty("algo") String algo,
                              @JsonProperty("created") long created,
                              @JsonProperty("expires") String expires,
                              @JsonProperty("trust") String trust,
                              @JsonProperty("public_key") String publicKey) {

  public static final String ALGO_RSA = "RSA";
  public static final String TRUST_ULTIMATE = "ultimate";
  public static final String TRUST_UNKNOWN = "unknown";

  public PublicKeyRecord {
    uids = uids == null ? List.of() : List.copyOf(uids);
    expires = expires == null ? "" : expires;
  }

  public KeySummary summary() {
    return new KeySummary(fingerprint, keyId, uids, length, algo, created, expires, trust);
  }
}
