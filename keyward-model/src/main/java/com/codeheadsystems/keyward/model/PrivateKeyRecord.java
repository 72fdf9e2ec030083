package com.codeheadsystems.keyward.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Persisted private half of a key pair, keyed by fingerprint in {@code private_keys.json}.
 * <p>
 * {@code privateKey} is interpreted according to {@code privateKeyFormat}. Records written before
 * the format tag existed carry a null format until they are classified on load.
 *
 * @param fingerprint      same fingerprint as the matching public record
 * @param keyId            trailing 16 hex digits of the fingerprint
 * @param uids             user ids
 * @param length           modulus size in bits, kept as text
 * @param algo             always {@code RSA}
 * @param created          creation time in epoch seconds
 * @param expires          empty when unset
 * @param trust            trust label copied from the public record
 * @param privateKey       the key payload
 * @param privateKeyFormat how {@code privateKey} is encoded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrivateKeyRecord(@JsonProperty("fingerprint") String fingerprint,
                               @JsonProperty("keyid") String keyId,
                               @JsonProperty("uids") List<String> uids,
                               @JsonProperty("length") String length,
                               @JsonProperty("algo") String algo,
                               @JsonProperty("created") long created,
                               @JsonProperty("expires") String expires,
                               @JsonProperty("trust") String trust,
                               @JsonProperty("private_key") String privateKey,
                               @JsonProperty("private_key_format") PrivateKeyFormat privateKeyFormat) {

  public PrivateKeyRecord {
    uids = uids == null ? List.of() : List.copyOf(uids);
    expires = expires == null ? "" : expires;
  }

  public PrivateKeyRecord withFormat(final PrivateKeyFormat format) {
    return new PrivateKeyRecord(fingerprint, keyId, uids, length, algo, created, expires, trust,
        privateKey, format);
  }

  public KeySummary summary() {
    return new KeySummary(fingerprint, keyId, uids, length, algo, created, expires, trust);
  }
}
