package com.codeheadsystems.keyward.backup;

import com.codeheadsystems.keyward.model.KeySummary;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Plaintext content of a key backup before it is sealed.
 *
 * @param version     backup format version
 * @param created     creation time in epoch seconds
 * @param publicKeys  exported public keys
 * @param privateKeys exported private keys
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackupDocument(@JsonProperty("version") String version,
                             @JsonProperty("created") long created,
                             @JsonProperty("public_keys") List<Entry> publicKeys,
                             @JsonProperty("private_keys") List<Entry> privateKeys) {

  public static final String CURRENT_VERSION = "1.0";

  public BackupDocument {
    publicKeys = publicKeys == null ? List.of() : List.copyOf(publicKeys);
    privateKeys = privateKeys == null ? List.of() : List.copyOf(privateKeys);
  }

  /**
   * One exported key.
   *
   * @param fingerprint key fingerprint
   * @param keyData     armored key block
   * @param metadata    listing metadata restored with the key
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Entry(@JsonProperty("fingerprint") String fingerprint,
                      @JsonProperty("key_data") String keyData,
                      @JsonProperty("metadata") KeySummary metadata) {
  }
}
