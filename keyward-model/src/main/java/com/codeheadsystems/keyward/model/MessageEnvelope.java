package com.codeheadsystems.keyward.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Hybrid-encrypted message body, carried base64 encoded inside a {@code MESSAGE} armor block.
 *
 * @param version          envelope format version
 * @param encryptedKeys    base64 RSA-OAEP wraps of the message key, one per recipient in order
 * @param iv               base64 of the 16-byte CBC IV
 * @param encryptedMessage base64 AES-256-CBC ciphertext of the padded plaintext
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"version", "encrypted_keys", "iv", "encrypted_message"})
public record MessageEnvelope(@JsonProperty("version") String version,
                              @JsonProperty("encrypted_keys") List<String> encryptedKeys,
                              @JsonProperty("iv") String iv,
                              @JsonProperty("encrypted_message") String encryptedMessage) {

  public static final String CURRENT_VERSION = "1.0";

  public MessageEnvelope {
    encryptedKeys = encryptedKeys == null ? List.of() : List.copyOf(encryptedKeys);
  }
}
