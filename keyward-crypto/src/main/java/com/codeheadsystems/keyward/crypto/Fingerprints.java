package com.codeheadsystems.keyward.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Key identity derived from public key PEM text.
 * <p>
 * The fingerprint is the first 40 hex digits of SHA-256 over the UTF-8 PEM, upper-cased and
 * grouped in blocks of four separated by single spaces. The key ID is the trailing 16 hex digits.
 */
public class Fingerprints {

  public static final int FINGERPRINT_HEX_LENGTH = 40;
  public static final int KEY_ID_LENGTH = 16;

  private Fingerprints() {
  }

  public static String fingerprint(String publicKeyPem) {
    if (publicKeyPem == null) {
      throw new IllegalArgumentException("Public key PEM must not be null");
    }
    String hex = Primitives.sha256Hex(publicKeyPem.getBytes(StandardCharsets.UTF_8))
        .substring(0, FINGERPRINT_HEX_LENGTH)
        .toUpperCase(Locale.ROOT);
    StringBuilder grouped = new StringBuilder(FINGERPRINT_HEX_LENGTH + 9);
    for (int i = 0; i < FINGERPRINT_HEX_LENGTH; i += 4) {
      if (i > 0) {
        grouped.append(' ');
      }
      grouped.append(hex, i, i + 4);
    }
    return grouped.toString();
  }

  public static String keyId(String fingerprint) {
    String compact = fingerprint.replace(" ", "");
    if (compact.length() < KEY_ID_LENGTH) {
      throw new IllegalArgumentException("Fingerprint too short: " + fingerprint);
    }
    return compact.substring(compact.length() - KEY_ID_LENGTH);
  }
}
