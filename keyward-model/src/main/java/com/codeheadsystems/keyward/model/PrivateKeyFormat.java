package com.codeheadsystems.keyward.model;

/**
 * Encoding of {@link PrivateKeyRecord#privateKey()}.
 */
public enum PrivateKeyFormat {
  /** base64(salt || iv || AES-256-CBC(PEM)) under a passphrase-derived key. */
  WRAPPED,
  /** Raw PEM text. */
  PLAIN_PEM,
  /** base64 of the PEM text, no passphrase. */
  ENCODED_PEM
}
