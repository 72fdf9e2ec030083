package com.codeheadsystems.keyward.crypto.common;

import java.security.SecureRandom;

/**
 * Single source of randomness for keyward. Tests can pass a seeded {@link SecureRandom}.
 *
 * @param random backing generator, also handed to RSA key generation
 */
public record RandomProvider(SecureRandom random) {

  public static final int IV_SIZE = 16;
  public static final int SYMMETRIC_KEY_SIZE = 32;

  public RandomProvider() {
    this(new SecureRandom());
  }

  public RandomProvider {
    if (random == null) {
      throw new IllegalArgumentException("SecureRandom must not be null");
    }
  }

  /**
   * Fresh random bytes; used for salts and secure-delete overwrite data.
   *
   * @param len number of bytes, zero allowed
   */
  public byte[] randomBytes(int len) {
    if (len < 0) {
      throw new IllegalArgumentException("Negative length: " + len);
    }
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /** A 16-byte CBC initialization vector. */
  public byte[] iv() {
    return randomBytes(IV_SIZE);
  }

  /** A 32-byte AES-256 key, one per message. */
  public byte[] symmetricKey() {
    return randomBytes(SYMMETRIC_KEY_SIZE);
  }
}
