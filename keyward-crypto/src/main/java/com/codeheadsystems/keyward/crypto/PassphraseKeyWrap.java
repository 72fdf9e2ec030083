package com.codeheadsystems.keyward.crypto;

import com.codeheadsystems.keyward.crypto.common.ByteUtils;
import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Passphrase protection for a private key PEM.
 * <p>
 * Wire form is {@code base64(salt(16) || iv(16) || AES-256-CBC(PKCS7(pem)))} where the AES key is
 * PBKDF2-HMAC-SHA256(passphrase, salt). Each wrap draws a fresh salt and IV, so this KDF
 * invocation is independent of the master-password derivation used for at-rest storage.
 */
public class PassphraseKeyWrap {

  public static final int SALT_SIZE = 16;
  private static final int MIN_BLOB_SIZE = SALT_SIZE + Primitives.AES_BLOCK_SIZE + Primitives.AES_BLOCK_SIZE;

  private final int iterations;
  private final RandomProvider randomProvider;

  public PassphraseKeyWrap(final int iterations, final RandomProvider randomProvider) {
    this.iterations = iterations;
    this.randomProvider = randomProvider;
  }

  /**
   * Wraps a PEM under a passphrase.
   *
   * @param pem        the private key PEM
   * @param passphrase the passphrase
   * @return the base64 blob
   */
  public String wrap(String pem, String passphrase) {
    byte[] salt = randomProvider.randomBytes(SALT_SIZE);
    byte[] iv = randomProvider.iv();
    byte[] key = Primitives.pbkdf2Sha256(passphrase, salt, iterations, Primitives.SYMMETRIC_KEY_SIZE);
    try {
      byte[] ciphertext = Primitives.aesCbcEncrypt(key, iv,
          Primitives.pkcs7Pad(pem.getBytes(StandardCharsets.UTF_8)));
      return Base64.getEncoder().encodeToString(ByteUtils.concat(salt, iv, ciphertext));
    } finally {
      ByteUtils.wipe(key);
    }
  }

  /**
   * Recovers the PEM from a blob produced by {@link #wrap(String, String)}.
   *
   * @param blob       the base64 blob
   * @param passphrase the passphrase
   * @return the PEM text
   * @throws CryptoOperationException on a wrong passphrase or a damaged blob
   */
  public String unwrap(String blob, String passphrase) {
    byte[] raw = decode(blob);
    if (!hasWrappedShape(raw)) {
      throw new CryptoOperationException("Wrapped key blob has an invalid length");
    }
    byte[] salt = ByteUtils.slice(raw, 0, SALT_SIZE);
    byte[] iv = ByteUtils.slice(raw, SALT_SIZE, Primitives.AES_BLOCK_SIZE);
    byte[] ciphertext = ByteUtils.slice(raw, SALT_SIZE + Primitives.AES_BLOCK_SIZE,
        raw.length - SALT_SIZE - Primitives.AES_BLOCK_SIZE);
    byte[] key = Primitives.pbkdf2Sha256(passphrase == null ? "" : passphrase, salt, iterations,
        Primitives.SYMMETRIC_KEY_SIZE);
    try {
      String pem = new String(Primitives.pkcs7Unpad(Primitives.aesCbcDecrypt(key, iv, ciphertext)),
          StandardCharsets.UTF_8);
      // Padding alone occasionally accepts a wrong key.
      if (!Pem.looksLikePem(pem)) {
        throw new CryptoOperationException("Failed to decrypt private key: wrong passphrase");
      }
      return pem;
    } finally {
      ByteUtils.wipe(key);
    }
  }

  /**
   * True when the decoded bytes could be salt || iv || whole AES blocks.
   */
  public static boolean hasWrappedShape(byte[] raw) {
    return raw.length >= MIN_BLOB_SIZE
        && (raw.length - SALT_SIZE - Primitives.AES_BLOCK_SIZE) % Primitives.AES_BLOCK_SIZE == 0;
  }

  private static byte[] decode(String blob) {
    try {
      return Base64.getDecoder().decode(blob == null ? "" : blob.trim());
    } catch (IllegalArgumentException e) {
      throw new CryptoOperationException("Wrapped key blob is not valid base64", e);
    }
  }
}
