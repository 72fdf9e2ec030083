package com.codeheadsystems.keyward.crypto;

import static com.codeheadsystems.keyward.crypto.common.ByteUtils.concat;

import com.codeheadsystems.keyward.crypto.common.ByteUtils;
import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Versioned, HMAC-authenticated symmetric token (Fernet layout).
 * <pre>
 *   token = base64url( 0x80 || timestamp(8) || iv(16) || AES-128-CBC(PKCS7(payload)) || HMAC-SHA256(32) )
 * </pre>
 * The 32-byte key is split in two: the first half keys the HMAC, the second half keys AES.
 * The MAC covers every byte before it and is checked before any decryption is attempted.
 */
public class SealedToken {

  public static final int KEY_SIZE = 32;

  private static final byte VERSION = (byte) 0x80;
  private static final int HEADER_SIZE = 1 + 8 + Primitives.AES_BLOCK_SIZE;
  private static final int MAC_SIZE = 32;

  private SealedToken() {
  }

  /**
   * Encrypts and authenticates a payload.
   *
   * @param key            32-byte token key
   * @param payload        plaintext bytes
   * @param randomProvider IV source
   * @return the URL-safe base64 token
   */
  public static String seal(byte[] key, byte[] payload, RandomProvider randomProvider) {
    return seal(key, payload, randomProvider, Instant.now().getEpochSecond());
  }

  static String seal(byte[] key, byte[] payload, RandomProvider randomProvider, long timestamp) {
    checkKey(key);
    byte[] iv = randomProvider.iv();
    byte[] ciphertext = Primitives.aesCbcEncrypt(encryptionKey(key), iv, Primitives.pkcs7Pad(payload));
    byte[] body = concat(new byte[]{VERSION}, ByteUtils.longToBytes(timestamp), iv, ciphertext);
    byte[] mac = hmac(signingKey(key), body);
    return Base64.getUrlEncoder().encodeToString(concat(body, mac));
  }

  /**
   * Verifies and decrypts a token.
   *
   * @param key   32-byte token key
   * @param token the token text
   * @return the payload
   * @throws CryptoOperationException if the token is malformed, was produced under another key,
   *                                   or has been modified
   */
  public static byte[] open(byte[] key, String token) {
    checkKey(key);
    byte[] raw;
    try {
      raw = Base64.getUrlDecoder().decode(token == null ? "" : token.trim());
    } catch (IllegalArgumentException e) {
      throw new CryptoOperationException("Token is not valid base64", e);
    }
    int ciphertextLength = raw.length - HEADER_SIZE - MAC_SIZE;
    if (ciphertextLength < Primitives.AES_BLOCK_SIZE || ciphertextLength % Primitives.AES_BLOCK_SIZE != 0) {
      throw new CryptoOperationException("Token has an invalid length");
    }
    if (raw[0] != VERSION) {
      throw new CryptoOperationException("Unsupported token version");
    }
    byte[] body = ByteUtils.slice(raw, 0, raw.length - MAC_SIZE);
    byte[] mac = ByteUtils.slice(raw, raw.length - MAC_SIZE, MAC_SIZE);
    // Constant-time comparison; nothing is decrypted until the MAC matches.
    if (!MessageDigest.isEqual(hmac(signingKey(key), body), mac)) {
      throw new CryptoOperationException("Token authentication failed");
    }
    byte[] iv = ByteUtils.slice(raw, 9, Primitives.AES_BLOCK_SIZE);
    byte[] ciphertext = ByteUtils.slice(raw, HEADER_SIZE, ciphertextLength);
    return Primitives.pkcs7Unpad(Primitives.aesCbcDecrypt(encryptionKey(key), iv, ciphertext));
  }

  /**
   * True when the text has the token layout: valid base64, a whole number of cipher blocks and the
   * expected version byte. Says nothing about which key produced it.
   */
  public static boolean isWellFormed(String token) {
    if (token == null) {
      return false;
    }
    byte[] raw;
    try {
      raw = Base64.getUrlDecoder().decode(token.trim());
    } catch (IllegalArgumentException e) {
      return false;
    }
    int ciphertextLength = raw.length - HEADER_SIZE - MAC_SIZE;
    return ciphertextLength >= Primitives.AES_BLOCK_SIZE
        && ciphertextLength % Primitives.AES_BLOCK_SIZE == 0
        && raw[0] == VERSION;
  }

  /**
   * Reads the creation time embedded in a token without verifying it.
   */
  public static Instant timestamp(String token) {
    try {
      byte[] raw = Base64.getUrlDecoder().decode(token.trim());
      return Instant.ofEpochSecond(ByteUtils.bytesToLong(raw, 1));
    } catch (IllegalArgumentException e) {
      throw new CryptoOperationException("Token is malformed", e);
    }
  }

  private static void checkKey(byte[] key) {
    if (key == null || key.length != KEY_SIZE) {
      throw new CryptoOperationException("Token key must be " + KEY_SIZE + " bytes");
    }
  }

  private static byte[] signingKey(byte[] key) {
    return ByteUtils.slice(key, 0, KEY_SIZE / 2);
  }

  private static byte[] encryptionKey(byte[] key) {
    return ByteUtils.slice(key, KEY_SIZE / 2, KEY_SIZE / 2);
  }

  private static byte[] hmac(byte[] key, byte[] data) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(key, "HmacSHA256"));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("HmacSHA256 not available", e);
    }
  }
}
