package com.codeheadsystems.keyward.crypto;

import com.codeheadsystems.keyward.crypto.common.RandomProvider;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.RSAKeyGenParameterSpec;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.Hex;

/**
 * Low-level cryptographic primitives: RSA key generation and OAEP key wrapping,
 * raw AES-CBC, PBKDF2-HMAC-SHA256 and PKCS#7 padding.
 * All methods are stateless; failures surface as {@link CryptoOperationException}.
 */
public class Primitives {

  public static final int AES_BLOCK_SIZE = 16;
  public static final int SYMMETRIC_KEY_SIZE = 32;
  public static final int PBKDF2_DEFAULT_ITERATIONS = 100_000;
  public static final int PBKDF2_DEFAULT_LENGTH = 32;

  private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
      "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

  private Primitives() {
  }

  // ─── RSA ─────────────────────────────────────────────────────────────────────

  /**
   * Generates an RSA key pair with public exponent 65537 and returns both halves as PEM.
   *
   * @param bits           modulus length
   * @param randomProvider source of randomness
   * @return PKCS#8 private PEM and SubjectPublicKeyInfo public PEM
   */
  public static RsaKeyPairPem generateRsaKeyPair(int bits, RandomProvider randomProvider) {
    if (bits < 1024) {
      throw new IllegalArgumentException("RSA key length must be at least 1024 bits: " + bits);
    }
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
      generator.initialize(new RSAKeyGenParameterSpec(bits, RSAKeyGenParameterSpec.F4),
          randomProvider.random());
      KeyPair keyPair = generator.generateKeyPair();
      return new RsaKeyPairPem(Pem.encodePrivateKey(keyPair.getPrivate()),
          Pem.encodePublicKey(keyPair.getPublic()));
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("RSA key generation failed", e);
    }
  }

  /**
   * RSA-OAEP encrypts a small payload, SHA-256 for both the hash and MGF1.
   *
   * @param publicKey recipient public key
   * @param payload   bytes to wrap, typically a symmetric key
   * @return the ciphertext
   */
  public static byte[] rsaOaepWrap(PublicKey publicKey, byte[] payload) {
    try {
      Cipher cipher = Cipher.getInstance("RSA/ECB/OAEPPadding");
      cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA256);
      return cipher.doFinal(payload);
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("RSA-OAEP wrap failed", e);
    }
  }

  /**
   * Reverses {@link #rsaOaepWrap(PublicKey, byte[])}.
   *
   * @param privateKey the private key
   * @param ciphertext the wrapped payload
   * @return the payload
   */
  public static byte[] rsaOaepUnwrap(PrivateKey privateKey, byte[] ciphertext) {
    try {
      Cipher cipher = Cipher.getInstance("RSA/ECB/OAEPPadding");
      cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256);
      return cipher.doFinal(ciphertext);
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("RSA-OAEP unwrap failed", e);
    }
  }

  // ─── AES-CBC ─────────────────────────────────────────────────────────────────

  /**
   * AES-CBC over input that is already a whole number of blocks (see {@link #pkcs7Pad(byte[])}).
   *
   * @param key    16, 24 or 32 byte key
   * @param iv     16 byte IV
   * @param padded padded plaintext
   * @return the ciphertext
   */
  public static byte[] aesCbcEncrypt(byte[] key, byte[] iv, byte[] padded) {
    return aesCbc(Cipher.ENCRYPT_MODE, key, iv, padded);
  }

  /**
   * AES-CBC decryption; the result still carries its PKCS#7 padding.
   *
   * @param key        the key
   * @param iv         the iv
   * @param ciphertext the ciphertext
   * @return the padded plaintext
   */
  public static byte[] aesCbcDecrypt(byte[] key, byte[] iv, byte[] ciphertext) {
    return aesCbc(Cipher.DECRYPT_MODE, key, iv, ciphertext);
  }

  private static byte[] aesCbc(int mode, byte[] key, byte[] iv, byte[] input) {
    if (iv == null || iv.length != AES_BLOCK_SIZE) {
      throw new CryptoOperationException("AES-CBC requires a 16-byte IV");
    }
    if (input.length % AES_BLOCK_SIZE != 0) {
      throw new CryptoOperationException("AES-CBC input is not a multiple of the block size");
    }
    try {
      Cipher cipher = Cipher.getInstance("AES/CBC/NoPadding");
      cipher.init(mode, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
      return cipher.doFinal(input);
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("AES-CBC operation failed", e);
    }
  }

  // ─── PBKDF2 ──────────────────────────────────────────────────────────────────

  /**
   * PBKDF2-HMAC-SHA256 over the UTF-8 encoding of the password.
   *
   * @param password   the password
   * @param salt       the salt
   * @param iterations iteration count
   * @param length     output length in bytes
   * @return the derived key
   */
  public static byte[] pbkdf2Sha256(String password, byte[] salt, int iterations, int length) {
    if (password == null) {
      throw new IllegalArgumentException("Password must not be null");
    }
    if (iterations < 1 || length < 1) {
      throw new IllegalArgumentException("Iterations and length must be positive");
    }
    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    generator.init(password.getBytes(StandardCharsets.UTF_8), salt, iterations);
    KeyParameter parameter = (KeyParameter) generator.generateDerivedMacParameters(length * 8);
    return parameter.getKey();
  }

  /**
   * PBKDF2 with the default 100000 iterations and a 32-byte output.
   */
  public static byte[] pbkdf2Sha256(String password, byte[] salt) {
    return pbkdf2Sha256(password, salt, PBKDF2_DEFAULT_ITERATIONS, PBKDF2_DEFAULT_LENGTH);
  }

  // ─── PKCS#7 ──────────────────────────────────────────────────────────────────

  /**
   * PKCS#7 pads to the AES block size. Always adds between 1 and 16 bytes.
   */
  public static byte[] pkcs7Pad(byte[] data) {
    int padLength = AES_BLOCK_SIZE - (data.length % AES_BLOCK_SIZE);
    byte[] out = Arrays.copyOf(data, data.length + padLength);
    Arrays.fill(out, data.length, out.length, (byte) padLength);
    return out;
  }

  /**
   * Removes PKCS#7 padding.
   *
   * @throws CryptoOperationException if the buffer is empty, the declared length is 0,
   *                                   larger than a block or the buffer, or the pad bytes disagree
   */
  public static byte[] pkcs7Unpad(byte[] data) {
    if (data == null || data.length == 0) {
      throw new CryptoOperationException("Cannot unpad an empty buffer");
    }
    int padLength = data[data.length - 1] & 0xFF;
    if (padLength == 0 || padLength > AES_BLOCK_SIZE || padLength > data.length) {
      throw new CryptoOperationException("Invalid PKCS#7 padding length: " + padLength);
    }
    for (int i = data.length - padLength; i < data.length; i++) {
      if ((data[i] & 0xFF) != padLength) {
        throw new CryptoOperationException("Inconsistent PKCS#7 padding");
      }
    }
    return Arrays.copyOf(data, data.length - padLength);
  }

  // ─── Hashing ─────────────────────────────────────────────────────────────────

  /**
   * Lower-case hex SHA-256 of the input.
   */
  public static String sha256Hex(byte[] data) {
    try {
      return Hex.toHexString(MessageDigest.getInstance("SHA-256").digest(data));
    } catch (NoSuchAlgorithmException e) {
      throw new CryptoOperationException("SHA-256 not available", e);
    }
  }

  /**
   * A freshly generated RSA key pair in PEM form.
   *
   * @param privatePem PKCS#8 private key PEM
   * @param publicPem  SubjectPublicKeyInfo public key PEM
   */
  public record RsaKeyPairPem(String privatePem, String publicPem) {
  }
}
