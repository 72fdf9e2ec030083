package com.codeheadsystems.keyward.crypto;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.RSAPublicKeySpec;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.util.io.pem.PemObjectGenerator;

/**
 * PEM encoding and decoding of RSA keys.
 * <p>
 * Public keys are written as SubjectPublicKeyInfo ({@code PUBLIC KEY}), private keys as
 * unencrypted PKCS#8 ({@code PRIVATE KEY}). Output always uses {@code \n} line endings
 * with a trailing newline so that fingerprints computed over the text are platform independent.
 * Parsing accepts PKCS#8 and PKCS#1 ({@code RSA PRIVATE KEY}) private keys; passphrase
 * protected PEM is rejected.
 */
public class Pem {

  private static final JcaPEMKeyConverter CONVERTER = new JcaPEMKeyConverter();

  private Pem() {
  }

  public static String encodePublicKey(PublicKey publicKey) {
    return write(publicKey);
  }

  public static String encodePrivateKey(PrivateKey privateKey) {
    StringWriter out = new StringWriter();
    try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
      PemObjectGenerator generator = new JcaPKCS8Generator(privateKey, null);
      writer.writeObject(generator);
    } catch (IOException e) {
      throw new CryptoOperationException("Unable to encode private key as PKCS#8", e);
    }
    return normalize(out.toString());
  }

  /**
   * Parses a PEM public key.
   *
   * @param pem the pem text
   * @return the public key
   * @throws CryptoOperationException if the text is not a PEM public key
   */
  public static PublicKey parsePublicKey(String pem) {
    Object parsed = read(pem);
    try {
      if (parsed instanceof SubjectPublicKeyInfo info) {
        return CONVERTER.getPublicKey(info);
      }
    } catch (IOException e) {
      throw new CryptoOperationException("Unable to load public key", e);
    }
    throw new CryptoOperationException("PEM does not contain a public key");
  }

  /**
   * Parses an unencrypted PEM private key.
   *
   * @param pem the pem text
   * @return the private key
   * @throws CryptoOperationException if the text is not an unencrypted PEM private key
   */
  public static PrivateKey parsePrivateKey(String pem) {
    Object parsed = read(pem);
    try {
      if (parsed instanceof PrivateKeyInfo info) {
        return CONVERTER.getPrivateKey(info);
      }
      if (parsed instanceof PEMKeyPair pair) {
        return CONVERTER.getKeyPair(pair).getPrivate();
      }
    } catch (IOException e) {
      throw new CryptoOperationException("Unable to load private key", e);
    }
    throw new CryptoOperationException("PEM does not contain an unencrypted private key");
  }

  /**
   * Derives the SubjectPublicKeyInfo PEM matching an RSA private key.
   */
  public static String publicPemFor(PrivateKey privateKey) {
    if (!(privateKey instanceof RSAPrivateCrtKey crtKey)) {
      throw new CryptoOperationException("Only RSA private keys with CRT parameters are supported");
    }
    try {
      PublicKey publicKey = KeyFactory.getInstance("RSA")
          .generatePublic(new RSAPublicKeySpec(crtKey.getModulus(), crtKey.getPublicExponent()));
      return encodePublicKey(publicKey);
    } catch (GeneralSecurityException e) {
      throw new CryptoOperationException("Unable to derive public key", e);
    }
  }

  /**
   * Modulus length in bits of an RSA key.
   */
  public static int keyLength(Object key) {
    if (key instanceof RSAKey rsaKey) {
      return rsaKey.getModulus().bitLength();
    }
    throw new CryptoOperationException("Not an RSA key: " + (key == null ? "null" : key.getClass().getName()));
  }

  /**
   * Cheap textual check used before attempting a full parse.
   */
  public static boolean looksLikePem(String text) {
    return text != null && text.stripLeading().startsWith("-----BEGIN ");
  }

  private static Object read(String pem) {
    if (pem == null || pem.isBlank()) {
      throw new CryptoOperationException("Empty PEM input");
    }
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      Object parsed = parser.readObject();
      if (parsed == null) {
        throw new CryptoOperationException("No PEM object found");
      }
      return parsed;
    } catch (IOException | IllegalArgumentException e) {
      throw new CryptoOperationException("Malformed PEM", e);
    }
  }

  private static String write(Object object) {
    StringWriter out = new StringWriter();
    try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
      writer.writeObject(object);
    } catch (IOException e) {
      throw new CryptoOperationException("Unable to write PEM", e);
    }
    return normalize(out.toString());
  }

  private static String normalize(String pem) {
    String text = pem.replace("\r\n", "\n");
    return text.endsWith("\n") ? text : text + "\n";
  }
}
