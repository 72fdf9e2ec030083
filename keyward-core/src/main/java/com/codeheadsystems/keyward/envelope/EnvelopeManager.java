package com.codeheadsystems.keyward.envelope;

import com.codeheadsystems.keyward.armor.ArmorCodec;
import com.codeheadsystems.keyward.config.KeywardConfig;
import com.codeheadsystems.keyward.crypto.CryptoOperationException;
import com.codeheadsystems.keyward.crypto.Pem;
import com.codeheadsystems.keyward.crypto.Primitives;
import com.codeheadsystems.keyward.crypto.common.ByteUtils;
import com.codeheadsystems.keyward.keys.KeyStoreManager;
import com.codeheadsystems.keyward.model.ArmorBlock;
import com.codeheadsystems.keyward.model.ArmorType;
import com.codeheadsystems.keyward.model.MessageEnvelope;
import com.codeheadsystems.keyward.model.PrivateKeyRecord;
import com.codeheadsystems.keyward.model.PublicKeyRecord;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hybrid multi-recipient message encryption.
 * <p>
 * A message is encrypted once with a fresh AES-256-CBC key and IV; that key is then wrapped with
 * RSA-OAEP for each recipient. The resulting {@link MessageEnvelope} is serialized to JSON,
 * base64 encoded and armored as {@code MESSAGE}.
 */
@Singleton
public class EnvelopeManager {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeManager.class);
  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final KeyStoreManager keyStore;
  private final KeywardConfig config;
  private final ObjectMapper mapper;

  @Inject
  public EnvelopeManager(final KeyStoreManager keyStore, final KeywardConfig config, final ObjectMapper mapper) {
    log.info("EnvelopeManager()");
    this.keyStore = keyStore;
    this.config = config;
    this.mapper = mapper;
  }

  /**
   * Encrypts {@code plaintext} for every recipient.
   *
   * @param plaintext  message text
   * @param recipients recipient fingerprints; the envelope holds one wrapped key per entry, in order
   * @return the armored message
   * @throws KeywardException {@link ErrorKind#NO_RECIPIENTS} for an empty list,
   *                          {@link ErrorKind#KEY_NOT_FOUND} for an unknown fingerprint
   */
  public String encryptMessage(final String plaintext, final List<String> recipients) {
    log.debug("encryptMessage({} recipient(s))", recipients == null ? 0 : recipients.size());
    if (recipients == null || recipients.isEmpty()) {
      throw new KeywardException(ErrorKind.NO_RECIPIENTS, "No recipients specified");
    }
    if (plaintext == null) {
      throw new IllegalArgumentException("Plaintext must not be null");
    }
    List<PublicKey> publicKeys = new ArrayList<>(recipients.size());
    for (String fingerprint : recipients) {
      PublicKeyRecord record = keyStore.publicKey(fingerprint)
          .orElseThrow(() -> new KeywardException(ErrorKind.KEY_NOT_FOUND,
              "Public key not found for " + fingerprint));
      try {
        publicKeys.add(Pem.parsePublicKey(record.publicKey()));
      } catch (CryptoOperationException e) {
        throw new KeywardException(ErrorKind.CORRUPT_KEY_DATA, "Stored public key is invalid: " + fingerprint, e);
      }
    }

    byte[] messageKey = config.randomProvider().symmetricKey();
    try {
      byte[] iv = config.randomProvider().iv();
      byte[] body = Primitives.aesCbcEncrypt(messageKey, iv,
          Primitives.pkcs7Pad(plaintext.getBytes(StandardCharsets.UTF_8)));
      List<String> wrappedKeys = new ArrayList<>(publicKeys.size());
      for (PublicKey publicKey : publicKeys) {
        wrappedKeys.add(B64.encodeToString(Primitives.rsaOaepWrap(publicKey, messageKey)));
      }
      MessageEnvelope envelope = new MessageEnvelope(MessageEnvelope.CURRENT_VERSION, wrappedKeys,
          B64.encodeToString(iv), B64.encodeToString(body));
      String payload = B64.encodeToString(mapper.writeValueAsBytes(envelope));
      return ArmorCodec.encode(ArmorBlock.of(ArmorType.MESSAGE, payload));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize message envelope", e);
    } finally {
      ByteUtils.wipe(messageKey);
    }
  }

  /**
   * Decrypts an armored message with whichever local private key opens it.
   *
   * @param armored    the armored message
   * @param passphrase passphrase for passphrase-protected private keys
   * @return the plaintext
   * @throws KeywardException {@link ErrorKind#INVALID_ARMOR_FORMAT}, {@link ErrorKind#INVALID_MESSAGE_FORMAT}
   *                          or {@link ErrorKind#DECRYPTION_FAILURE}
   */
  public String decryptMessage(final String armored, final String passphrase) {
    ArmorBlock block = ArmorCodec.decode(armored);
    log.debug("decryptMessage({})", block.label());
    if (!block.isMessage()) {
      throw new KeywardException(ErrorKind.INVALID_MESSAGE_FORMAT, "Invalid message format");
    }
    MessageEnvelope envelope = decodeEnvelope(block.payload());
    byte[] iv = decodeField(envelope.iv(), "iv");
    if (iv.length != Primitives.AES_BLOCK_SIZE) {
      throw new KeywardException(ErrorKind.INVALID_MESSAGE_FORMAT, "Message IV must be 16 bytes");
    }
    byte[] body = decodeField(envelope.encryptedMessage(), "encrypted_message");

    KeySearchResult search = findMessageKey(envelope, passphrase);
    if (!search.isFound()) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, search.failureMessage());
    }
    byte[] messageKey = search.messageKey();
    try {
      byte[] plaintext = Primitives.pkcs7Unpad(Primitives.aesCbcDecrypt(messageKey, iv, body));
      log.debug("decryptMessage(): opened with {}", search.fingerprint());
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(plaintext))
          .toString();
    } catch (CryptoOperationException e) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, "Message body could not be decrypted", e);
    } catch (CharacterCodingException e) {
      throw new KeywardException(ErrorKind.DECRYPTION_FAILURE, "Decrypted message is not valid UTF-8", e);
    } finally {
      ByteUtils.wipe(messageKey);
    }
  }

  /**
   * Tries every private key, in ring order, against every wrapped key, in envelope order, and stops
   * at the first that unwraps. A key that cannot be unlocked is counted and skipped.
   */
  KeySearchResult findMessageKey(final MessageEnvelope envelope, final String passphrase) {
    List<PrivateKeyRecord> candidates = keyStore.privateKeys();
    int unlocked = 0;
    int unlockFailures = 0;
    for (PrivateKeyRecord record : candidates) {
      PrivateKey privateKey;
      try {
        privateKey = keyStore.unlockPrivateKey(record, passphrase);
      } catch (KeywardException e) {
        unlockFailures++;
        log.debug("Skipping private key {}: {}", record.keyId(), e.getMessage());
        continue;
      }
      unlocked++;
      for (String wrapped : envelope.encryptedKeys()) {
        byte[] messageKey = tryUnwrap(privateKey, wrapped);
        if (messageKey != null) {
          return KeySearchResult.found(messageKey, record.fingerprint(), candidates.size(), unlocked, unlockFailures);
        }
      }
    }
    return KeySearchResult.exhausted(candidates.size(), unlocked, unlockFailures);
  }

  private byte[] tryUnwrap(final PrivateKey privateKey, final String wrapped) {
    try {
      byte[] key = Primitives.rsaOaepUnwrap(privateKey, B64D.decode(wrapped));
      return key.length == Primitives.SYMMETRIC_KEY_SIZE ? key : null;
    } catch (CryptoOperationException | IllegalArgumentException e) {
      log.trace("Wrapped key did not open: {}", e.getMessage());
      return null;
    }
  }

  private MessageEnvelope decodeEnvelope(final String payload) {
    MessageEnvelope envelope;
    try {
      envelope = mapper.readValue(B64D.decode(payload), MessageEnvelope.class);
    } catch (IllegalArgumentException | IOException e) {
      throw new KeywardException(ErrorKind.INVALID_MESSAGE_FORMAT, "Message envelope cannot be decoded", e);
    }
    if (envelope == null || envelope.iv() == null || envelope.encryptedMessage() == null
        || envelope.encryptedKeys().isEmpty()) {
      throw new KeywardException(ErrorKind.INVALID_MESSAGE_FORMAT, "Message envelope is incomplete");
    }
    return envelope;
  }

  private static byte[] decodeField(final String value, final String field) {
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new KeywardException(ErrorKind.INVALID_MESSAGE_FORMAT, "Invalid base64 in field: " + field, e);
    }
  }
}
