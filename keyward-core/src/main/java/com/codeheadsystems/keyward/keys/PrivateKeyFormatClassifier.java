package com.codeheadsystems.keyward.keys;

import com.codeheadsystems.keyward.crypto.PassphraseKeyWrap;
import com.codeheadsystems.keyward.crypto.Pem;
import com.codeheadsystems.keyward.model.PrivateKeyFormat;
import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Decides the {@link PrivateKeyFormat} of a private key payload stored without a format tag.
 */
public class PrivateKeyFormatClassifier {

  private PrivateKeyFormatClassifier() {
  }

  /**
   * Classifies by shape: PEM text, base64 of PEM text, or base64 of a salt/iv/ciphertext blob.
   *
   * @param payload the stored payload
   * @return the format
   * @throws KeywardException with {@link ErrorKind#CORRUPT_KEY_DATA} when the payload matches none
   */
  public static PrivateKeyFormat classify(final String payload) {
    if (payload == null || payload.isBlank()) {
      throw corrupt("Private key payload is empty");
    }
    if (payload.startsWith("-----")) {
      return PrivateKeyFormat.PLAIN_PEM;
    }
    byte[] raw;
    try {
      raw = Base64.getDecoder().decode(payload.trim());
    } catch (IllegalArgumentException e) {
      throw new KeywardException(ErrorKind.CORRUPT_KEY_DATA, "Private key payload is not PEM or base64", e);
    }
    if (Pem.looksLikePem(new String(raw, StandardCharsets.UTF_8))) {
      return PrivateKeyFormat.ENCODED_PEM;
    }
    if (PassphraseKeyWrap.hasWrappedShape(raw)) {
      return PrivateKeyFormat.WRAPPED;
    }
    throw corrupt("Private key payload has an unrecognized shape");
  }

  private static KeywardException corrupt(final String message) {
    return new KeywardException(ErrorKind.CORRUPT_KEY_DATA, message);
  }
}
