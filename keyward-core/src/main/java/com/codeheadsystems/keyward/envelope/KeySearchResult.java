package com.codeheadsystems.keyward.envelope;

import java.util.Optional;

/**
 * Outcome of searching the private ring for a key that opens one of an envelope's wrapped keys.
 *
 * @param messageKey     the recovered symmetric key, null when nothing matched
 * @param fingerprint    fingerprint of the private key that matched, null when nothing matched
 * @param stored         private keys in the ring
 * @param unlocked       private keys that could be unlocked and were tried against the envelope
 * @param unlockFailures private keys that could not be unlocked with the passphrase
 */
public record KeySearchResult(byte[] messageKey,
                              String fingerprint,
                              int stored,
                              int unlocked,
                              int unlockFailures) {

  public static KeySearchResult found(final byte[] messageKey, final String fingerprint,
                                      final int stored, final int unlocked, final int unlockFailures) {
    return new KeySearchResult(messageKey, fingerprint, stored, unlocked, unlockFailures);
  }

  public static KeySearchResult exhausted(final int stored, final int unlocked, final int unlockFailures) {
    return new KeySearchResult(null, null, stored, unlocked, unlockFailures);
  }

  public boolean isFound() {
    return messageKey != null;
  }

  public Optional<String> matchedFingerprint() {
    return Optional.ofNullable(fingerprint);
  }

  /**
   * Failure text for an exhausted search. An empty ring reads differently from a ring whose keys
   * were all tried.
   */
  public String failureMessage() {
    if (stored == 0) {
      return "No private keys available for decryption";
    }
    return "Could not decrypt message with any of the " + unlocked + " available private keys ("
        + stored + " stored, " + unlockFailures + " could not be unlocked with the given passphrase)."
        + " The message may be for a different key, the passphrase may be wrong,"
        + " or the key data or message may be corrupted";
  }
}
