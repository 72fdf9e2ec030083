package com.codeheadsystems.keyward.model.error;

/**
 * Failure categories reported by every keyward operation.
 */
public enum ErrorKind {
  /** No master session is open. */
  ENCRYPTION_NOT_INITIALIZED,
  /** Fingerprint or recipient is not in the key ring. */
  KEY_NOT_FOUND,
  /** Armor BEGIN or END marker missing. */
  INVALID_ARMOR_FORMAT,
  /** Armored block is not a message, or its envelope cannot be decoded. */
  INVALID_MESSAGE_FORMAT,
  /** Wrong passphrase or password, tampered data, or no usable private key. */
  DECRYPTION_FAILURE,
  /** Encryption requested with an empty recipient list. */
  NO_RECIPIENTS,
  /** Stored or imported key material cannot be parsed. */
  CORRUPT_KEY_DATA,
  /** Filesystem error, lock contention or corrupt file structure. */
  STORAGE_FAILURE,
  /** Backup blob cannot be decoded. */
  INVALID_BACKUP,
  /** Caller input rejected before any work was done, such as a null passphrase or a short key size. */
  INVALID_ARGUMENT
}
