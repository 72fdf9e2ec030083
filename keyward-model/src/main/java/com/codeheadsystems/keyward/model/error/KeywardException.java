package com.codeheadsystems.keyward.model.error;

/**
 * Unchecked failure carrying the {@link ErrorKind} the caller should act on.
 */
public class KeywardException extends RuntimeException {

  private final ErrorKind kind;

  public KeywardException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  public KeywardException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public static KeywardException notInitialized() {
    return new KeywardException(ErrorKind.ENCRYPTION_NOT_INITIALIZED,
        "Encryption not initialized: unlock with the master password first");
  }

  public static KeywardException keyNotFound(final String fingerprint) {
    return new KeywardException(ErrorKind.KEY_NOT_FOUND, "Key not found: " + fingerprint);
  }
}
