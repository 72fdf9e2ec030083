package com.codeheadsystems.keyward.crypto;

/**
 * Raised when a cryptographic primitive rejects its input: bad key, bad padding,
 * failed authentication, malformed PEM or an unavailable algorithm.
 */
public class CryptoOperationException extends RuntimeException {

  /**
   * Instantiates a new Crypto operation exception.
   *
   * @param message the message
   */
  public CryptoOperationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Crypto operation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CryptoOperationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
