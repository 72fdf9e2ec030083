package com.codeheadsystems.keyward.storage;

import com.codeheadsystems.keyward.crypto.common.ByteUtils;
import java.security.MessageDigest;

/**
 * Holds the derived master key for the life of an unlocked session. The key is zero-filled on
 * {@link #close()}.
 */
class MasterKeySession implements AutoCloseable {

  private final byte[] key;
  private volatile boolean closed;

  MasterKeySession(final byte[] key) {
    this.key = key.clone();
  }

  byte[] key() {
    if (closed) {
      throw new IllegalStateException("Session closed");
    }
    return key;
  }

  boolean matches(final byte[] candidate) {
    return !closed && MessageDigest.isEqual(key, candidate);
  }

  boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
    ByteUtils.wipe(key);
  }
}
