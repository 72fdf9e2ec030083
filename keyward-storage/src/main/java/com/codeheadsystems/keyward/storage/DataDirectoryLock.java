package com.codeheadsystems.keyward.storage;

import com.codeheadsystems.keyward.model.error.ErrorKind;
import com.codeheadsystems.keyward.model.error.KeywardException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive lock on {@value #LOCK_FILE} so that only one store instance at a time works on a
 * data directory.
 */
public class DataDirectoryLock implements AutoCloseable {

  public static final String LOCK_FILE = ".keyward.lock";

  private static final Logger log = LoggerFactory.getLogger(DataDirectoryLock.class);

  private final FileChannel channel;
  private final FileLock lock;

  private DataDirectoryLock(final FileChannel channel, final FileLock lock) {
    this.channel = channel;
    this.lock = lock;
  }

  /**
   * Takes the lock without waiting.
   *
   * @param root the data directory
   * @return the held lock
   * @throws KeywardException with {@link ErrorKind#STORAGE_FAILURE} if the directory is already locked
   */
  public static DataDirectoryLock acquire(final Path root) {
    try {
      Files.createDirectories(root);
      FileChannel channel = FileChannel.open(root.resolve(LOCK_FILE),
          StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      FileLock lock;
      try {
        lock = channel.tryLock();
      } catch (OverlappingFileLockException e) {
        channel.close();
        throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Data directory is already in use: " + root, e);
      }
      if (lock == null) {
        channel.close();
        throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Data directory is locked by another process: " + root);
      }
      log.debug("Locked data directory {}", root);
      return new DataDirectoryLock(channel, lock);
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to lock data directory: " + root, e);
    }
  }

  public boolean isValid() {
    return lock.isValid();
  }

  @Override
  public void close() {
    try {
      if (lock.isValid()) {
        lock.release();
      }
      channel.close();
    } catch (IOException e) {
      throw new KeywardException(ErrorKind.STORAGE_FAILURE, "Unable to release data directory lock", e);
    }
  }
}
