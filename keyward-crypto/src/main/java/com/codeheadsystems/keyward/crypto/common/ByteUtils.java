package com.codeheadsystems.keyward.crypto.common;

import java.util.Arrays;

/**
 * Utility methods for byte array assembly and slicing.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Encodes a long as an 8-byte big-endian octet string.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] longToBytes(long value) {
    byte[] result = new byte[8];
    for (int i = 7; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Decodes 8 big-endian bytes starting at {@code offset} into a long.
   *
   * @param bytes  the source
   * @param offset the offset of the first byte
   * @return the long
   */
  public static long bytesToLong(byte[] bytes, int offset) {
    if (bytes == null || bytes.length < offset + 8) {
      throw new IllegalArgumentException("Input too short for a 64-bit value");
    }
    long value = 0;
    for (int i = 0; i < 8; i++) {
      value = (value << 8) | (bytes[offset + i] & 0xFF);
    }
    return value;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Copies {@code length} bytes starting at {@code offset}.
   *
   * @param bytes  the source
   * @param offset the start offset
   * @param length number of bytes
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] bytes, int offset, int length) {
    if (offset < 0 || length < 0 || bytes.length < offset + length) {
      throw new IllegalArgumentException("Slice out of range: offset=" + offset
          + " length=" + length + " size=" + bytes.length);
    }
    return Arrays.copyOfRange(bytes, offset, offset + length);
  }

  /**
   * Zero-fills the array if it is not null.
   *
   * @param bytes the bytes to clear
   */
  public static void wipe(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }
}
