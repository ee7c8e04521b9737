package com.codeheadsystems.p9sk.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Utility methods for the fixed-width fields used on the wire.
 */
public class ByteUtils {

  private ByteUtils() {
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
   * Whether a string's UTF-8 encoding fits a NUL-terminated field of {@code fieldLength} bytes.
   *
   * @param value       the string
   * @param fieldLength the field width
   * @return true if {@link #putString} would store it whole
   */
  public static boolean fitsField(String value, int fieldLength) {
    return value.getBytes(StandardCharsets.UTF_8).length < fieldLength;
  }

  /**
   * Writes a string into a NUL-padded field of {@code fieldLength} bytes. At most
   * {@code fieldLength - 1} bytes of the UTF-8 encoding are kept so the field always ends in NUL;
   * a longer string is cut before the first character that does not fit whole.
   *
   * @param buf         the destination
   * @param offset      start of the field
   * @param value       the string, null is written as an empty field
   * @param fieldLength the field width
   */
  public static void putString(byte[] buf, int offset, String value, int fieldLength) {
    Arrays.fill(buf, offset, offset + fieldLength, (byte) 0);
    if (value == null) {
      return;
    }
    byte[] encoded = value.getBytes(StandardCharsets.UTF_8);
    int n = Math.min(encoded.length, fieldLength - 1);
    // back off over continuation bytes (10xxxxxx) so no character is split
    while (n > 0 && n < encoded.length && (encoded[n] & 0xC0) == 0x80) {
      n--;
    }
    System.arraycopy(encoded, 0, buf, offset, n);
  }

  /**
   * Reads a NUL-terminated string out of a fixed-width field.
   *
   * @param buf         the source
   * @param offset      start of the field
   * @param fieldLength the field width
   * @return the string up to the first NUL, or the whole field if there is none
   */
  public static String getString(byte[] buf, int offset, int fieldLength) {
    int end = offset;
    int limit = offset + fieldLength;
    while (end < limit && buf[end] != 0) {
      end++;
    }
    return new String(buf, offset, end - offset, StandardCharsets.UTF_8);
  }

  /**
   * Writes a 32-bit value little-endian.
   *
   * @param buf    the destination
   * @param offset the offset
   * @param value  the value
   */
  public static void putInt32(byte[] buf, int offset, int value) {
    buf[offset] = (byte) value;
    buf[offset + 1] = (byte) (value >>> 8);
    buf[offset + 2] = (byte) (value >>> 16);
    buf[offset + 3] = (byte) (value >>> 24);
  }

  /**
   * Reads a little-endian 32-bit value.
   *
   * @param buf    the source
   * @param offset the offset
   * @return the int
   */
  public static int getInt32(byte[] buf, int offset) {
    return (buf[offset] & 0xFF)
        | (buf[offset + 1] & 0xFF) << 8
        | (buf[offset + 2] & 0xFF) << 16
        | (buf[offset + 3] & 0xFF) << 24;
  }

  /**
   * Zeroes every non-null array.
   *
   * @param arrays the arrays
   */
  public static void zero(byte[]... arrays) {
    for (byte[] arr : arrays) {
      if (arr != null) {
        Arrays.fill(arr, (byte) 0);
      }
    }
  }
}
