package com.codeheadsystems.p9sk.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.engines.DESEngine;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * DES primitives in the form the ticket and authenticator formats use them.
 * <p>
 * Keys are 56-bit ({@value #DESKEYLEN} bytes) and are expanded to the 64-bit DES form with
 * parity bits before use. Buffers longer than one block are enciphered in overlapping 8-byte
 * windows that advance 7 bytes at a time, so every byte after the first is covered by at least
 * one full DES block.
 */
public class DesCipher {

  /**
   * Length of a 56-bit DES key.
   */
  public static final int DESKEYLEN = 7;

  /**
   * Length of an expanded DES key, and of the shared secret derived from a session key.
   */
  public static final int EXPANDED_KEYLEN = 8;

  private static final int BLOCK = 8;
  private static final int STRIDE = 7;
  private static final int MAX_PASSWORD = 27;

  private DesCipher() {
  }

  /**
   * Spreads a 56-bit key over 8 bytes, seven key bits per byte with the low bit set so every
   * byte has odd parity.
   *
   * @param key56 the 7-byte key
   * @return the 8-byte key
   */
  public static byte[] des56to64(byte[] key56) {
    requireKey(key56);
    long bits = 0;
    for (int i = 0; i < DESKEYLEN; i++) {
      bits = (bits << 8) | (key56[i] & 0xFF);
    }
    byte[] key64 = new byte[EXPANDED_KEYLEN];
    for (int i = 0; i < EXPANDED_KEYLEN; i++) {
      int seven = (int) (bits >>> (49 - 7 * i)) & 0x7F;
      key64[i] = (byte) withParity(seven);
    }
    return key64;
  }

  private static int withParity(int seven) {
    return (seven << 1) | ((Integer.bitCount(seven) & 1) == 0 ? 1 : 0);
  }

  /**
   * Enciphers {@code length} bytes of {@code buf} in place.
   *
   * @param key56  the 7-byte key
   * @param buf    the buffer
   * @param offset the start of the region
   * @param length the region length, at least 8
   */
  public static void encrypt(byte[] key56, byte[] buf, int offset, int length) {
    DESEngine engine = engine(key56, true, length);
    int blocks = (length - 1) / STRIDE;
    int remainder = (length - 1) % STRIDE;
    int pos = offset;
    for (int i = 0; i < blocks; i++) {
      engine.processBlock(buf, pos, buf, pos);
      pos += STRIDE;
    }
    if (remainder != 0) {
      int last = pos - STRIDE + remainder;
      engine.processBlock(buf, last, buf, last);
    }
  }

  /**
   * Deciphers {@code length} bytes of {@code buf} in place, undoing {@link #encrypt}.
   *
   * @param key56  the 7-byte key
   * @param buf    the buffer
   * @param offset the start of the region
   * @param length the region length, at least 8
   */
  public static void decrypt(byte[] key56, byte[] buf, int offset, int length) {
    DESEngine engine = engine(key56, false, length);
    int blocks = (length - 1) / STRIDE;
    int remainder = (length - 1) % STRIDE;
    int pos = offset + blocks * STRIDE;
    if (remainder != 0) {
      int last = pos - STRIDE + remainder;
      engine.processBlock(buf, last, buf, last);
    }
    for (int i = 0; i < blocks; i++) {
      pos -= STRIDE;
      engine.processBlock(buf, pos, buf, pos);
    }
  }

  /**
   * Derives a 7-byte key from a password. The first 8 bytes of the space-padded password seed
   * the key; each further 8-byte window is enciphered under the key so far and folded in.
   *
   * @param password the password; bytes past the 27th are ignored
   * @return the 7-byte key
   */
  public static byte[] passToKey(String password) {
    byte[] encoded = password.getBytes(StandardCharsets.UTF_8);
    int n = Math.min(encoded.length, MAX_PASSWORD);
    byte[] buf = new byte[MAX_PASSWORD + 1];
    Arrays.fill(buf, 0, BLOCK, (byte) ' ');
    System.arraycopy(encoded, 0, buf, 0, n);
    buf[n] = 0;

    byte[] key = new byte[DESKEYLEN];
    int t = 0;
    while (true) {
      for (int i = 0; i < DESKEYLEN; i++) {
        key[i] = (byte) (((buf[t + i] & 0xFF) >> i) + ((buf[t + i + 1] & 0xFF) << (8 - (i + 1))));
      }
      if (n <= BLOCK) {
        Arrays.fill(buf, (byte) 0);
        return key;
      }
      n -= BLOCK;
      t += BLOCK;
      if (n < BLOCK) {
        t -= BLOCK - n;
        n = BLOCK;
      }
      encrypt(key, buf, t, BLOCK);
    }
  }

  private static DESEngine engine(byte[] key56, boolean forEncryption, int length) {
    if (length < BLOCK) {
      throw new IllegalArgumentException("Cannot encipher fewer than " + BLOCK + " bytes: " + length);
    }
    byte[] key64 = des56to64(key56);
    DESEngine engine = new DESEngine();
    engine.init(forEncryption, new KeyParameter(key64));
    Arrays.fill(key64, (byte) 0);
    return engine;
  }

  private static void requireKey(byte[] key56) {
    if (key56 == null || key56.length != DESKEYLEN) {
      throw new IllegalArgumentException("DES key must be " + DESKEYLEN + " bytes");
    }
  }
}
