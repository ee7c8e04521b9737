package com.codeheadsystems.p9sk.common;

import java.security.SecureRandom;

/**
 * Source of challenges and session keys. Sessions and issuers take one through their config so
 * tests can substitute a seeded generator and replay a handshake byte for byte.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Uses the platform's default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Fresh random bytes, e.g. {@code CHALLEN} for a challenge or {@code DESKEYLEN} for a key.
   *
   * @param length how many bytes
   * @return the byte [ ]
   */
  public byte[] randomBytes(int length) {
    byte[] bytes = new byte[length];
    random.nextBytes(bytes);
    return bytes;
  }
}
