package com.codeheadsystems.p9sk.protocol;

import com.codeheadsystems.p9sk.common.RandomProvider;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Configuration for the protocol engine.
 *
 * @param randomProvider source of channel and ticket request challenges
 * @param keyProto       the {@code proto} attribute keys are looked up under, shared by both variants
 */
public record ProtocolConfig(RandomProvider randomProvider, String keyProto) {

  /**
   * Default configuration: a fresh {@link SecureRandom}, {@code proto=p9sk1} keys.
   */
  public static final ProtocolConfig DEFAULT = new ProtocolConfig(new RandomProvider(), "p9sk1");

  /**
   * Creates a test configuration drawing challenges from a seeded, repeatable source.
   *
   * @param seed the seed
   * @return the protocol config
   */
  public static ProtocolConfig forTesting(long seed) {
    SecureRandom random;
    try {
      random = SecureRandom.getInstance("SHA1PRNG");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA1PRNG unavailable", e);
    }
    random.setSeed(seed);
    return new ProtocolConfig(new RandomProvider(random), "p9sk1");
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   *
   * @param randomProvider the random provider
   * @return the protocol config
   */
  public ProtocolConfig withRandomProvider(RandomProvider randomProvider) {
    return new ProtocolConfig(randomProvider, keyProto);
  }
}
