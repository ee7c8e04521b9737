package com.codeheadsystems.p9sk.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void randomBytes_hasRequestedLength() {
    RandomProvider provider = new RandomProvider();
    assertThat(provider.randomBytes(8)).hasSize(8);
    assertThat(provider.randomBytes(0)).isEmpty();
  }

  @Test
  void randomBytes_successiveCallsDiffer() {
    RandomProvider provider = new RandomProvider();
    assertThat(provider.randomBytes(16)).isNotEqualTo(provider.randomBytes(16));
  }

  @Test
  void randomBytes_usesSuppliedSource() throws Exception {
    SecureRandom a = SecureRandom.getInstance("SHA1PRNG");
    a.setSeed(42L);
    SecureRandom b = SecureRandom.getInstance("SHA1PRNG");
    b.setSeed(42L);
    assertThat(new RandomProvider(a).randomBytes(8)).isEqualTo(new RandomProvider(b).randomBytes(8));
  }
}
