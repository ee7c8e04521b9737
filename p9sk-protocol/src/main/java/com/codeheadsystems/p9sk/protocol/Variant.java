package com.codeheadsystems.p9sk.protocol;

import java.util.Optional;

/**
 * The two protocol variants.
 * <ul>
 *   <li>P9SK1: full protocol: the initiator sends its own channel challenge first.</li>
 *   <li>P9SK2: flawed simplification: no initiator challenge; both sides use the ticket
 *       request's challenge as the channel challenge, so the initiator has no independent
 *       freshness check on the responder.</li>
 * </ul>
 * Both variants use {@code proto=p9sk1} keys.
 */
public enum Variant {

  P9SK1("p9sk1", "user? !password?"),
  P9SK2("p9sk2", null);

  private final String protocolName;
  private final String keyPrompt;

  Variant(String protocolName, String keyPrompt) {
    this.protocolName = protocolName;
    this.keyPrompt = keyPrompt;
  }

  /**
   * Returns the variant for the given protocol name. Accepted names: {@code "p9sk1"},
   * {@code "p9sk2"}.
   *
   * @param name the name
   * @return the variant
   * @throws IllegalArgumentException for unrecognised names
   */
  public static Variant fromName(String name) {
    for (Variant v : values()) {
      if (v.protocolName.equals(name)) {
        return v;
      }
    }
    throw new IllegalArgumentException("Unknown protocol: " + name + ". Valid values: p9sk1, p9sk2");
  }

  /**
   * The protocol name as negotiated on the wire.
   *
   * @return the string
   */
  public String protocolName() {
    return protocolName;
  }

  /**
   * The attributes a key store asks a person for when no key is on file.
   *
   * @return the prompt template, empty for the flawed variant
   */
  public Optional<String> keyPrompt() {
    return Optional.ofNullable(keyPrompt);
  }

  /**
   * Whether the initiator generates and sends its own channel challenge.
   *
   * @return the boolean
   */
  public boolean initiatorSendsChallenge() {
    return this == P9SK1;
  }
}
