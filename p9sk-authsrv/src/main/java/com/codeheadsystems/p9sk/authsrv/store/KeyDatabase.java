package com.codeheadsystems.p9sk.authsrv.store;

import java.util.Optional;

/**
 * The ticket server's view of its principals: their keys and who may speak for whom.
 * <p>
 * Implementations must be thread-safe.
 */
public interface KeyDatabase {

  /**
   * The 7-byte key of a principal.
   *
   * @param user the user
   * @return a copy of the key the caller must zero when done, or empty if the user is unknown
   */
  Optional<byte[]> key(String user);

  /**
   * Whether {@code host} may obtain tickets that name {@code uid} as the server-side identity.
   * A principal always speaks for itself.
   *
   * @param host the requesting host principal
   * @param uid  the user it claims to speak for
   * @return the boolean
   */
  boolean speaksFor(String host, String uid);
}
