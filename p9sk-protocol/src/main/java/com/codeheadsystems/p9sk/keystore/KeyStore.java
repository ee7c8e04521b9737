package com.codeheadsystems.p9sk.keystore;

import com.codeheadsystems.p9sk.exceptions.KeyResolutionException;

/**
 * Resolves an identity and domain to secret key material.
 * <p>
 * Every {@link #acquire} hands out a record owned by the caller until it is passed back to
 * {@link #release}. Records are never shared between callers. Implementations must be
 * thread-safe; sessions acquiring keys are not.
 */
public interface KeyStore {

  /**
   * Finds a key matching the query and hands out an exclusively owned record for it.
   *
   * @param query the query
   * @return the key record
   * @throws KeyResolutionException if no key matches
   */
  KeyRecord acquire(KeyQuery query);

  /**
   * Returns a record obtained from {@link #acquire}. Its private key material is zeroed.
   *
   * @param record the record
   */
  void release(KeyRecord record);
}
