package com.codeheadsystems.p9sk.keystore;

import com.codeheadsystems.p9sk.common.Attributes;
import com.codeheadsystems.p9sk.model.Role;

/**
 * What a session asks the key store for.
 *
 * @param role    the role the key will be used in
 * @param pattern values the key must carry and queries ({@code user?}) it must satisfy
 */
public record KeyQuery(Role role, Attributes pattern) {

  @Override
  public String toString() {
    return "role=" + role.attributeValue() + " " + pattern;
  }
}
