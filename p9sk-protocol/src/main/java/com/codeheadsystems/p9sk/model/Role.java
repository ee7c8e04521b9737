package com.codeheadsystems.p9sk.model;

import java.util.Optional;

/**
 * Which side of the handshake a session plays.
 */
public enum Role {

  /**
   * The initiator: fetches tickets and presents them.
   */
  CLIENT("client"),

  /**
   * The responder: issues the ticket request and checks the ticket.
   */
  SERVER("server");

  private final String attributeValue;

  Role(String attributeValue) {
    this.attributeValue = attributeValue;
  }

  /**
   * The value of the {@code role} attribute naming this role.
   *
   * @return the string
   */
  public String attributeValue() {
    return attributeValue;
  }

  /**
   * Resolves a {@code role} attribute value.
   *
   * @param value the value, may be null
   * @return the role, or empty if the value is null or unrecognized
   */
  public static Optional<Role> fromAttribute(String value) {
    for (Role role : values()) {
      if (role.attributeValue.equals(value)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
