package com.codeheadsystems.p9sk.model;

/**
 * Type codes carried in the first byte of every wire structure.
 */
public enum AuthType {

  TICKET_REQUEST(1),
  OK(4),
  ERROR(5),
  SERVER_TICKET(64),
  CLIENT_TICKET(65),
  SERVER_AUTHENTICATOR(66),
  CLIENT_AUTHENTICATOR(67);

  private final int code;

  AuthType(int code) {
    this.code = code;
  }

  /**
   * The on-the-wire value.
   *
   * @return the int
   */
  public int code() {
    return code;
  }

  /**
   * Returns true when {@code code} is this type's wire value.
   *
   * @param code the unsigned first byte of a structure
   * @return the boolean
   */
  public boolean matches(int code) {
    return this.code == code;
  }
}
