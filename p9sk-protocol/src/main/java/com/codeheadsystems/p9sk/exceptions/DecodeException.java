package com.codeheadsystems.p9sk.exceptions;

/**
 * A wire structure from the peer is malformed. Fatal to the session.
 */
public class DecodeException extends P9skException {

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   */
  public DecodeException(final String message) {
    super(message);
  }
}
