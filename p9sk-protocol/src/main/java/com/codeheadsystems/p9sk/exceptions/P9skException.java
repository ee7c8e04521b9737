package com.codeheadsystems.p9sk.exceptions;

/**
 * Base type for every failure the protocol engine reports. None of them are retried by the
 * engine; the caller decides whether to abandon the session or start a new one.
 */
public abstract class P9skException extends RuntimeException {

  /**
   * Instantiates a new P9sk exception.
   *
   * @param message the message
   */
  protected P9skException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new P9sk exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  protected P9skException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
