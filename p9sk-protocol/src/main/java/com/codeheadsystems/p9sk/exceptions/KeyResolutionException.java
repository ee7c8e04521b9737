package com.codeheadsystems.p9sk.exceptions;

/**
 * The key store has no usable key for the requested identity and domain.
 */
public class KeyResolutionException extends P9skException {

  /**
   * Instantiates a new Key resolution exception.
   *
   * @param message the message
   */
  public KeyResolutionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Key resolution exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyResolutionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
