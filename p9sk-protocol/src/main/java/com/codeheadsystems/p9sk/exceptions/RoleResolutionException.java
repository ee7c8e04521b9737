package com.codeheadsystems.p9sk.exceptions;

/**
 * The role attribute is missing or names neither client nor server.
 */
public class RoleResolutionException extends P9skException {

  /**
   * Instantiates a new Role resolution exception.
   *
   * @param message the message
   */
  public RoleResolutionException(final String message) {
    super(message);
  }
}
