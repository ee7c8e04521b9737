package com.codeheadsystems.p9sk.exceptions;

/**
 * An operation was invoked in a phase that does not accept it. The session is unchanged.
 */
public class PhaseException extends P9skException {

  private final String phase;
  private final String operation;

  /**
   * Instantiates a new Phase exception.
   *
   * @param phase     the current phase name
   * @param operation the rejected operation
   */
  public PhaseException(final String phase, final String operation) {
    super("Protocol phase error: " + operation + " in state " + phase);
    this.phase = phase;
    this.operation = operation;
  }

  /**
   * The phase the session was in.
   *
   * @return the string
   */
  public String phase() {
    return phase;
  }

  /**
   * The operation that was refused.
   *
   * @return the string
   */
  public String operation() {
    return operation;
  }
}
