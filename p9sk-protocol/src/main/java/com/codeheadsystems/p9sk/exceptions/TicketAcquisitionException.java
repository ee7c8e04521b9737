package com.codeheadsystems.p9sk.exceptions;

/**
 * Fetching tickets from the issuing service failed. Fatal to the current session attempt.
 */
public class TicketAcquisitionException extends P9skException {

  /**
   * Instantiates a new Ticket acquisition exception.
   *
   * @param message the message
   */
  public TicketAcquisitionException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Ticket acquisition exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TicketAcquisitionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
