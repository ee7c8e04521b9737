package com.codeheadsystems.p9sk.authsrv.issuer;

/**
 * The issuer will not mint tickets for a request. The message is sent to the requester, so it
 * names the problem without revealing key material.
 */
public class TicketRefusedException extends RuntimeException {

  /**
   * Instantiates a new Ticket refused exception.
   *
   * @param message the reason, truncated on the wire to the error field
   */
  public TicketRefusedException(final String message) {
    super(message);
  }
}
