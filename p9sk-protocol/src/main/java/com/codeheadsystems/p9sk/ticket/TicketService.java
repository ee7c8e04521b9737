package com.codeheadsystems.p9sk.ticket;

import com.codeheadsystems.p9sk.exceptions.TicketAcquisitionException;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;

/**
 * Obtains a ticket pair from a trusted issuer on behalf of the initiator.
 * <p>
 * This is the only step of a handshake that may touch the network. Implementations own their
 * timeout policy and must not retry behind the caller's back: any failure is reported as a
 * {@link TicketAcquisitionException} and ends the session attempt.
 */
public interface TicketService {

  /**
   * Fetches the client and server tickets for a request.
   *
   * @param request   the ticket request, with hostId and uid naming the initiator
   * @param clientKey the initiator's 7-byte key
   * @return the enciphered ticket pair
   * @throws TicketAcquisitionException if the exchange fails for any reason
   */
  TicketPair getTickets(TicketRequest request, byte[] clientKey);
}
