package com.codeheadsystems.p9sk.model;

/**
 * TicketRequest: what the responder asks the initiator to fetch from the ticket service.
 * Wire format: type || authId || authDomain || challenge || hostId || uid (141 bytes, clear).
 *
 * @param type       the type code, {@link AuthType#TICKET_REQUEST} when well formed
 * @param authId     the responder's identity
 * @param authDomain the responder's authentication domain
 * @param challenge  the responder's challenge
 * @param hostId     the requesting host's identity, empty until the initiator fills it
 * @param uid        the user the initiator speaks as, empty until the initiator fills it
 */
public record TicketRequest(int type, String authId, String authDomain, byte[] challenge,
                            String hostId, String uid) {

  /**
   * Returns a copy naming the initiator that will present the ticket.
   *
   * @param hostId the host id
   * @param uid    the uid
   * @return the ticket request
   */
  public TicketRequest withRequester(String hostId, String uid) {
    return new TicketRequest(type, authId, authDomain, challenge, hostId, uid);
  }
}
