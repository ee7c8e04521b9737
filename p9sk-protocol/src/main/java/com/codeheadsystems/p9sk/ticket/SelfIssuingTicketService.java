package com.codeheadsystems.p9sk.ticket;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.RandomProvider;
import com.codeheadsystems.p9sk.exceptions.TicketAcquisitionException;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.Ticket;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TicketService} for an initiator that already holds the responder's key, i.e. the
 * request's authId and hostId name the same principal. Both tickets are minted locally under
 * that key with a fresh session key, without contacting an issuer.
 */
public class SelfIssuingTicketService implements TicketService {

  private static final Logger log = LoggerFactory.getLogger(SelfIssuingTicketService.class);

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Self issuing ticket service.
   *
   * @param randomProvider the random provider
   */
  public SelfIssuingTicketService(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  @Override
  public TicketPair getTickets(TicketRequest request, byte[] clientKey) {
    if (!request.authId().equals(request.hostId())) {
      throw new TicketAcquisitionException(
          "cannot self-issue: " + request.hostId() + " does not hold the key of " + request.authId());
    }
    log.debug("Self-issuing tickets for {}", request.uid());
    byte[] sessionKey = randomProvider.randomBytes(WireCodec.DESKEYLEN);
    try {
      Ticket clientTicket = new Ticket(AuthType.CLIENT_TICKET.code(), request.challenge(),
          request.uid(), request.uid(), sessionKey);
      Ticket serverTicket = new Ticket(AuthType.SERVER_TICKET.code(), request.challenge(),
          request.uid(), request.uid(), sessionKey);
      return new TicketPair(
          WireCodec.encodeTicket(clientTicket, clientKey),
          WireCodec.encodeTicket(serverTicket, clientKey));
    } finally {
      Arrays.fill(sessionKey, (byte) 0);
    }
  }
}
