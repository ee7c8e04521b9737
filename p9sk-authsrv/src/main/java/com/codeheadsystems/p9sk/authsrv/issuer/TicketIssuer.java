package com.codeheadsystems.p9sk.authsrv.issuer;

import com.codeheadsystems.p9sk.authsrv.store.KeyDatabase;
import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.common.RandomProvider;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.Ticket;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints ticket pairs.
 * <p>
 * For a request from {@code hostid} to reach {@code authid} as {@code uid}, both tickets carry
 * the request challenge, {@code cuid = hostid}, {@code suid = uid} and a fresh session key. The
 * client ticket is enciphered under the hostid's key and the server ticket under the authid's
 * key, so each side can open only its own.
 */
public class TicketIssuer {

  private static final Logger log = LoggerFactory.getLogger(TicketIssuer.class);

  private final KeyDatabase keyDatabase;
  private final String authDomain;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Ticket issuer.
   *
   * @param keyDatabase    the key database
   * @param authDomain     the only domain this issuer serves
   * @param randomProvider source of session keys
   */
  public TicketIssuer(final KeyDatabase keyDatabase,
                      final String authDomain,
                      final RandomProvider randomProvider) {
    this.keyDatabase = keyDatabase;
    this.authDomain = authDomain;
    this.randomProvider = randomProvider;
  }

  /**
   * Checks a ticket request and mints its ticket pair.
   *
   * @param request the request
   * @return the enciphered client and server tickets
   * @throws TicketRefusedException if the request is not one this issuer will honor
   */
  public TicketPair issue(TicketRequest request) {
    if (!AuthType.TICKET_REQUEST.matches(request.type())) {
      throw new TicketRefusedException("bad ticket request type " + request.type());
    }
    if (!authDomain.equals(request.authDomain())) {
      throw new TicketRefusedException("unknown auth domain " + request.authDomain());
    }
    byte[] hostKey = keyDatabase.key(request.hostId())
        .orElseThrow(() -> new TicketRefusedException("unknown host " + request.hostId()));
    byte[] authKey = null;
    byte[] sessionKey = null;
    try {
      authKey = keyDatabase.key(request.authId())
          .orElseThrow(() -> new TicketRefusedException("unknown authid " + request.authId()));
      if (!keyDatabase.speaksFor(request.hostId(), request.uid())) {
        throw new TicketRefusedException(request.hostId() + " cannot speak for " + request.uid());
      }
      sessionKey = randomProvider.randomBytes(WireCodec.DESKEYLEN);
      Ticket clientTicket = new Ticket(AuthType.CLIENT_TICKET.code(), request.challenge(),
          request.hostId(), request.uid(), sessionKey);
      Ticket serverTicket = new Ticket(AuthType.SERVER_TICKET.code(), request.challenge(),
          request.hostId(), request.uid(), sessionKey);
      TicketPair pair = new TicketPair(
          WireCodec.encodeTicket(clientTicket, hostKey),
          WireCodec.encodeTicket(serverTicket, authKey));
      log.info("Issued tickets: host={} uid={} authid={}", request.hostId(), request.uid(), request.authId());
      return pair;
    } finally {
      ByteUtils.zero(hostKey, authKey, sessionKey);
    }
  }
}
