package com.codeheadsystems.p9sk.protocol;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.RandomProvider;
import com.codeheadsystems.p9sk.crypto.DesCipher;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.Ticket;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import com.codeheadsystems.p9sk.ticket.TicketService;
import java.util.HashMap;
import java.util.Map;

/**
 * Issues tickets from its own table of user keys, the way a ticket server does.
 */
class TestIssuer implements TicketService {

  private final Map<String, byte[]> keys = new HashMap<>();
  private final RandomProvider random = new RandomProvider();
  private byte[] lastSessionKey;

  TestIssuer user(String name, String password) {
    keys.put(name, DesCipher.passToKey(password));
    return this;
  }

  byte[] lastSessionKey() {
    return lastSessionKey;
  }

  @Override
  public TicketPair getTickets(TicketRequest request, byte[] clientKey) {
    byte[] sessionKey = random.randomBytes(WireCodec.DESKEYLEN);
    lastSessionKey = sessionKey.clone();
    Ticket tc = new Ticket(AuthType.CLIENT_TICKET.code(), request.challenge(),
        request.hostId(), request.uid(), sessionKey);
    Ticket ts = new Ticket(AuthType.SERVER_TICKET.code(), request.challenge(),
        request.hostId(), request.uid(), sessionKey);
    return new TicketPair(
        WireCodec.encodeTicket(tc, keys.get(request.hostId())),
        WireCodec.encodeTicket(ts, keys.get(request.authId())));
  }
}
