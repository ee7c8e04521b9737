package com.codeheadsystems.p9sk.protocol;

import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.model.SessionResult;
import com.codeheadsystems.p9sk.model.Ticket;
import com.codeheadsystems.p9sk.model.TicketRequest;

/**
 * Per-phase session data. Each state carries only what is valid in its phase.
 */
sealed interface SessionState {

  Phase phase();

  /**
   * The channel challenge known in this phase, or null.
   */
  default byte[] channelChallenge() {
    return null;
  }

  /**
   * Zeroes secret material held by this state.
   */
  default void wipe() {
  }

  record ClientHaveChallenge(byte[] channelChallenge) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.CLIENT_HAVE_CHALLENGE;
    }
  }

  /**
   * {@code channelChallenge} is null for p9sk2 until the ticket request supplies it.
   */
  record ClientNeedTicketRequest(byte[] channelChallenge) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.CLIENT_NEED_TICKET_REQUEST;
    }
  }

  /**
   * {@code outgoing} is the server ticket followed by the client authenticator.
   */
  record ClientHaveTicket(byte[] channelChallenge, Ticket ticket, byte[] outgoing) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.CLIENT_HAVE_TICKET;
    }

    @Override
    public void wipe() {
      ByteUtils.zero(ticket.key());
    }
  }

  record ClientNeedServerAuthenticator(byte[] channelChallenge, Ticket ticket) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.CLIENT_NEED_SERVER_AUTHENTICATOR;
    }

    @Override
    public void wipe() {
      ByteUtils.zero(ticket.key());
    }
  }

  record ServerNeedChallenge(TicketRequest request) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.SERVER_NEED_CHALLENGE;
    }
  }

  record ServerHaveTicketRequest(TicketRequest request, byte[] channelChallenge) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.SERVER_HAVE_TICKET_REQUEST;
    }
  }

  record ServerNeedTicket(TicketRequest request, byte[] channelChallenge) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.SERVER_NEED_TICKET;
    }
  }

  /**
   * {@code authenticator} is the enciphered server authenticator waiting to be read.
   */
  record ServerHaveAuthenticator(Ticket ticket, byte[] authenticator) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.SERVER_HAVE_AUTHENTICATOR;
    }

    @Override
    public void wipe() {
      ByteUtils.zero(ticket.key());
    }
  }

  record Established(SessionResult result) implements SessionState {
    @Override
    public Phase phase() {
      return Phase.ESTABLISHED;
    }

    @Override
    public void wipe() {
      ByteUtils.zero(result.secret());
    }
  }
}
