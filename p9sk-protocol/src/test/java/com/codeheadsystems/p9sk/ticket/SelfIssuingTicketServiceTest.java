package com.codeheadsystems.p9sk.ticket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.RandomProvider;
import com.codeheadsystems.p9sk.crypto.DesCipher;
import com.codeheadsystems.p9sk.exceptions.TicketAcquisitionException;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.Ticket;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import org.junit.jupiter.api.Test;

class SelfIssuingTicketServiceTest {

  private static final byte[] CHAL = {8, 7, 6, 5, 4, 3, 2, 1};
  private static final byte[] KEY = DesCipher.passToKey("hostpw");

  private final SelfIssuingTicketService service = new SelfIssuingTicketService(new RandomProvider());

  @Test
  void getTickets_mintsBothTicketsUnderTheSharedKey() {
    TicketRequest request = new TicketRequest(AuthType.TICKET_REQUEST.code(), "host", "example", CHAL, "host", "host");

    TicketPair pair = service.getTickets(request, KEY);
    Ticket client = WireCodec.decodeTicket(pair.clientTicket(), 0, KEY);
    Ticket server = WireCodec.decodeTicket(pair.serverTicket(), 0, KEY);

    assertThat(client.type()).isEqualTo(AuthType.CLIENT_TICKET.code());
    assertThat(server.type()).isEqualTo(AuthType.SERVER_TICKET.code());
    assertThat(client.challenge()).isEqualTo(CHAL);
    assertThat(server.challenge()).isEqualTo(CHAL);
    assertThat(client.clientUser()).isEqualTo("host");
    assertThat(client.serverUser()).isEqualTo("host");
    assertThat(client.key()).isEqualTo(server.key()).hasSize(WireCodec.DESKEYLEN);
  }

  @Test
  void getTickets_freshSessionKeyEachTime() {
    TicketRequest request = new TicketRequest(AuthType.TICKET_REQUEST.code(), "host", "example", CHAL, "host", "host");

    Ticket first = WireCodec.decodeTicket(service.getTickets(request, KEY).clientTicket(), 0, KEY);
    Ticket second = WireCodec.decodeTicket(service.getTickets(request, KEY).clientTicket(), 0, KEY);

    assertThat(first.key()).isNotEqualTo(second.key());
  }

  @Test
  void getTickets_refusesForeignResponder() {
    TicketRequest request = new TicketRequest(AuthType.TICKET_REQUEST.code(), "fs", "example", CHAL, "host", "host");

    assertThatThrownBy(() -> service.getTickets(request, KEY))
        .isInstanceOf(TicketAcquisitionException.class)
        .hasMessageContaining("cannot self-issue");
  }
}
