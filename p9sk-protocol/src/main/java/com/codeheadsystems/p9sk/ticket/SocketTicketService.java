package com.codeheadsystems.p9sk.ticket;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.exceptions.TicketAcquisitionException;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TicketService} that asks a remote issuer over TCP.
 * <p>
 * One connection per request: the ticket request goes out as-is, and the reply is a status byte
 * followed by either both tickets ({@link AuthType#OK}) or a NUL-padded error text
 * ({@link AuthType#ERROR}). Timeouts and I/O errors surface as
 * {@link TicketAcquisitionException}; nothing is retried.
 */
public class SocketTicketService implements TicketService {

  private static final Logger log = LoggerFactory.getLogger(SocketTicketService.class);

  private final TicketServiceConfig config;

  /**
   * Instantiates a new Socket ticket service.
   *
   * @param config the config
   */
  public SocketTicketService(final TicketServiceConfig config) {
    this.config = config;
  }

  @Override
  public TicketPair getTickets(TicketRequest request, byte[] clientKey) {
    log.debug("getTickets(authdom={}, host={}:{})", request.authDomain(), config.host(), config.port());
    byte[] encoded = WireCodec.encodeTicketRequest(request);
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(config.host(), config.port()),
          (int) config.connectTimeout().toMillis());
      socket.setSoTimeout((int) config.readTimeout().toMillis());
      OutputStream out = socket.getOutputStream();
      out.write(encoded);
      out.flush();
      return readReply(socket.getInputStream());
    } catch (SocketTimeoutException e) {
      throw new TicketAcquisitionException("timed out talking to ticket service " + endpoint(), e);
    } catch (IOException e) {
      throw new TicketAcquisitionException("cannot reach ticket service " + endpoint(), e);
    }
  }

  private TicketPair readReply(InputStream in) throws IOException {
    int status = in.read();
    if (status < 0) {
      throw new TicketAcquisitionException("auth protocol botch: connection closed by " + endpoint());
    }
    if (AuthType.OK.matches(status)) {
      byte[] tickets = in.readNBytes(2 * WireCodec.TICKETLEN);
      if (tickets.length != 2 * WireCodec.TICKETLEN) {
        throw new TicketAcquisitionException("auth protocol botch: short ticket reply from " + endpoint());
      }
      return WireCodec.decodeTicketPair(tickets, 0);
    }
    if (AuthType.ERROR.matches(status)) {
      byte[] error = in.readNBytes(WireCodec.ERRMAX);
      if (error.length != WireCodec.ERRMAX) {
        throw new TicketAcquisitionException("auth protocol botch: short error reply from " + endpoint());
      }
      throw new TicketAcquisitionException("remote: " + ByteUtils.getString(error, 0, WireCodec.ERRMAX));
    }
    throw new TicketAcquisitionException("auth protocol botch: unexpected status " + status + " from " + endpoint());
  }

  private String endpoint() {
    return config.host() + ":" + config.port();
  }
}
