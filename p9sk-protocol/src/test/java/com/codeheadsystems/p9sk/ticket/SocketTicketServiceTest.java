package com.codeheadsystems.p9sk.ticket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.exceptions.TicketAcquisitionException;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SocketTicketServiceTest {

  private static final byte[] CHAL = {1, 1, 2, 3, 5, 8, 13, 21};
  private static final TicketRequest REQUEST =
      new TicketRequest(AuthType.TICKET_REQUEST.code(), "fs", "example", CHAL, "bob", "bob");

  private ServerSocket listener;
  private ExecutorService executor;

  @BeforeEach
  void setUp() throws IOException {
    listener = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() throws IOException {
    executor.shutdownNow();
    listener.close();
  }

  private SocketTicketService service(Duration readTimeout) {
    return new SocketTicketService(new TicketServiceConfig(
        listener.getInetAddress().getHostAddress(), listener.getLocalPort(), Duration.ofSeconds(5), readTimeout));
  }

  /**
   * Accepts one connection, captures the request, and answers with {@code reply}.
   */
  private Future<byte[]> answerOnce(byte[] reply) {
    return executor.submit(() -> {
      try (Socket socket = listener.accept()) {
        byte[] request = socket.getInputStream().readNBytes(WireCodec.TICKREQLEN);
        socket.getOutputStream().write(reply);
        socket.getOutputStream().flush();
        return request;
      }
    });
  }

  @Test
  void getTickets_ok() throws Exception {
    byte[] tc = new byte[WireCodec.TICKETLEN];
    byte[] ts = new byte[WireCodec.TICKETLEN];
    Arrays.fill(tc, (byte) 'c');
    Arrays.fill(ts, (byte) 's');
    Future<byte[]> sent = answerOnce(ByteUtils.concat(new byte[]{(byte) AuthType.OK.code()}, tc, ts));

    TicketPair pair = service(Duration.ofSeconds(5)).getTickets(REQUEST, new byte[7]);

    assertThat(pair.clientTicket()).isEqualTo(tc);
    assertThat(pair.serverTicket()).isEqualTo(ts);
    assertThat(sent.get(5, TimeUnit.SECONDS)).isEqualTo(WireCodec.encodeTicketRequest(REQUEST));
  }

  @Test
  void getTickets_remoteError() {
    byte[] error = new byte[1 + WireCodec.ERRMAX];
    error[0] = (byte) AuthType.ERROR.code();
    ByteUtils.putString(error, 1, "no such user", WireCodec.ERRMAX);
    answerOnce(error);

    assertThatThrownBy(() -> service(Duration.ofSeconds(5)).getTickets(REQUEST, new byte[7]))
        .isInstanceOf(TicketAcquisitionException.class)
        .hasMessage("remote: no such user");
  }

  @Test
  void getTickets_unexpectedStatus() {
    answerOnce(new byte[]{9});

    assertThatThrownBy(() -> service(Duration.ofSeconds(5)).getTickets(REQUEST, new byte[7]))
        .isInstanceOf(TicketAcquisitionException.class)
        .hasMessageContaining("auth protocol botch");
  }

  @Test
  void getTickets_shortReply() {
    answerOnce(new byte[]{(byte) AuthType.OK.code(), 1, 2, 3});

    assertThatThrownBy(() -> service(Duration.ofSeconds(5)).getTickets(REQUEST, new byte[7]))
        .isInstanceOf(TicketAcquisitionException.class)
        .hasMessageContaining("short ticket reply");
  }

  @Test
  void getTickets_readTimeout() {
    executor.submit(() -> {
      try (Socket socket = listener.accept()) {
        socket.getInputStream().readNBytes(WireCodec.TICKREQLEN);
        Thread.sleep(2000);
      }
      return null;
    });

    assertThatThrownBy(() -> service(Duration.ofMillis(200)).getTickets(REQUEST, new byte[7]))
        .isInstanceOf(TicketAcquisitionException.class)
        .hasMessageContaining("timed out")
        .hasCauseInstanceOf(SocketTimeoutException.class);
  }

  @Test
  void getTickets_unreachable() throws IOException {
    int port = listener.getLocalPort();
    listener.close();
    SocketTicketService service = new SocketTicketService(
        TicketServiceConfig.forHost(InetAddress.getLoopbackAddress().getHostAddress(), port));

    assertThatThrownBy(() -> service.getTickets(REQUEST, new byte[7]))
        .isInstanceOf(TicketAcquisitionException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void config_defaults() {
    TicketServiceConfig config = TicketServiceConfig.forHost("auth.example");

    assertThat(config.port()).isEqualTo(567);
    assertThat(config.readTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.connectTimeout()).isEqualTo(Duration.ofSeconds(30));
  }
}
