package com.codeheadsystems.p9sk.authsrv.server;

import com.codeheadsystems.p9sk.authsrv.issuer.TicketIssuer;
import com.codeheadsystems.p9sk.authsrv.issuer.TicketRefusedException;
import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers ticket requests over TCP, one request per connection.
 * <p>
 * The reply is {@link AuthType#OK} followed by the client and server tickets, or
 * {@link AuthType#ERROR} followed by a NUL-padded reason of {@value WireCodec#ERRMAX} bytes.
 * A connection that does not deliver a full request within the read timeout is dropped
 * without a reply.
 */
public class TicketServer {

  private static final Logger log = LoggerFactory.getLogger(TicketServer.class);

  private final TicketIssuer issuer;
  private final InetAddress bindAddress;
  private final int port;
  private final int readTimeoutMillis;
  private final ExecutorService workers;

  private volatile ServerSocket listener;
  private Thread acceptor;
  private boolean stopped;

  /**
   * Instantiates a new Ticket server.
   *
   * @param issuer            the issuer
   * @param bindAddress       the address to listen on
   * @param port              the port, 0 for an ephemeral one
   * @param readTimeoutMillis how long to wait for a request
   * @param workerThreads     connections served concurrently
   */
  public TicketServer(final TicketIssuer issuer,
                      final InetAddress bindAddress,
                      final int port,
                      final int readTimeoutMillis,
                      final int workerThreads) {
    this.issuer = issuer;
    this.bindAddress = bindAddress;
    this.port = port;
    this.readTimeoutMillis = readTimeoutMillis;
    AtomicInteger counter = new AtomicInteger();
    this.workers = Executors.newFixedThreadPool(workerThreads, r -> {
      Thread t = new Thread(r, "ticket-worker-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  /**
   * Binds the listening socket and starts accepting connections.
   *
   * @throws IOException           if the socket cannot be bound
   * @throws IllegalStateException if already started, or stopped
   */
  public synchronized void start() throws IOException {
    if (listener != null || stopped) {
      throw new IllegalStateException("TicketServer already started");
    }
    ServerSocket socket = new ServerSocket();
    socket.setReuseAddress(true);
    socket.bind(new InetSocketAddress(bindAddress, port));
    listener = socket;
    acceptor = new Thread(this::acceptLoop, "ticket-acceptor");
    acceptor.start();
    log.info("TicketServer listening on {}:{}", bindAddress.getHostAddress(), socket.getLocalPort());
  }

  /**
   * The bound port.
   *
   * @return the int
   * @throws IllegalStateException if not started
   */
  public int localPort() {
    ServerSocket socket = listener;
    if (socket == null) {
      throw new IllegalStateException("TicketServer not started");
    }
    return socket.getLocalPort();
  }

  /**
   * Stops accepting, lets in-flight requests finish for up to five seconds, then returns.
   * Calling stop on a stopped server has no effect.
   */
  public synchronized void stop() {
    ServerSocket socket = listener;
    if (socket == null) {
      return;
    }
    listener = null;
    stopped = true;
    try {
      socket.close();
    } catch (IOException e) {
      log.warn("Error closing listener", e);
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
      acceptor.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("TicketServer stopped");
  }

  private void acceptLoop() {
    ServerSocket socket = listener;
    while (socket != null && !socket.isClosed()) {
      Socket connection;
      try {
        connection = socket.accept();
      } catch (SocketException e) {
        // listener closed by stop()
        break;
      } catch (IOException e) {
        log.warn("accept failed", e);
        continue;
      }
      try {
        workers.execute(() -> handle(connection));
      } catch (RejectedExecutionException e) {
        log.warn("Dropping connection from {}: server stopping", connection.getRemoteSocketAddress());
        closeQuietly(connection);
      }
    }
  }

  private void handle(Socket connection) {
    try (connection) {
      connection.setSoTimeout(readTimeoutMillis);
      byte[] buf = connection.getInputStream().readNBytes(WireCodec.TICKREQLEN);
      if (buf.length != WireCodec.TICKREQLEN) {
        log.warn("Short ticket request from {} ({} bytes)", connection.getRemoteSocketAddress(), buf.length);
        return;
      }
      TicketRequest request = WireCodec.decodeTicketRequest(buf, 0);
      OutputStream out = connection.getOutputStream();
      try {
        TicketPair pair = issuer.issue(request);
        out.write(AuthType.OK.code());
        out.write(WireCodec.encodeTicketPair(pair));
      } catch (TicketRefusedException e) {
        log.warn("Refused ticket request from {}: {}", connection.getRemoteSocketAddress(), e.getMessage());
        out.write(errorReply(e.getMessage()));
      }
      out.flush();
    } catch (SocketTimeoutException e) {
      log.warn("Timed out waiting for ticket request");
    } catch (IOException e) {
      log.warn("Ticket request connection failed", e);
    }
  }

  static byte[] errorReply(String message) {
    byte[] reply = new byte[1 + WireCodec.ERRMAX];
    reply[0] = (byte) AuthType.ERROR.code();
    ByteUtils.putString(reply, 1, message, WireCodec.ERRMAX);
    return reply;
  }

  private static void closeQuietly(Socket connection) {
    try {
      connection.close();
    } catch (IOException e) {
      log.debug("Error closing rejected connection", e);
    }
  }
}
