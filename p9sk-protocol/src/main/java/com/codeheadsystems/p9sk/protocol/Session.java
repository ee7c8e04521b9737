package com.codeheadsystems.p9sk.protocol;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.Attributes;
import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.crypto.DesCipher;
import com.codeheadsystems.p9sk.exceptions.BufferTooSmallException;
import com.codeheadsystems.p9sk.exceptions.DecodeException;
import com.codeheadsystems.p9sk.exceptions.KeyResolutionException;
import com.codeheadsystems.p9sk.exceptions.P9skException;
import com.codeheadsystems.p9sk.exceptions.PhaseException;
import com.codeheadsystems.p9sk.exceptions.TicketAcquisitionException;
import com.codeheadsystems.p9sk.keystore.KeyQuery;
import com.codeheadsystems.p9sk.keystore.KeyRecord;
import com.codeheadsystems.p9sk.keystore.KeyStore;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.Authenticator;
import com.codeheadsystems.p9sk.model.Role;
import com.codeheadsystems.p9sk.model.SessionResult;
import com.codeheadsystems.p9sk.model.Ticket;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import com.codeheadsystems.p9sk.protocol.SessionState.ClientHaveChallenge;
import com.codeheadsystems.p9sk.protocol.SessionState.ClientHaveTicket;
import com.codeheadsystems.p9sk.protocol.SessionState.ClientNeedServerAuthenticator;
import com.codeheadsystems.p9sk.protocol.SessionState.ClientNeedTicketRequest;
import com.codeheadsystems.p9sk.protocol.SessionState.Established;
import com.codeheadsystems.p9sk.protocol.SessionState.ServerHaveAuthenticator;
import com.codeheadsystems.p9sk.protocol.SessionState.ServerHaveTicketRequest;
import com.codeheadsystems.p9sk.protocol.SessionState.ServerNeedChallenge;
import com.codeheadsystems.p9sk.protocol.SessionState.ServerNeedTicket;
import com.codeheadsystems.p9sk.ticket.TicketService;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One side of one p9sk1/p9sk2 handshake.
 * <p>
 * The caller alternates {@link #read} and {@link #write} as {@link #phase()} dictates, moving
 * each message to and from the peer, until the phase is {@link Phase#ESTABLISHED}. Every call
 * either completes its phase and advances, or throws and leaves the phase unchanged. After a
 * failure other than {@link PhaseException} or {@link BufferTooSmallException} the handshake
 * cannot be resumed; close the session and start a new one.
 * <p>
 * Not thread-safe: a session belongs to exactly one connection and its calls must be serialized.
 * Create one session per connection through {@link P9skProtocol}.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@link PhaseException}: the operation does not apply to the current phase</li>
 *   <li>{@link BufferTooSmallException}: the buffer is shorter than the phase's message</li>
 *   <li>{@link DecodeException}: the peer's ticket request is malformed</li>
 *   <li>{@link KeyResolutionException}: no client key for the responder's domain</li>
 *   <li>{@link TicketAcquisitionException}: the ticket service failed</li>
 *   <li>{@link SecurityException}: a ticket or authenticator does not prove what this phase
 *       requires: wrong type, wrong challenge, or wrong key</li>
 * </ul>
 */
public class Session implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Session.class);

  private final Variant variant;
  private final Role role;
  private final Attributes attributes;
  private final KeyStore keyStore;
  private final TicketService ticketService;
  private final String keyProto;

  private SessionState state;
  private KeyRecord key;
  private boolean closed;

  Session(Variant variant,
          Role role,
          Attributes attributes,
          SessionState initial,
          KeyRecord key,
          KeyStore keyStore,
          TicketService ticketService,
          String keyProto) {
    this.variant = variant;
    this.role = role;
    this.attributes = attributes;
    this.state = initial;
    this.key = key;
    this.keyStore = keyStore;
    this.ticketService = ticketService;
    this.keyProto = keyProto;
    log.debug("{} {} session starts in {}", variant.protocolName(), role.attributeValue(), initial.phase());
  }

  // ─── Accessors ───────────────────────────────────────────────────────────────

  public Variant variant() {
    return variant;
  }

  public Role role() {
    return role;
  }

  public Phase phase() {
    return state.phase();
  }

  /**
   * The number of bytes the current phase reads or writes.
   *
   * @return the int
   */
  public int requiredSize() {
    return state.phase().messageLength();
  }

  public boolean isEstablished() {
    return state.phase() == Phase.ESTABLISHED;
  }

  /**
   * The handshake result, present once the session is established and until it is closed.
   * Closing zeroes the secret of any result already handed out.
   *
   * @return the session result
   */
  public Optional<SessionResult> result() {
    if (closed) {
      return Optional.empty();
    }
    return state instanceof Established established
        ? Optional.of(established.result())
        : Optional.empty();
  }

  /**
   * A copy of the channel challenge this side will check the peer's final proof against, if
   * known yet. A p9sk2 client has none until it has seen the ticket request.
   *
   * @return the challenge
   */
  public Optional<byte[]> channelChallenge() {
    return Optional.ofNullable(state.channelChallenge()).map(byte[]::clone);
  }

  // ─── Read ────────────────────────────────────────────────────────────────────

  /**
   * Produces the current phase's outgoing message into a new array.
   *
   * @return the message
   */
  public byte[] read() {
    byte[] out = new byte[Math.max(requiredSize(), 0)];
    int n = read(out, 0, out.length);
    return n == out.length ? out : Arrays.copyOf(out, n);
  }

  /**
   * Produces the current phase's outgoing message.
   *
   * @param out the destination
   * @return the number of bytes written
   */
  public int read(byte[] out) {
    return read(out, 0, out.length);
  }

  /**
   * Produces the current phase's outgoing message into {@code out[offset, offset + length)}.
   *
   * @param out    the destination
   * @param offset the offset
   * @param length the capacity available
   * @return the number of bytes written, always the phase's message length
   * @throws PhaseException          if the current phase does not produce a message
   * @throws BufferTooSmallException if {@code length} is shorter than the message
   */
  public int read(byte[] out, int offset, int length) {
    ensureOpen();
    Phase phase = state.phase();
    if (phase.direction() != Phase.Direction.READ) {
      throw new PhaseException(phase.name(), "read");
    }
    int m = phase.messageLength();
    if (length < m) {
      throw new BufferTooSmallException(m, length);
    }
    Objects.checkFromIndexSize(offset, m, out.length);

    SessionState next = switch (phase) {
      case CLIENT_HAVE_CHALLENGE -> readChallenge((ClientHaveChallenge) state, out, offset);
      case SERVER_HAVE_TICKET_REQUEST -> readTicketRequest((ServerHaveTicketRequest) state, out, offset);
      case CLIENT_HAVE_TICKET -> readTicket((ClientHaveTicket) state, out, offset);
      case SERVER_HAVE_AUTHENTICATOR -> readAuthenticator((ServerHaveAuthenticator) state, out, offset);
      case CLIENT_NEED_TICKET_REQUEST, CLIENT_NEED_SERVER_AUTHENTICATOR, SERVER_NEED_CHALLENGE,
          SERVER_NEED_TICKET, ESTABLISHED -> throw new PhaseException(phase.name(), "read");
    };
    advance(next);
    return m;
  }

  private SessionState readChallenge(ClientHaveChallenge s, byte[] out, int offset) {
    System.arraycopy(s.channelChallenge(), 0, out, offset, WireCodec.CHALLEN);
    return new ClientNeedTicketRequest(s.channelChallenge());
  }

  private SessionState readTicketRequest(ServerHaveTicketRequest s, byte[] out, int offset) {
    byte[] encoded = WireCodec.encodeTicketRequest(s.request());
    System.arraycopy(encoded, 0, out, offset, encoded.length);
    return new ServerNeedTicket(s.request(), s.channelChallenge());
  }

  private SessionState readTicket(ClientHaveTicket s, byte[] out, int offset) {
    System.arraycopy(s.outgoing(), 0, out, offset, s.outgoing().length);
    return new ClientNeedServerAuthenticator(s.channelChallenge(), s.ticket());
  }

  private SessionState readAuthenticator(ServerHaveAuthenticator s, byte[] out, int offset) {
    System.arraycopy(s.authenticator(), 0, out, offset, s.authenticator().length);
    return establish(s.ticket());
  }

  // ─── Write ───────────────────────────────────────────────────────────────────

  /**
   * Consumes the peer's message for the current phase.
   *
   * @param in the message
   * @return the number of bytes consumed
   */
  public int write(byte[] in) {
    return write(in, 0, in.length);
  }

  /**
   * Consumes the peer's message for the current phase from {@code in[offset, offset + length)}.
   * Only the phase's message length is consumed; trailing bytes are ignored.
   *
   * @param in     the source
   * @param offset the offset
   * @param length the bytes available
   * @return the number of bytes consumed, always the phase's message length
   * @throws PhaseException          if the current phase does not accept a message
   * @throws BufferTooSmallException if {@code length} is shorter than the message
   */
  public int write(byte[] in, int offset, int length) {
    ensureOpen();
    Phase phase = state.phase();
    if (phase.direction() != Phase.Direction.WRITE) {
      throw new PhaseException(phase.name(), "write");
    }
    int m = phase.messageLength();
    if (length < m) {
      throw new BufferTooSmallException(m, length);
    }
    Objects.checkFromIndexSize(offset, m, in.length);

    SessionState next = switch (phase) {
      case SERVER_NEED_CHALLENGE -> writeChallenge((ServerNeedChallenge) state, in, offset);
      case CLIENT_NEED_TICKET_REQUEST -> writeTicketRequest((ClientNeedTicketRequest) state, in, offset);
      case SERVER_NEED_TICKET -> writeTicket((ServerNeedTicket) state, in, offset);
      case CLIENT_NEED_SERVER_AUTHENTICATOR ->
          writeAuthenticator((ClientNeedServerAuthenticator) state, in, offset);
      case CLIENT_HAVE_CHALLENGE, CLIENT_HAVE_TICKET, SERVER_HAVE_TICKET_REQUEST,
          SERVER_HAVE_AUTHENTICATOR, ESTABLISHED -> throw new PhaseException(phase.name(), "write");
    };
    advance(next);
    return m;
  }

  private SessionState writeChallenge(ServerNeedChallenge s, byte[] in, int offset) {
    byte[] channelChallenge = Arrays.copyOfRange(in, offset, offset + WireCodec.CHALLEN);
    return new ServerHaveTicketRequest(s.request(), channelChallenge);
  }

  private SessionState writeTicketRequest(ClientNeedTicketRequest s, byte[] in, int offset) {
    TicketRequest request = WireCodec.decodeTicketRequest(in, offset);
    if (!AuthType.TICKET_REQUEST.matches(request.type())) {
      throw new DecodeException("not a ticket request: type " + request.type());
    }
    // p9sk2: the initiator adopts the responder's challenge as its own
    byte[] channelChallenge = variant.initiatorSendsChallenge()
        ? s.channelChallenge()
        : request.challenge().clone();

    KeyRecord clientKey = keyStore.acquire(
        new KeyQuery(Role.CLIENT, P9skProtocol.clientKeyPattern(attributes, keyProto, request.authDomain())));
    try {
      String user = clientKey.user()
          .orElseThrow(() -> new KeyResolutionException("key has no user: " + clientKey));
      TicketPair pair = acquireTickets(request.withRequester(user, user), clientKey.privateKey());

      Ticket ticket = WireCodec.decodeTicket(pair.clientTicket(), 0, clientKey.privateKey());
      if (!AuthType.CLIENT_TICKET.matches(ticket.type())
          || !MessageDigest.isEqual(ticket.challenge(), request.challenge())) {
        ByteUtils.zero(ticket.key());
        throw new TicketAcquisitionException("could not get ticket: wrong key?");
      }
      Authenticator proof = new Authenticator(AuthType.CLIENT_AUTHENTICATOR.code(), request.challenge(), 0);
      byte[] outgoing = ByteUtils.concat(pair.serverTicket(),
          WireCodec.encodeAuthenticator(proof, ticket.key()));

      key = clientKey;
      return new ClientHaveTicket(channelChallenge, ticket, outgoing);
    } catch (RuntimeException e) {
      keyStore.release(clientKey);
      throw e;
    }
  }

  private TicketPair acquireTickets(TicketRequest request, byte[] clientKey) {
    TicketPair pair;
    try {
      pair = ticketService.getTickets(request, clientKey);
    } catch (P9skException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TicketAcquisitionException("ticket service failed: " + e.getMessage(), e);
    }
    if (pair == null
        || pair.clientTicket() == null || pair.clientTicket().length != WireCodec.TICKETLEN
        || pair.serverTicket() == null || pair.serverTicket().length != WireCodec.TICKETLEN) {
      throw new TicketAcquisitionException("ticket service returned a malformed ticket pair");
    }
    return pair;
  }

  private SessionState writeTicket(ServerNeedTicket s, byte[] in, int offset) {
    byte[] expected = s.request().challenge();
    Ticket ticket = WireCodec.decodeTicket(in, offset, key.privateKey());
    if (!AuthType.SERVER_TICKET.matches(ticket.type())
        || !MessageDigest.isEqual(ticket.challenge(), expected)) {
      ByteUtils.zero(ticket.key());
      throw new SecurityException("ticket not issued for this server and challenge");
    }
    Authenticator peer = WireCodec.decodeAuthenticator(in, offset + WireCodec.TICKETLEN, ticket.key());
    if (!AuthType.CLIENT_AUTHENTICATOR.matches(peer.type())
        || !MessageDigest.isEqual(peer.challenge(), expected)
        || peer.id() != 0) {
      ByteUtils.zero(ticket.key());
      throw new SecurityException("invalid authenticator from client");
    }
    Authenticator reply = new Authenticator(AuthType.SERVER_AUTHENTICATOR.code(), s.channelChallenge(), 0);
    return new ServerHaveAuthenticator(ticket, WireCodec.encodeAuthenticator(reply, ticket.key()));
  }

  private SessionState writeAuthenticator(ClientNeedServerAuthenticator s, byte[] in, int offset) {
    Authenticator peer = WireCodec.decodeAuthenticator(in, offset, s.ticket().key());
    if (!AuthType.SERVER_AUTHENTICATOR.matches(peer.type())
        || !MessageDigest.isEqual(peer.challenge(), s.channelChallenge())
        || peer.id() != 0) {
      throw new SecurityException("invalid authenticator from server");
    }
    return establish(s.ticket());
  }

  // ─── Lifecycle ───────────────────────────────────────────────────────────────

  private Established establish(Ticket ticket) {
    byte[] secret = DesCipher.des56to64(ticket.key());
    ByteUtils.zero(ticket.key());
    return new Established(new SessionResult(ticket.clientUser(), ticket.serverUser(), secret));
  }

  private void advance(SessionState next) {
    log.debug("{} {}: {} -> {}", variant.protocolName(), role.attributeValue(), state.phase(), next.phase());
    state = next;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Session is closed");
    }
  }

  /**
   * Releases the key record and zeroes the shared secret and any session key still held.
   * Calling close again has no effect.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    state.wipe();
    if (key != null) {
      keyStore.release(key);
      key = null;
    }
    log.debug("{} {} session closed in {}", variant.protocolName(), role.attributeValue(), state.phase());
  }
}
