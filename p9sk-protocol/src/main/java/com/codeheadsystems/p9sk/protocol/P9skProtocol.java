package com.codeheadsystems.p9sk.protocol;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.Attributes;
import com.codeheadsystems.p9sk.exceptions.KeyResolutionException;
import com.codeheadsystems.p9sk.exceptions.RoleResolutionException;
import com.codeheadsystems.p9sk.keystore.KeyQuery;
import com.codeheadsystems.p9sk.keystore.KeyRecord;
import com.codeheadsystems.p9sk.keystore.KeyStore;
import com.codeheadsystems.p9sk.model.AuthType;
import com.codeheadsystems.p9sk.model.Role;
import com.codeheadsystems.p9sk.model.TicketRequest;
import com.codeheadsystems.p9sk.protocol.SessionState.ClientHaveChallenge;
import com.codeheadsystems.p9sk.protocol.SessionState.ClientNeedTicketRequest;
import com.codeheadsystems.p9sk.protocol.SessionState.ServerHaveTicketRequest;
import com.codeheadsystems.p9sk.protocol.SessionState.ServerNeedChallenge;
import com.codeheadsystems.p9sk.ticket.TicketService;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts sessions. Holds no per-session state, so one instance serves any number of
 * connections; every {@link Session} it returns is independent.
 */
@Singleton
public class P9skProtocol {

  private static final Logger log = LoggerFactory.getLogger(P9skProtocol.class);

  private final KeyStore keyStore;
  private final TicketService ticketService;
  private final ProtocolConfig config;

  /**
   * Instantiates a new P9sk protocol.
   *
   * @param keyStore      where both roles resolve their keys
   * @param ticketService how clients obtain tickets
   * @param config        the config
   */
  @Inject
  public P9skProtocol(final KeyStore keyStore,
                      final TicketService ticketService,
                      final ProtocolConfig config) {
    this.keyStore = keyStore;
    this.ticketService = ticketService;
    this.config = config;
    log.info("P9skProtocol({}, {})", keyStore.getClass().getSimpleName(), ticketService.getClass().getSimpleName());
  }

  /**
   * Starts a session for the role named by the {@code role} attribute.
   *
   * @param variant    the variant
   * @param attributes the caller's attributes, e.g. {@code role=server dom=example}
   * @return the session
   * @throws RoleResolutionException if {@code role} is missing or unrecognized
   * @throws KeyResolutionException  if a server has no key for the requested domain
   */
  public Session start(Variant variant, Attributes attributes) {
    String value = attributes.find("role")
        .orElseThrow(() -> new RoleResolutionException("role not specified"));
    Role role = Role.fromAttribute(value)
        .orElseThrow(() -> new RoleResolutionException("unknown role: " + value));
    return switch (role) {
      case CLIENT -> startClient(variant, attributes);
      case SERVER -> startServer(variant, attributes);
    };
  }

  /**
   * Starts an initiator session. No key is resolved until the ticket request arrives.
   *
   * @param variant    the variant
   * @param attributes the attributes
   * @return the session
   */
  public Session startClient(Variant variant, Attributes attributes) {
    SessionState initial = variant.initiatorSendsChallenge()
        ? new ClientHaveChallenge(config.randomProvider().randomBytes(WireCodec.CHALLEN))
        : new ClientNeedTicketRequest(null);
    return new Session(variant, Role.CLIENT, attributes, initial, null,
        keyStore, ticketService, config.keyProto());
  }

  /**
   * Starts a responder session: resolves the server key and prepares the ticket request.
   *
   * @param variant    the variant
   * @param attributes the attributes
   * @return the session
   * @throws KeyResolutionException if no key matches, or it lacks a user or domain
   */
  public Session startServer(Variant variant, Attributes attributes) {
    Attributes pattern = attributes.without("role")
        .with("proto", config.keyProto())
        .query("user")
        .query("dom");
    KeyRecord key = keyStore.acquire(new KeyQuery(Role.SERVER, pattern));
    try {
      String user = key.user().orElseThrow(() -> new KeyResolutionException("key has no user: " + key));
      String domain = key.domain().orElseThrow(() -> new KeyResolutionException("key has no dom: " + key));
      byte[] challenge = config.randomProvider().randomBytes(WireCodec.CHALLEN);
      TicketRequest request = new TicketRequest(AuthType.TICKET_REQUEST.code(), user, domain, challenge, "", "");
      // p9sk2: the ticket request challenge doubles as the channel challenge
      SessionState initial = variant.initiatorSendsChallenge()
          ? new ServerNeedChallenge(request)
          : new ServerHaveTicketRequest(request, challenge.clone());
      return new Session(variant, Role.SERVER, attributes, initial, key,
          keyStore, ticketService, config.keyProto());
    } catch (RuntimeException e) {
      keyStore.release(key);
      throw e;
    }
  }

  /**
   * The pattern a client's key must satisfy for a responder in {@code domain}.
   *
   * @param attributes the caller's attributes
   * @param keyProto   the key protocol name
   * @param domain     the responder's authentication domain
   * @return the attributes
   */
  static Attributes clientKeyPattern(Attributes attributes, String keyProto, String domain) {
    return attributes.without("role")
        .with("proto", keyProto)
        .with("dom", domain)
        .plus(Attributes.parse(Variant.P9SK1.keyPrompt().orElseThrow()));
  }
}
