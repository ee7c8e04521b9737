package com.codeheadsystems.p9sk.ticket;

import java.time.Duration;

/**
 * Where and how patiently to reach the ticket-issuing service.
 *
 * @param host           the issuer's host
 * @param port           the issuer's TCP port
 * @param connectTimeout how long to wait for the connection
 * @param readTimeout    how long to wait for each read of the reply
 */
public record TicketServiceConfig(String host, int port, Duration connectTimeout, Duration readTimeout) {

  /**
   * The conventional ticket service port.
   */
  public static final int DEFAULT_PORT = 567;

  /**
   * Default wait for the issuer, applied to both connect and read.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /**
   * Config for an issuer on the default port with default timeouts.
   *
   * @param host the host
   * @return the ticket service config
   */
  public static TicketServiceConfig forHost(String host) {
    return forHost(host, DEFAULT_PORT);
  }

  /**
   * Config for an issuer with default timeouts.
   *
   * @param host the host
   * @param port the port
   * @return the ticket service config
   */
  public static TicketServiceConfig forHost(String host, int port) {
    return new TicketServiceConfig(host, port, DEFAULT_TIMEOUT, DEFAULT_TIMEOUT);
  }
}
