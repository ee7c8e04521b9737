package com.codeheadsystems.p9sk.authsrv;

import com.codeheadsystems.p9sk.authsrv.config.AuthServerConfiguration;
import com.codeheadsystems.p9sk.authsrv.issuer.TicketIssuer;
import com.codeheadsystems.p9sk.authsrv.server.TicketServer;
import com.codeheadsystems.p9sk.authsrv.store.InMemoryKeyDatabase;
import com.codeheadsystems.p9sk.common.RandomProvider;
import jakarta.validation.ValidationException;
import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the ticket server.
 *
 * <pre>
 * Usage:
 *   java -cp ... com.codeheadsystems.p9sk.authsrv.AuthServerMain --config &lt;file&gt; [--port &lt;n&gt;]
 *
 * Options:
 *   --config &lt;file&gt;   YAML configuration (required)
 *   --port &lt;n&gt;        Override the configured port
 * </pre>
 */
public class AuthServerMain {

  private static final Logger log = LoggerFactory.getLogger(AuthServerMain.class);

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    String configFile = null;
    Integer port = null;

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--config" -> configFile = args[++i];
        case "--port"   -> port       = Integer.parseInt(args[++i]);
        default -> {
          System.err.println("Unknown option: " + args[i]);
          printUsage();
          System.exit(1);
        }
      }
    }

    if (configFile == null) {
      printUsage();
      System.exit(1);
    }

    try {
      AuthServerConfiguration configuration = AuthServerConfiguration.load(Path.of(configFile));
      if (port != null) {
        configuration.setPort(port);
        configuration.validate();
      }
      TicketServer server = create(configuration);
      server.start();
      Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "ticket-server-shutdown"));
    } catch (IllegalArgumentException | ValidationException e) {
      System.err.println("Invalid configuration: " + e.getMessage());
      System.exit(1);
    } catch (IOException e) {
      log.error("Cannot start ticket server", e);
      System.exit(1);
    }
  }

  /**
   * Wires a ticket server from a validated configuration without starting it.
   *
   * @param configuration the configuration
   * @return the ticket server
   * @throws IOException if the bind address cannot be resolved
   */
  public static TicketServer create(AuthServerConfiguration configuration) throws IOException {
    InMemoryKeyDatabase database = InMemoryKeyDatabase.fromConfiguration(configuration);
    TicketIssuer issuer = new TicketIssuer(database, configuration.getDomain(), new RandomProvider());
    return new TicketServer(issuer,
        InetAddress.getByName(configuration.getBindAddress()),
        configuration.getPort(),
        configuration.getReadTimeoutMillis(),
        configuration.getWorkerThreads());
  }

  private static void printUsage() {
    System.err.println("Usage: AuthServerMain --config <file> [--port <n>]");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --config <file>   YAML configuration (required)");
    System.err.println("  --port <n>        Override the configured port");
  }
}
