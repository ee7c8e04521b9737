package com.codeheadsystems.p9sk.authsrv.config;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * YAML configuration for the ticket server.
 * <pre>
 * domain: example
 * port: 567
 * users:
 *   - name: fs
 *     password: fspass
 *   - name: glenda
 *     hexKey: 0123456789abcd
 * speaksFor:
 *   fs: [glenda]
 * </pre>
 * Keys are held in memory only; every user with a key must be listed here.
 * <p>
 * Field rules are Bean Validation constraints. Rules that span entries (unique names, key
 * material, wire field widths, speaks-for hosts) are checked in code after them.
 */
public class AuthServerConfiguration {

  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
  private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

  /**
   * The authentication domain this server issues tickets for.
   */
  @NotEmpty
  private String domain = "";

  /**
   * Address to listen on.
   */
  @NotEmpty
  private String bindAddress = "0.0.0.0";

  /**
   * TCP port to listen on. 0 picks an ephemeral port.
   */
  @Min(0)
  @Max(65535)
  private int port = 567;

  /**
   * How long to wait for a client's ticket request before dropping the connection.
   */
  @Min(1)
  private int readTimeoutMillis = 30_000;

  /**
   * Connections served concurrently.
   */
  @Min(1)
  private int workerThreads = 4;

  @Valid
  @NotNull
  private List<@NotNull UserEntry> users = new ArrayList<>();

  /**
   * Host principal to the users it may request tickets for. {@code "*"} means any user.
   * Every principal may always speak for itself.
   */
  @NotNull
  private Map<String, List<String>> speaksFor = new LinkedHashMap<>();

  /**
   * Reads and validates a configuration file.
   *
   * @param path the path
   * @return the auth server configuration
   * @throws IOException                  if the file cannot be read or parsed
   * @throws ConstraintViolationException if a field breaks its constraint
   * @throws IllegalArgumentException     if the configuration is inconsistent
   */
  public static AuthServerConfiguration load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  /**
   * Reads and validates a configuration from a stream.
   *
   * @param in the in
   * @return the auth server configuration
   * @throws IOException if the stream cannot be parsed
   */
  public static AuthServerConfiguration load(InputStream in) throws IOException {
    AuthServerConfiguration configuration = YAML.readValue(in, AuthServerConfiguration.class);
    configuration.validate();
    return configuration;
  }

  /**
   * Checks that the configuration can serve requests.
   *
   * @throws ConstraintViolationException listing every field that breaks its constraint
   * @throws IllegalArgumentException     naming the first inconsistency between entries
   */
  public void validate() {
    Set<ConstraintViolation<AuthServerConfiguration>> violations = VALIDATOR.validate(this);
    if (!violations.isEmpty()) {
      throw new ConstraintViolationException(describe(violations), violations);
    }
    if (!ByteUtils.fitsField(domain, WireCodec.DOMLEN)) {
      throw new IllegalArgumentException("domain longer than " + (WireCodec.DOMLEN - 1) + " bytes: " + domain);
    }
    Set<String> names = new HashSet<>();
    for (UserEntry user : users) {
      if (!ByteUtils.fitsField(user.name(), WireCodec.ANAMELEN)) {
        throw new IllegalArgumentException(
            "user name longer than " + (WireCodec.ANAMELEN - 1) + " bytes: " + user.name());
      }
      if (!names.add(user.name())) {
        throw new IllegalArgumentException("duplicate user: " + user.name());
      }
      if (user.password() == null && user.hexKey() == null) {
        throw new IllegalArgumentException("user " + user.name() + " has neither password nor hexKey");
      }
    }
    for (String host : speaksFor.keySet()) {
      if (!names.contains(host)) {
        throw new IllegalArgumentException("speaksFor names unknown host: " + host);
      }
    }
  }

  private static String describe(Set<? extends ConstraintViolation<?>> violations) {
    return violations.stream()
        .map(v -> v.getPropertyPath() + " " + v.getMessage())
        .sorted()
        .collect(Collectors.joining(", "));
  }

  /**
   * Gets domain.
   *
   * @return the domain
   */
  @JsonProperty
  public String getDomain() {
    return domain;
  }

  /**
   * Sets domain.
   *
   * @param domain the domain
   */
  @JsonProperty
  public void setDomain(String domain) {
    this.domain = domain;
  }

  /**
   * Gets bind address.
   *
   * @return the bind address
   */
  @JsonProperty
  public String getBindAddress() {
    return bindAddress;
  }

  /**
   * Sets bind address.
   *
   * @param bindAddress the bind address
   */
  @JsonProperty
  public void setBindAddress(String bindAddress) {
    this.bindAddress = bindAddress;
  }

  /**
   * Gets port.
   *
   * @return the port
   */
  @JsonProperty
  public int getPort() {
    return port;
  }

  /**
   * Sets port.
   *
   * @param port the port
   */
  @JsonProperty
  public void setPort(int port) {
    this.port = port;
  }

  /**
   * Gets read timeout millis.
   *
   * @return the read timeout millis
   */
  @JsonProperty
  public int getReadTimeoutMillis() {
    return readTimeoutMillis;
  }

  /**
   * Sets read timeout millis.
   *
   * @param readTimeoutMillis the read timeout millis
   */
  @JsonProperty
  public void setReadTimeoutMillis(int readTimeoutMillis) {
    this.readTimeoutMillis = readTimeoutMillis;
  }

  /**
   * Gets worker threads.
   *
   * @return the worker threads
   */
  @JsonProperty
  public int getWorkerThreads() {
    return workerThreads;
  }

  /**
   * Sets worker threads.
   *
   * @param workerThreads the worker threads
   */
  @JsonProperty
  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  /**
   * Gets users.
   *
   * @return the users
   */
  @JsonProperty
  public List<UserEntry> getUsers() {
    return users;
  }

  /**
   * Sets users.
   *
   * @param users the users
   */
  @JsonProperty
  public void setUsers(List<UserEntry> users) {
    this.users = users == null ? new ArrayList<>() : users;
  }

  /**
   * Gets speaks for.
   *
   * @return the speaks for
   */
  @JsonProperty
  public Map<String, List<String>> getSpeaksFor() {
    return speaksFor;
  }

  /**
   * Sets speaks for.
   *
   * @param speaksFor the speaks for
   */
  @JsonProperty
  public void setSpeaksFor(Map<String, List<String>> speaksFor) {
    this.speaksFor = speaksFor == null ? new LinkedHashMap<>() : speaksFor;
  }
}
