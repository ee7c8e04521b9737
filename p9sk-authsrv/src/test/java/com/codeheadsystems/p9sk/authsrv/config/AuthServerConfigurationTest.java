package com.codeheadsystems.p9sk.authsrv.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.lang.annotation.Annotation;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuthServerConfigurationTest {

  private static AuthServerConfiguration parse(String yaml) throws IOException {
    return AuthServerConfiguration.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }

  private static void assertViolations(String yaml, String... expected) {
    assertThatThrownBy(() -> parse(yaml))
        .isInstanceOfSatisfying(ConstraintViolationException.class, e ->
            assertThat(e.getConstraintViolations())
                .extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder(expected));
  }

  private static Class<? extends Annotation> constraintOf(ConstraintViolation<?> violation) {
    return violation.getConstraintDescriptor().getAnnotation().annotationType();
  }

  @Test
  void load_testConfiguration() throws IOException {
    AuthServerConfiguration configuration;
    try (InputStream in = getClass().getResourceAsStream("/authsrv-test.yml")) {
      configuration = AuthServerConfiguration.load(in);
    }

    assertThat(configuration.getDomain()).isEqualTo("example");
    assertThat(configuration.getBindAddress()).isEqualTo("127.0.0.1");
    assertThat(configuration.getPort()).isZero();
    assertThat(configuration.getReadTimeoutMillis()).isEqualTo(2000);
    assertThat(configuration.getWorkerThreads()).isEqualTo(2);
    assertThat(configuration.getUsers()).extracting(UserEntry::name).containsExactly("fs", "glenda", "cpu");
    assertThat(configuration.getUsers().get(2).hexKey()).isEqualTo("0123456789abcd");
    assertThat(configuration.getSpeaksFor()).containsEntry("cpu", List.of("glenda"));
  }

  @Test
  void load_fromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("authsrv.yml");
    Files.writeString(file, "domain: lab\nusers:\n  - name: fs\n    password: pw\n");

    AuthServerConfiguration configuration = AuthServerConfiguration.load(file);

    assertThat(configuration.getDomain()).isEqualTo("lab");
    assertThat(configuration.getPort()).isEqualTo(567);
    assertThat(configuration.getBindAddress()).isEqualTo("0.0.0.0");
    assertThat(configuration.getSpeaksFor()).isEmpty();
  }

  @Test
  void validate_requiresDomain() {
    assertThatThrownBy(() -> parse("users: []\n"))
        .isInstanceOfSatisfying(ConstraintViolationException.class, e ->
            assertThat(e.getConstraintViolations())
                .singleElement()
                .satisfies(v -> {
                  assertThat(v.getPropertyPath().toString()).isEqualTo("domain");
                  assertThat(constraintOf(v)).isEqualTo(NotEmpty.class);
                }));
  }

  @Test
  void validate_reportsEveryBrokenField() {
    assertViolations("domain: lab\nport: -1\nreadTimeoutMillis: 0\nworkerThreads: 0\nbindAddress: ''\n",
        "port", "readTimeoutMillis", "workerThreads", "bindAddress");
  }

  @Test
  void validate_requiresUserName() {
    assertViolations("domain: lab\nusers:\n  - password: pw\n", "users[0].name");
  }

  @Test
  void validate_rejectsNamesTooLongForTheWire() {
    assertThatThrownBy(() -> parse("domain: lab\nusers:\n  - name: " + "u".repeat(28) + "\n    password: pw\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("user name longer than 27 bytes");
    assertThatThrownBy(() -> parse("domain: " + "d".repeat(48) + "\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("domain longer than 47 bytes");
  }

  @Test
  void validate_requiresKeyMaterial() {
    assertThatThrownBy(() -> parse("domain: lab\nusers:\n  - name: fs\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("neither password nor hexKey");
  }

  @Test
  void validate_rejectsDuplicateUsers() {
    assertThatThrownBy(() -> parse(
        "domain: lab\nusers:\n  - name: fs\n    password: a\n  - name: fs\n    password: b\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("duplicate user: fs");
  }

  @Test
  void validate_rejectsUnknownSpeaksForHost() {
    assertThatThrownBy(() -> parse(
        "domain: lab\nusers:\n  - name: fs\n    password: a\nspeaksFor:\n  cpu: [fs]\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("cpu");
  }

  @Test
  void validate_rejectsBadPort() {
    assertThatThrownBy(() -> parse("domain: lab\nport: 70000\n"))
        .isInstanceOfSatisfying(ConstraintViolationException.class, e ->
            assertThat(e.getConstraintViolations())
                .singleElement()
                .satisfies(v -> assertThat(constraintOf(v)).isEqualTo(Max.class)))
        .hasMessageContaining("port");
  }

  @Test
  void validate_runsAgainAfterOverride() throws IOException {
    AuthServerConfiguration configuration = parse("domain: lab\n");
    configuration.setWorkerThreads(0);

    assertThatThrownBy(configuration::validate)
        .isInstanceOfSatisfying(ConstraintViolationException.class, e ->
            assertThat(e.getConstraintViolations())
                .singleElement()
                .satisfies(v -> assertThat(constraintOf(v)).isEqualTo(Min.class)));
  }

  @Test
  void load_rejectsUnknownProperties() {
    assertThatThrownBy(() -> parse("domain: lab\nprot: 1\n"))
        .isInstanceOf(UnrecognizedPropertyException.class);
  }

  @Test
  void userEntry_toStringHidesSecrets() {
    assertThat(new UserEntry("fs", "secret", null).toString()).isEqualTo("UserEntry[fs]");
  }
}
