package com.codeheadsystems.p9sk.authsrv.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;

/**
 * One principal known to the ticket server. Exactly one of {@code password} and {@code hexKey}
 * supplies the 56-bit key; {@code hexKey} wins when both are present.
 *
 * @param name     the user name, at most 27 bytes of UTF-8
 * @param password the password the key is derived from
 * @param hexKey   the key itself, 14 hex digits
 */
public record UserEntry(
    @NotEmpty @JsonProperty("name") String name,
    @JsonProperty("password") String password,
    @JsonProperty("hexKey") String hexKey) {

  @Override
  public String toString() {
    return "UserEntry[" + name + "]";
  }
}
