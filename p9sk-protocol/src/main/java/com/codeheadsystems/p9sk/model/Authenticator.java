package com.codeheadsystems.p9sk.model;

/**
 * Authenticator: proof of possession of a ticket's session key.
 * Wire format: type || challenge || id (13 bytes), enciphered under the session key.
 *
 * @param type      {@link AuthType#CLIENT_AUTHENTICATOR} or {@link AuthType#SERVER_AUTHENTICATOR}
 * @param challenge the challenge this proof answers
 * @param id        the ticket reuse counter, always 0 here
 */
public record Authenticator(int type, byte[] challenge, int id) {
}
