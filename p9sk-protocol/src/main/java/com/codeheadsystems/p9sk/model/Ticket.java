package com.codeheadsystems.p9sk.model;

/**
 * Ticket: binds a session key to the (cuid, suid) pair and the responder's challenge.
 * Wire format: type || challenge || cuid || suid || key (72 bytes), enciphered under the
 * key of the principal it is issued to.
 *
 * @param type       {@link AuthType#CLIENT_TICKET} or {@link AuthType#SERVER_TICKET}
 * @param challenge  the ticket request challenge
 * @param clientUser the client identity (cuid)
 * @param serverUser the identity the client holds on the server (suid)
 * @param key        the 7-byte session key
 */
public record Ticket(int type, byte[] challenge, String clientUser, String serverUser, byte[] key) {
}
