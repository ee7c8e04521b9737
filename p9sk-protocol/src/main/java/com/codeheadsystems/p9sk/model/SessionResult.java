package com.codeheadsystems.p9sk.model;

/**
 * Result of a completed handshake: { clientUser, serverUser, secret }.
 * <p>
 * The secret array belongs to the session that produced it and is zeroed when that session
 * closes; copy it first if it must outlive the session.
 *
 * @param clientUser the client identity (cuid)
 * @param serverUser the identity the client holds on the server (suid)
 * @param secret     the 8-byte shared secret
 */
public record SessionResult(String clientUser, String serverUser, byte[] secret) {
}
