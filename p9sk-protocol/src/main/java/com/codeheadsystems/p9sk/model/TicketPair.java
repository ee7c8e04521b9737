package com.codeheadsystems.p9sk.model;

/**
 * The two enciphered tickets returned by the ticket service.
 *
 * @param clientTicket the ticket enciphered under the initiator's key
 * @param serverTicket the ticket enciphered under the responder's key, passed on opaque
 */
public record TicketPair(byte[] clientTicket, byte[] serverTicket) {
}
