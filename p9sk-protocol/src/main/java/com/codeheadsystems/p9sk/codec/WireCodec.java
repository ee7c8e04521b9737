package com.codeheadsystems.p9sk.codec;

import com.codeheadsystems.p9sk.common.ByteUtils;
import com.codeheadsystems.p9sk.crypto.DesCipher;
import com.codeheadsystems.p9sk.exceptions.DecodeException;
import com.codeheadsystems.p9sk.model.Authenticator;
import com.codeheadsystems.p9sk.model.Ticket;
import com.codeheadsystems.p9sk.model.TicketPair;
import com.codeheadsystems.p9sk.model.TicketRequest;
import java.util.Arrays;

/**
 * Marshals the three wire structures. Tickets and authenticators are enciphered with
 * {@link DesCipher} under the supplied key; ticket requests travel in the clear.
 * <p>
 * Decoding only checks lengths. Whether a decoded type code and challenge are the ones a
 * phase expects is for the caller to verify.
 */
public class WireCodec {

  // ─── Field and message lengths ───────────────────────────────────────────────

  public static final int CHALLEN = 8;
  public static final int ANAMELEN = 28;
  public static final int DOMLEN = 48;
  public static final int DESKEYLEN = DesCipher.DESKEYLEN;
  public static final int ERRMAX = 64;

  public static final int TICKREQLEN = 1 + ANAMELEN + DOMLEN + CHALLEN + ANAMELEN + ANAMELEN;
  public static final int TICKETLEN = 1 + CHALLEN + ANAMELEN + ANAMELEN + DESKEYLEN;
  public static final int AUTHENTLEN = 1 + CHALLEN + 4;

  private WireCodec() {
  }

  // ─── Ticket request ──────────────────────────────────────────────────────────

  /**
   * Serializes a ticket request (141 bytes, not enciphered).
   *
   * @param request the request
   * @return the byte [ ]
   */
  public static byte[] encodeTicketRequest(TicketRequest request) {
    requireChallenge(request.challenge());
    byte[] out = new byte[TICKREQLEN];
    int off = 0;
    out[off++] = (byte) request.type();
    ByteUtils.putString(out, off, request.authId(), ANAMELEN);
    off += ANAMELEN;
    ByteUtils.putString(out, off, request.authDomain(), DOMLEN);
    off += DOMLEN;
    System.arraycopy(request.challenge(), 0, out, off, CHALLEN);
    off += CHALLEN;
    ByteUtils.putString(out, off, request.hostId(), ANAMELEN);
    off += ANAMELEN;
    ByteUtils.putString(out, off, request.uid(), ANAMELEN);
    return out;
  }

  /**
   * Deserializes a ticket request.
   *
   * @param buf    the buf
   * @param offset the offset
   * @return the ticket request
   */
  public static TicketRequest decodeTicketRequest(byte[] buf, int offset) {
    requireLength(buf, offset, TICKREQLEN, "ticket request");
    int off = offset;
    int type = buf[off++] & 0xFF;
    String authId = ByteUtils.getString(buf, off, ANAMELEN);
    off += ANAMELEN;
    String authDomain = ByteUtils.getString(buf, off, DOMLEN);
    off += DOMLEN;
    byte[] challenge = Arrays.copyOfRange(buf, off, off + CHALLEN);
    off += CHALLEN;
    String hostId = ByteUtils.getString(buf, off, ANAMELEN);
    off += ANAMELEN;
    String uid = ByteUtils.getString(buf, off, ANAMELEN);
    return new TicketRequest(type, authId, authDomain, challenge, hostId, uid);
  }

  // ─── Ticket ──────────────────────────────────────────────────────────────────

  /**
   * Serializes and enciphers a ticket under {@code key} (72 bytes).
   *
   * @param ticket the ticket
   * @param key    the 7-byte key of the principal the ticket is issued to
   * @return the byte [ ]
   */
  public static byte[] encodeTicket(Ticket ticket, byte[] key) {
    requireChallenge(ticket.challenge());
    if (ticket.key() == null || ticket.key().length != DESKEYLEN) {
      throw new IllegalArgumentException("Session key must be " + DESKEYLEN + " bytes");
    }
    byte[] out = new byte[TICKETLEN];
    int off = 0;
    out[off++] = (byte) ticket.type();
    System.arraycopy(ticket.challenge(), 0, out, off, CHALLEN);
    off += CHALLEN;
    ByteUtils.putString(out, off, ticket.clientUser(), ANAMELEN);
    off += ANAMELEN;
    ByteUtils.putString(out, off, ticket.serverUser(), ANAMELEN);
    off += ANAMELEN;
    System.arraycopy(ticket.key(), 0, out, off, DESKEYLEN);
    DesCipher.encrypt(key, out, 0, TICKETLEN);
    return out;
  }

  /**
   * Deciphers and deserializes a ticket. The input buffer is not modified.
   *
   * @param buf    the buf
   * @param offset the offset
   * @param key    the 7-byte key of the ticket holder
   * @return the ticket
   */
  public static Ticket decodeTicket(byte[] buf, int offset, byte[] key) {
    requireLength(buf, offset, TICKETLEN, "ticket");
    byte[] clear = Arrays.copyOfRange(buf, offset, offset + TICKETLEN);
    DesCipher.decrypt(key, clear, 0, TICKETLEN);
    int off = 0;
    int type = clear[off++] & 0xFF;
    byte[] challenge = Arrays.copyOfRange(clear, off, off + CHALLEN);
    off += CHALLEN;
    String clientUser = ByteUtils.getString(clear, off, ANAMELEN);
    off += ANAMELEN;
    String serverUser = ByteUtils.getString(clear, off, ANAMELEN);
    off += ANAMELEN;
    byte[] sessionKey = Arrays.copyOfRange(clear, off, off + DESKEYLEN);
    Arrays.fill(clear, (byte) 0);
    return new Ticket(type, challenge, clientUser, serverUser, sessionKey);
  }

  /**
   * Splits the service reply into its two enciphered tickets.
   *
   * @param buf    client ticket followed by server ticket
   * @param offset the offset
   * @return the ticket pair
   */
  public static TicketPair decodeTicketPair(byte[] buf, int offset) {
    requireLength(buf, offset, 2 * TICKETLEN, "ticket pair");
    return new TicketPair(
        Arrays.copyOfRange(buf, offset, offset + TICKETLEN),
        Arrays.copyOfRange(buf, offset + TICKETLEN, offset + 2 * TICKETLEN));
  }

  /**
   * Concatenates a ticket pair in wire order.
   *
   * @param pair the pair
   * @return the byte [ ]
   */
  public static byte[] encodeTicketPair(TicketPair pair) {
    if (pair.clientTicket().length != TICKETLEN || pair.serverTicket().length != TICKETLEN) {
      throw new IllegalArgumentException("Tickets must be " + TICKETLEN + " bytes");
    }
    return ByteUtils.concat(pair.clientTicket(), pair.serverTicket());
  }

  // ─── Authenticator ───────────────────────────────────────────────────────────

  /**
   * Serializes and enciphers an authenticator under the session key (13 bytes).
   *
   * @param authenticator the authenticator
   * @param sessionKey    the 7-byte session key
   * @return the byte [ ]
   */
  public static byte[] encodeAuthenticator(Authenticator authenticator, byte[] sessionKey) {
    requireChallenge(authenticator.challenge());
    byte[] out = new byte[AUTHENTLEN];
    out[0] = (byte) authenticator.type();
    System.arraycopy(authenticator.challenge(), 0, out, 1, CHALLEN);
    ByteUtils.putInt32(out, 1 + CHALLEN, authenticator.id());
    DesCipher.encrypt(sessionKey, out, 0, AUTHENTLEN);
    return out;
  }

  /**
   * Deciphers and deserializes an authenticator. The input buffer is not modified.
   *
   * @param buf        the buf
   * @param offset     the offset
   * @param sessionKey the 7-byte session key
   * @return the authenticator
   */
  public static Authenticator decodeAuthenticator(byte[] buf, int offset, byte[] sessionKey) {
    requireLength(buf, offset, AUTHENTLEN, "authenticator");
    byte[] clear = Arrays.copyOfRange(buf, offset, offset + AUTHENTLEN);
    DesCipher.decrypt(sessionKey, clear, 0, AUTHENTLEN);
    int type = clear[0] & 0xFF;
    byte[] challenge = Arrays.copyOfRange(clear, 1, 1 + CHALLEN);
    int id = ByteUtils.getInt32(clear, 1 + CHALLEN);
    return new Authenticator(type, challenge, id);
  }

  // ─── Helpers ─────────────────────────────────────────────────────────────────

  private static void requireChallenge(byte[] challenge) {
    if (challenge == null || challenge.length != CHALLEN) {
      throw new IllegalArgumentException("Challenge must be " + CHALLEN + " bytes");
    }
  }

  private static void requireLength(byte[] buf, int offset, int length, String what) {
    if (buf == null || offset < 0 || buf.length - offset < length) {
      throw new DecodeException("Short " + what + ": need " + length + " bytes");
    }
  }
}
