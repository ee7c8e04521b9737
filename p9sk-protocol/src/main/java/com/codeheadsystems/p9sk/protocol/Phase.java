package com.codeheadsystems.p9sk.protocol;

import com.codeheadsystems.p9sk.codec.WireCodec;
import com.codeheadsystems.p9sk.model.Role;

/**
 * Every phase a session passes through, with the role it belongs to, whether the caller reads
 * or writes in it, and the exact message length.
 * <pre>
 * client (p9sk1): HAVE_CHALLENGE → NEED_TICKET_REQUEST → HAVE_TICKET → NEED_SERVER_AUTHENTICATOR → ESTABLISHED
 * client (p9sk2):                  NEED_TICKET_REQUEST → HAVE_TICKET → NEED_SERVER_AUTHENTICATOR → ESTABLISHED
 * server (p9sk1): NEED_CHALLENGE → HAVE_TICKET_REQUEST → NEED_TICKET → HAVE_AUTHENTICATOR → ESTABLISHED
 * server (p9sk2):                  HAVE_TICKET_REQUEST → NEED_TICKET → HAVE_AUTHENTICATOR → ESTABLISHED
 * </pre>
 */
public enum Phase {

  CLIENT_HAVE_CHALLENGE(Role.CLIENT, Direction.READ, WireCodec.CHALLEN),
  CLIENT_NEED_TICKET_REQUEST(Role.CLIENT, Direction.WRITE, WireCodec.TICKREQLEN),
  CLIENT_HAVE_TICKET(Role.CLIENT, Direction.READ, WireCodec.TICKETLEN + WireCodec.AUTHENTLEN),
  CLIENT_NEED_SERVER_AUTHENTICATOR(Role.CLIENT, Direction.WRITE, WireCodec.AUTHENTLEN),

  SERVER_NEED_CHALLENGE(Role.SERVER, Direction.WRITE, WireCodec.CHALLEN),
  SERVER_HAVE_TICKET_REQUEST(Role.SERVER, Direction.READ, WireCodec.TICKREQLEN),
  SERVER_NEED_TICKET(Role.SERVER, Direction.WRITE, WireCodec.TICKETLEN + WireCodec.AUTHENTLEN),
  SERVER_HAVE_AUTHENTICATOR(Role.SERVER, Direction.READ, WireCodec.AUTHENTLEN),

  ESTABLISHED(null, Direction.NONE, 0);

  private final Role role;
  private final Direction direction;
  private final int messageLength;

  Phase(Role role, Direction direction, int messageLength) {
    this.role = role;
    this.direction = direction;
    this.messageLength = messageLength;
  }

  /**
   * The role this phase belongs to, null for {@link #ESTABLISHED}.
   *
   * @return the role
   */
  public Role role() {
    return role;
  }

  /**
   * Whether the caller reads from or writes to the session in this phase.
   *
   * @return the direction
   */
  public Direction direction() {
    return direction;
  }

  /**
   * The exact number of bytes produced or consumed in this phase.
   *
   * @return the int
   */
  public int messageLength() {
    return messageLength;
  }

  /**
   * Caller-side direction of a phase.
   */
  public enum Direction {
    READ, WRITE, NONE
  }
}
