package com.codeheadsystems.p9sk.protocol;

import com.codeheadsystems.p9sk.model.SessionResult;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link Session} to completion over a byte stream pair, for callers that have a
 * connected socket and nothing else to multiplex on it.
 */
public class StreamHandshake {

  private static final Logger log = LoggerFactory.getLogger(StreamHandshake.class);

  private StreamHandshake() {
  }

  /**
   * Alternates session reads and writes until the session is established. The session is not
   * closed; its result stays valid until the caller closes it.
   *
   * @param session the session, in its initial phase
   * @param in      bytes from the peer
   * @param out     bytes to the peer
   * @return the session result
   * @throws UncheckedIOException on I/O failure or if the peer closes the stream early
   */
  public static SessionResult run(Session session, InputStream in, OutputStream out) {
    try {
      while (!session.isEstablished()) {
        Phase phase = session.phase();
        switch (phase.direction()) {
          case READ -> {
            out.write(session.read());
            out.flush();
          }
          case WRITE -> {
            byte[] message = in.readNBytes(phase.messageLength());
            if (message.length != phase.messageLength()) {
              throw new EOFException("peer closed the stream in " + phase
                  + " after " + message.length + " of " + phase.messageLength() + " bytes");
            }
            session.write(message);
          }
          case NONE -> throw new IllegalStateException("no transition out of " + phase);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    log.debug("{} {} handshake complete", session.variant().protocolName(), session.role().attributeValue());
    return session.result().orElseThrow();
  }
}
