package com.codeheadsystems.p9sk.exceptions;

/**
 * The caller's buffer is shorter than the current phase's message. Retry with a buffer of
 * {@link #requiredSize()} bytes; the session is unchanged.
 */
public class BufferTooSmallException extends P9skException {

  private final int requiredSize;

  /**
   * Instantiates a new Buffer too small exception.
   *
   * @param requiredSize the exact size the phase needs
   * @param actualSize   the size supplied
   */
  public BufferTooSmallException(final int requiredSize, final int actualSize) {
    super("Buffer too small: need " + requiredSize + " bytes, have " + actualSize);
    this.requiredSize = requiredSize;
  }

  /**
   * The exact number of bytes the current phase reads or writes.
   *
   * @return the int
   */
  public int requiredSize() {
    return requiredSize;
  }
}
