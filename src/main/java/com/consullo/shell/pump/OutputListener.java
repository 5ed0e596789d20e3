package com.consullo.shell.pump;

/**
 * Receives every line the shell prints, on the reader thread of the originating pipe.
 *
 * <p>Implementations must not block for long; a slow listener delays delivery of later lines from the same
 * pipe. Exceptions thrown by a listener are logged and do not affect other listeners.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface OutputListener {

  /**
   * Called for each non-blank line.
   *
   * @param stream pipe the line was read from
   * @param text line text without terminator
   */
  void onOutputLine(OutputLine.Stream stream, String text);
}
