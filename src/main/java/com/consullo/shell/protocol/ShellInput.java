package com.consullo.shell.protocol;

import com.consullo.shell.core.ShellControllerException;

/**
 * Write side of a running shell, as seen by the command protocol.
 *
 * @since 1.0
 */
public interface ShellInput {

  boolean isAlive();

  /**
   * Writes text to the shell's stdin and flushes. Concurrent calls never interleave.
   *
   * @param text raw text, including any newline
   * @throws ShellControllerException {@code NOT_RUNNING} without a live process, {@code WRITE_FAILED} if the
   *     pipe is broken
   */
  void write(String text) throws ShellControllerException;
}
