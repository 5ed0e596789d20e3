package com.consullo.shell.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal controller for a shell subprocess attached through three independent pipes.
 *
 * <p>Implementations must provide:
 * - access to the stdin, stdout and stderr pipes
 * - liveness probing and bounded waiting for exit
 * - graceful and forced termination
 *
 * @since 1.0
 */
public interface ShellProcessController extends AutoCloseable {

  OutputStream getStdin();

  InputStream getStdout();

  InputStream getStderr();

  /**
   * Waits for the process to exit.
   *
   * @param timeout maximum time to wait
   * @return true if the process exited within the timeout
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean waitFor(final Duration timeout) throws InterruptedException;

  /** Sends a graceful termination request (SIGTERM or the platform equivalent). */
  void terminate();

  /** Forcibly kills the process. */
  void kill();

  CompletableFuture<Integer> onExit();

  long pid();

  boolean isAlive();

  /**
   * Releases the stdin pipe and makes sure the process is gone. The stdout and stderr pipes are owned and
   * closed by their readers.
   */
  @Override
  void close();
}
