package com.consullo.shell.process;

import com.consullo.shell.core.ShellControllerException;
import com.consullo.shell.core.ShellErrorKind;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shell controller implemented with {@link ProcessBuilder}.
 *
 * <p>This controller spawns the shell with three separate pipes. stderr is never merged into stdout so the
 * output pump can tag every line with its origin.
 *
 * @since 1.0
 */
public final class ShellProcessControllerJdk implements ShellProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShellProcessControllerJdk.class);

  private final Process process;
  private final CompletableFuture<Integer> exitFuture;

  /**
   * Spawns a pipe-attached shell process.
   *
   * @param config process configuration (command, working directory, environment)
   * @throws ShellControllerException if the process cannot be started
   */
  public ShellProcessControllerJdk(final ShellProcessConfig config) throws ShellControllerException {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.command(), "command must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.workingDirectory(), "workingDirectory must not be null");

    final ProcessBuilder builder = new ProcessBuilder(config.command());
    builder.directory(config.workingDirectory().toFile());
    builder.redirectErrorStream(false);
    if (config.environment() != null) {
      builder.environment().putAll(config.environment());
    }

    try {
      this.process = builder.start();
    } catch (final IOException | RuntimeException e) {
      throw new ShellControllerException(ShellErrorKind.LAUNCH_FAILED,
          "Failed to launch " + config.command().get(0) + ": " + e.getMessage(), e);
    }

    this.exitFuture = this.process.onExit().thenApply(Process::exitValue);
    LOGGER.debug("Spawned {} with PID={}", config.command(), this.process.pid());
  }

  @Override
  public OutputStream getStdin() {
    return this.process.getOutputStream();
  }

  @Override
  public InputStream getStdout() {
    return this.process.getInputStream();
  }

  @Override
  public InputStream getStderr() {
    return this.process.getErrorStream();
  }

  @Override
  public boolean waitFor(final Duration timeout) throws InterruptedException {
    Validate.notNull(timeout, "timeout must not be null");
    return this.process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  @Override
  public void terminate() {
    this.process.destroy();
  }

  @Override
  public void kill() {
    this.process.destroyForcibly();
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return this.exitFuture;
  }

  @Override
  public long pid() {
    return this.process.pid();
  }

  @Override
  public boolean isAlive() {
    return this.process.isAlive();
  }

  /**
   * Closes all three pipes and force-kills the process if it is still alive. A child that inherited the
   * output pipes may keep them open; closing our ends lets blocked readers fail instead of waiting for it.
   */
  @Override
  public void close() {
    try {
      closeQuietly("stdin", this.process.getOutputStream());
      closeQuietly("stdout", this.process.getInputStream());
      closeQuietly("stderr", this.process.getErrorStream());
    } finally {
      if (this.process.isAlive()) {
        this.process.destroyForcibly();
      }
    }
  }

  private static void closeQuietly(final String name, final Closeable stream) {
    try {
      stream.close();
    } catch (final IOException e) {
      LOGGER.debug("Closing shell {} failed: {}", name, e.getMessage());
    }
  }
}
