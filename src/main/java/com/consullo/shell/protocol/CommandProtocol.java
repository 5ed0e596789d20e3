package com.consullo.shell.protocol;

import com.consullo.shell.core.ShellControllerException;
import com.consullo.shell.core.ShellErrorKind;
import com.consullo.shell.pump.OutputLine;
import com.consullo.shell.pump.OutputPump;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns logical shell operations into directive lines and reconciles the best-known working directory with
 * what the shell reports.
 *
 * <p>No method throws for an expected condition. Failures return {@code false} (or a fallback directory) and
 * are reported to the error sink.
 *
 * @since 1.0
 */
public final class CommandProtocol {

  private static final Logger LOGGER = LoggerFactory.getLogger(CommandProtocol.class);

  private final ShellInput input;
  private final OutputPump pump;
  private final DirectoryLineFilterPolicy directoryPolicy;
  private final Duration settleDelay;
  private final Duration defaultQueryTimeout;
  private final Consumer<ShellErrorKind> errorSink;

  // Separate from the pump's listener lock so a listener reading the directory cannot deadlock an update.
  private final Object directoryLock = new Object();
  private String knownDirectory;

  /**
   * Creates the protocol.
   *
   * @param input shell write side
   * @param pump output pump used for directory queries
   * @param directoryPolicy filter applied to directory query captures
   * @param settleDelay pause between sending a query and draining its answer
   * @param defaultQueryTimeout drain budget for {@link #getCurrentDirectory()}
   * @param initialDirectory initial best-known directory (may be null)
   * @param errorSink receives the kind of every failed operation
   */
  public CommandProtocol(
          final ShellInput input,
          final OutputPump pump,
          final DirectoryLineFilterPolicy directoryPolicy,
          final Duration settleDelay,
          final Duration defaultQueryTimeout,
          final String initialDirectory,
          final Consumer<ShellErrorKind> errorSink) {
    Validate.notNull(input, "input must not be null");
    Validate.notNull(pump, "pump must not be null");
    Validate.notNull(directoryPolicy, "directoryPolicy must not be null");
    Validate.notNull(settleDelay, "settleDelay must not be null");
    Validate.notNull(defaultQueryTimeout, "defaultQueryTimeout must not be null");
    Validate.notNull(errorSink, "errorSink must not be null");
    this.input = input;
    this.pump = pump;
    this.directoryPolicy = directoryPolicy;
    this.settleDelay = settleDelay;
    this.defaultQueryTimeout = defaultQueryTimeout;
    this.knownDirectory = initialDirectory;
    this.errorSink = errorSink;
  }

  /**
   * Writes text to the shell. Without a newline the text is staged at the shell's input line and not run.
   *
   * @param text text to send
   * @param appendNewline true to execute immediately
   * @return true if written and flushed
   */
  public boolean sendInput(final String text, final boolean appendNewline) {
    Validate.notNull(text, "text must not be null");
    if (!input.isAlive()) {
      LOGGER.warn("Shell is not running, input not sent");
      errorSink.accept(ShellErrorKind.NOT_RUNNING);
      return false;
    }
    try {
      input.write(appendNewline ? text + "\n" : text);
      LOGGER.info("Sent input to shell: {}", text);
      return true;
    } catch (ShellControllerException e) {
      LOGGER.warn("Shell input failed ({}): {}", e.kind(), e.getMessage());
      errorSink.accept(e.kind());
      return false;
    }
  }

  public boolean executeCommand(final String command) {
    return executeCommand(command, null, true);
  }

  public boolean executeCommand(final String command, final String workingDirectory) {
    return executeCommand(command, workingDirectory, true);
  }

  /**
   * Runs a command, optionally inside a directory scoped to this one invocation.
   *
   * <p>The directory change is part of the same line and does not update the best-known directory; use
   * {@link #changeDirectory(String)} for that.
   *
   * @param command command text, passed through verbatim
   * @param workingDirectory directory to run in (may be null)
   * @param immediate true to append a newline and execute
   * @return true if sent
   */
  public boolean executeCommand(final String command, final String workingDirectory, final boolean immediate) {
    Validate.notNull(command, "command must not be null");
    String line = command;
    if (StringUtils.isNotEmpty(workingDirectory)) {
      if (!isExistingDirectory(workingDirectory)) {
        LOGGER.warn("Working directory does not exist: {}", workingDirectory);
        errorSink.accept(ShellErrorKind.PATH_INVALID);
        return false;
      }
      line = ShellDirectives.inDirectory(workingDirectory, command);
    }
    LOGGER.info("Executing command: {}", line);
    return sendInput(line, immediate);
  }

  /**
   * Changes the shell's directory and, once the directive is sent, records it as the best-known directory.
   * The shell is not re-queried.
   *
   * @param path target directory
   * @return true if the directive was sent
   */
  public boolean changeDirectory(final String path) {
    Validate.notNull(path, "path must not be null");
    if (!isExistingDirectory(path)) {
      LOGGER.warn("Directory does not exist: {}", path);
      errorSink.accept(ShellErrorKind.PATH_INVALID);
      return false;
    }
    boolean sent = sendInput(ShellDirectives.changeDirectory(path), true);
    if (sent) {
      synchronized (directoryLock) {
        knownDirectory = path;
      }
      LOGGER.info("Changed directory to {}", path);
    }
    return sent;
  }

  public String getCurrentDirectory() {
    return getCurrentDirectory(defaultQueryTimeout);
  }

  /**
   * Asks the shell for its location and returns it, falling back to the best-known directory.
   *
   * <p>Blocks at most for the settle delay plus {@code queryTimeout}. Never throws.
   *
   * @param queryTimeout drain budget for the answer
   * @return current directory, possibly stale
   */
  public String getCurrentDirectory(final Duration queryTimeout) {
    Validate.notNull(queryTimeout, "queryTimeout must not be null");
    if (!input.isAlive()) {
      return fallbackDirectory();
    }
    try {
      Optional<String> found = queryDirectory(queryTimeout);
      if (found.isPresent()) {
        String normalized = normalize(found.get());
        synchronized (directoryLock) {
          knownDirectory = normalized;
        }
        LOGGER.info("Shell reports directory: {}", normalized);
        return normalized;
      }
      LOGGER.debug("Directory query inconclusive, using last known directory");
      errorSink.accept(ShellErrorKind.DIRECTORY_QUERY_INCONCLUSIVE);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.debug("Directory query interrupted");
    } catch (RuntimeException e) {
      LOGGER.error("Directory query failed: {}", e.getMessage(), e);
    }
    return fallbackDirectory();
  }

  /**
   * Returns the best-known directory without any I/O.
   *
   * @return best-known directory, or the JVM's current directory if none is known
   */
  public String getKnownDirectory() {
    return fallbackDirectory();
  }

  /**
   * Replaces the best-known directory, e.g. after a restart in the configured directory.
   *
   * @param directory new directory (may be null)
   */
  public void resetKnownDirectory(final String directory) {
    synchronized (directoryLock) {
      knownDirectory = directory;
    }
  }

  private Optional<String> queryDirectory(final Duration queryTimeout) throws InterruptedException {
    // Drop output produced before the query so it cannot be mistaken for the answer.
    pump.clear();
    if (!sendInput(ShellDirectives.QUERY_DIRECTORY, true)) {
      return Optional.empty();
    }
    TimeUnit.MILLISECONDS.sleep(settleDelay.toMillis());

    long deadline = System.nanoTime() + queryTimeout.toNanos();
    List<OutputLine> captured = new ArrayList<>();
    while (true) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        break;
      }
      List<OutputLine> batch = pump.drain(Duration.ofNanos(remaining));
      if (batch.isEmpty()) {
        break;
      }
      captured.addAll(batch);
      Optional<String> candidate = directoryPolicy.selectDirectory(captured);
      if (candidate.isPresent()) {
        return candidate;
      }
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedException("Interrupted while draining directory query output");
    }
    return Optional.empty();
  }

  private String fallbackDirectory() {
    synchronized (directoryLock) {
      if (StringUtils.isNotEmpty(knownDirectory)) {
        return knownDirectory;
      }
    }
    return System.getProperty("user.dir");
  }

  static String normalize(final String raw) {
    try {
      return Path.of(raw).normalize().toString();
    } catch (InvalidPathException e) {
      return raw;
    }
  }

  private static boolean isExistingDirectory(final String path) {
    try {
      return Files.isDirectory(Path.of(path));
    } catch (InvalidPathException e) {
      return false;
    }
  }
}
