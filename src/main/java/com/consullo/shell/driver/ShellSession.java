package com.consullo.shell.driver;

import com.consullo.shell.config.ShellSessionConfig;
import com.consullo.shell.core.RunState;
import com.consullo.shell.core.ShellErrorKind;
import com.consullo.shell.process.ShellExecutableResolver;
import com.consullo.shell.process.ShellProcessLauncher;
import com.consullo.shell.protocol.CommandProtocol;
import com.consullo.shell.protocol.DirectoryLineFilterPolicy;
import com.consullo.shell.pump.OutputLine;
import com.consullo.shell.pump.OutputListener;
import com.consullo.shell.pump.OutputPump;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Represents a single controlled interactive shell.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>Lifecycle manager (spawn, health check, graduated shutdown)</li>
 * <li>Output pump (stdout/stderr reader loops, listener fan-out)</li>
 * <li>Command protocol (directives and working-directory tracking)</li>
 * </ul>
 * </p>
 *
 * <p>
 * Every operation reports failure as a {@code false} result (or a fallback
 * directory) rather than an exception; {@link #lastError()} tells why the most
 * recent failure happened.
 * </p>
 */
public final class ShellSession implements AutoCloseable {

  private final ShellSessionConfig config;
  private final OutputPump pump;
  private final ShellLifecycleManager lifecycle;
  private final CommandProtocol protocol;

  private final AtomicReference<ShellErrorKind> lastError = new AtomicReference<>();

  ShellSession(
          ShellSessionConfig config,
          ShellProcessLauncher launcher,
          ShellExecutableResolver resolver,
          DirectoryLineFilterPolicy directoryPolicy) {
    if (config == null || launcher == null || resolver == null || directoryPolicy == null) {
      throw new IllegalArgumentException("config/launcher/resolver/directoryPolicy must not be null.");
    }
    this.config = config;
    this.pump = new OutputPump(config.getCharset(), config.getQueueCapacity());
    this.lifecycle = new ShellLifecycleManager(config, launcher, resolver, pump, lastError::set);
    this.protocol = new CommandProtocol(
            lifecycle,
            pump,
            directoryPolicy,
            config.getQuerySettleDelay(),
            config.getQueryTimeout(),
            config.getWorkingDirectory().toString(),
            lastError::set);
  }

  public ShellSessionConfig config() {
    return config;
  }

  /**
   * Starts the shell in the configured working directory.
   *
   * @return true on success
   */
  public boolean start() {
    boolean started = lifecycle.start();
    if (started) {
      protocol.resetKnownDirectory(config.getWorkingDirectory().toString());
    }
    return started;
  }

  /**
   * Starts the shell on a short-lived background thread so a UI thread is never blocked by process spawn.
   *
   * @return future completed with the result of {@link #start()}
   */
  public CompletableFuture<Boolean> startAsync() {
    CompletableFuture<Boolean> result = new CompletableFuture<>();
    Thread launcherThread = new Thread(() -> {
      try {
        result.complete(start());
      } catch (RuntimeException e) {
        result.completeExceptionally(e);
      }
    }, "ShellSessionLauncher");
    launcherThread.setDaemon(true);
    launcherThread.start();
    return result;
  }

  public boolean stop() {
    return lifecycle.stop();
  }

  public boolean isAlive() {
    return lifecycle.isAlive();
  }

  public RunState runState() {
    return lifecycle.runState();
  }

  public void addOutputListener(OutputListener listener) {
    pump.addListener(listener);
  }

  public void removeOutputListener(OutputListener listener) {
    pump.removeListener(listener);
  }

  /**
   * Pulls queued output; see {@link OutputPump#drain(Duration)}.
   */
  public List<OutputLine> drainOutput(Duration timeout) {
    return pump.drain(timeout);
  }

  public boolean sendInput(String text, boolean appendNewline) {
    return protocol.sendInput(text, appendNewline);
  }

  public boolean executeCommand(String command) {
    return protocol.executeCommand(command);
  }

  public boolean executeCommand(String command, String workingDirectory) {
    return protocol.executeCommand(command, workingDirectory);
  }

  public boolean executeCommand(String command, String workingDirectory, boolean immediate) {
    return protocol.executeCommand(command, workingDirectory, immediate);
  }

  public boolean changeDirectory(String path) {
    return protocol.changeDirectory(path);
  }

  public String getCurrentDirectory() {
    return protocol.getCurrentDirectory();
  }

  public String getCurrentDirectory(Duration queryTimeout) {
    return protocol.getCurrentDirectory(queryTimeout);
  }

  /**
   * Returns the best-known working directory without querying the shell.
   */
  public String getKnownDirectory() {
    return protocol.getKnownDirectory();
  }

  /**
   * Returns the kind of the most recent failed operation, if any.
   */
  public Optional<ShellErrorKind> lastError() {
    return Optional.ofNullable(lastError.get());
  }

  @Override
  public void close() {
    stop();
  }
}
