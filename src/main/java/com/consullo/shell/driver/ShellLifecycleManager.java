package com.consullo.shell.driver;

import com.consullo.shell.config.ShellSessionConfig;
import com.consullo.shell.core.RunState;
import com.consullo.shell.core.ShellControllerException;
import com.consullo.shell.core.ShellErrorKind;
import com.consullo.shell.process.ShellExecutableResolver;
import com.consullo.shell.process.ShellProcessConfig;
import com.consullo.shell.process.ShellProcessController;
import com.consullo.shell.process.ShellProcessLauncher;
import com.consullo.shell.protocol.ShellDirectives;
import com.consullo.shell.protocol.ShellInput;
import com.consullo.shell.pump.OutputPump;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the existence of the shell child process.
 *
 * <p>
 * The controller reference and run state are written only here, under the
 * lifecycle lock. Readers ({@link #isAlive()}, the pump's reader loops) see
 * them through volatile reads. Shutdown is graduated and bounded:
 * <ol>
 * <li>write {@code exit}</li>
 * <li>wait for a natural exit</li>
 * <li>send a graceful terminate and wait again</li>
 * <li>force-kill</li>
 * </ol>
 * then the reader loops are joined with a timeout.
 * </p>
 */
public final class ShellLifecycleManager implements ShellInput {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShellLifecycleManager.class);

  private final ShellSessionConfig config;
  private final ShellProcessLauncher launcher;
  private final ShellExecutableResolver resolver;
  private final OutputPump pump;
  private final Consumer<ShellErrorKind> errorSink;

  private final Object lifecycleLock = new Object();
  private final Object writeLock = new Object();

  private volatile RunState runState = RunState.STOPPED;
  private volatile ShellProcessController controller;

  public ShellLifecycleManager(
          ShellSessionConfig config,
          ShellProcessLauncher launcher,
          ShellExecutableResolver resolver,
          OutputPump pump,
          Consumer<ShellErrorKind> errorSink) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(launcher, "launcher must not be null");
    Validate.notNull(resolver, "resolver must not be null");
    Validate.notNull(pump, "pump must not be null");
    Validate.notNull(errorSink, "errorSink must not be null");
    this.config = config;
    this.launcher = launcher;
    this.resolver = resolver;
    this.pump = pump;
    this.errorSink = errorSink;
  }

  /**
   * Spawns the shell and its reader loops.
   *
   * @return false if a process is already alive, the working directory is missing, or the launch fails
   */
  public boolean start() {
    synchronized (lifecycleLock) {
      if (isAlive()) {
        LOGGER.warn("Shell already running, start ignored");
        errorSink.accept(ShellErrorKind.ALREADY_RUNNING);
        return false;
      }
      if (controller != null) {
        LOGGER.info("Previous shell process has exited, releasing it before relaunch");
        release(controller);
      }

      Path workDir = config.getWorkingDirectory();
      if (!Files.isDirectory(workDir)) {
        LOGGER.error("Shell working directory does not exist: {}", workDir);
        errorSink.accept(ShellErrorKind.WORKING_DIRECTORY_INVALID);
        return false;
      }

      try {
        List<String> command = resolver.resolveCommand(config);
        ShellProcessConfig processConfig = new ShellProcessConfig(
                command, workDir, config.getEnvironment(), config.getCharset());
        ShellProcessController c = launcher.launch(processConfig);

        this.controller = c;
        this.runState = RunState.RUNNING;
        pump.start(c, () -> isCurrent(c));
        watchExit(c);

        LOGGER.info("Shell started: {} (PID={}) in {}", command.get(0), c.pid(), workDir);
        return true;
      } catch (ShellControllerException e) {
        LOGGER.error("Failed to start shell: {}", e.getMessage(), e);
        errorSink.accept(e.kind());
        return false;
      }
    }
  }

  /**
   * Returns true if the session is running and the process has not exited. Never throws.
   */
  @Override
  public boolean isAlive() {
    ShellProcessController c = controller;
    if (runState != RunState.RUNNING || c == null) {
      return false;
    }
    try {
      return c.isAlive();
    } catch (RuntimeException e) {
      LOGGER.debug("Liveness probe failed: {}", e.getMessage());
      return false;
    }
  }

  public RunState runState() {
    return runState;
  }

  @Override
  public void write(String text) throws ShellControllerException {
    Validate.notNull(text, "text must not be null");
    ShellProcessController c = controller;
    if (c == null || !isAlive()) {
      throw new ShellControllerException(ShellErrorKind.NOT_RUNNING, "Shell process is not running");
    }
    byte[] bytes = text.getBytes(config.getCharset());
    synchronized (writeLock) {
      try {
        OutputStream stdin = c.getStdin();
        stdin.write(bytes);
        stdin.flush();
      } catch (IOException e) {
        throw new ShellControllerException(ShellErrorKind.WRITE_FAILED,
                "Failed writing to shell stdin: " + e.getMessage(), e);
      }
    }
  }

  /**
   * Stops the shell. Idempotent, bounded, and always returns true; the observable result is that the
   * session is no longer running.
   *
   * @return true
   */
  public boolean stop() {
    synchronized (lifecycleLock) {
      // Flip first so the reader loops stop at their next iteration.
      runState = RunState.STOPPED;
      ShellProcessController c = controller;
      if (c == null) {
        return true;
      }
      LOGGER.info("Stopping shell (PID={})", c.pid());
      try {
        requestExit(c);
        if (!awaitExit(c, config.getExitGracePeriod())) {
          LOGGER.info("Shell did not exit within {} ms, terminating", config.getExitGracePeriod().toMillis());
          terminateQuietly(c);
          if (!awaitExit(c, config.getTerminateGracePeriod())) {
            LOGGER.warn("Shell did not terminate within {} ms, killing",
                    config.getTerminateGracePeriod().toMillis());
            killQuietly(c);
            awaitExit(c, config.getKillGracePeriod());
          }
        }
      } finally {
        release(c);
      }
      LOGGER.info("Shell stopped");
      return true;
    }
  }

  // Readers of an earlier process stay stopped even after a restart flips the state back to RUNNING.
  private boolean isCurrent(ShellProcessController c) {
    return controller == c && runState == RunState.RUNNING;
  }

  private void release(ShellProcessController c) {
    try {
      c.close();
    } catch (RuntimeException e) {
      LOGGER.warn("Closing shell process failed: {}", e.getMessage(), e);
    }
    if (!pump.join(config.getReaderJoinTimeout())) {
      LOGGER.warn("Output reader threads did not finish within {} ms, detaching them",
              config.getReaderJoinTimeout().toMillis());
    }
    if (controller == c) {
      controller = null;
    }
  }

  private void requestExit(ShellProcessController c) {
    synchronized (writeLock) {
      try {
        OutputStream stdin = c.getStdin();
        stdin.write((ShellDirectives.EXIT + "\n").getBytes(config.getCharset()));
        stdin.flush();
      } catch (IOException | RuntimeException e) {
        LOGGER.debug("Exit directive not delivered: {}", e.getMessage());
      }
    }
  }

  private static boolean awaitExit(ShellProcessController c, Duration timeout) {
    try {
      return c.waitFor(timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return !c.isAlive();
    } catch (RuntimeException e) {
      LOGGER.debug("Waiting for shell exit failed: {}", e.getMessage());
      return false;
    }
  }

  private static void terminateQuietly(ShellProcessController c) {
    try {
      c.terminate();
    } catch (RuntimeException e) {
      LOGGER.debug("Terminate failed: {}", e.getMessage());
    }
  }

  private static void killQuietly(ShellProcessController c) {
    try {
      c.kill();
    } catch (RuntimeException e) {
      LOGGER.debug("Kill failed: {}", e.getMessage());
    }
  }

  private void watchExit(ShellProcessController c) {
    c.onExit().whenComplete((code, error) -> {
      if (controller == c && runState == RunState.RUNNING) {
        LOGGER.info("Shell exited on its own (code={})", code);
      }
    });
  }
}
