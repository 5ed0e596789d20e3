package com.consullo.shell.driver;

import com.consullo.shell.config.ShellSessionConfig;
import com.consullo.shell.process.ShellExecutableResolver;
import com.consullo.shell.process.ShellProcessControllerJdk;
import com.consullo.shell.process.ShellProcessLauncher;
import com.consullo.shell.protocol.DefaultDirectoryLineFilterPolicy;
import java.nio.file.Path;

/**
 * Factory for creating shell sessions with sensible defaults.
 *
 * <p>
 * Centralizes the choice of launcher, executable resolution and directory
 * detection policy. Sessions are returned unstarted.
 * </p>
 */
public final class ShellSessionFactory {

  private ShellSessionFactory() {
  }

  /**
   * Create a PowerShell session rooted at the given directory.
   *
   * @param workingDirectory working dir (if null, uses current directory)
   * @return unstarted session
   */
  public static ShellSession createPowerShellSession(Path workingDirectory) {
    return createPowerShellSession(ShellSessionConfig.defaults(workingDirectory));
  }

  /**
   * Create a session that spawns a real process for the given configuration.
   *
   * @param config configuration
   * @return unstarted session
   */
  public static ShellSession createPowerShellSession(ShellSessionConfig config) {
    return createSession(config, ShellProcessControllerJdk::new);
  }

  /**
   * Create a session with a custom launcher.
   *
   * @param config configuration
   * @param launcher process launcher
   * @return unstarted session
   */
  public static ShellSession createSession(ShellSessionConfig config, ShellProcessLauncher launcher) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null.");
    }
    if (launcher == null) {
      throw new IllegalArgumentException("launcher must not be null.");
    }
    return new ShellSession(
            config,
            launcher,
            ShellExecutableResolver.forCurrentPlatform(),
            new DefaultDirectoryLineFilterPolicy());
  }
}
