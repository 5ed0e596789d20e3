package com.consullo.shell.process;

import com.consullo.shell.config.ShellSessionConfig;
import com.consullo.shell.core.ShellControllerException;
import com.consullo.shell.core.ShellErrorKind;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the command line used to spawn the interactive shell.
 *
 * <p>Resolution order:
 * 1) an explicit command list from configuration, used verbatim
 * 2) a configured executable override, which must exist
 * 3) PowerShell 7 at its Windows install location
 * 4) {@code pwsh} (or {@code pwsh.exe}) on the PATH
 * 5) on Windows only, the bundled {@code powershell.exe}, left to the OS to locate
 *
 * <p>PowerShell is started with {@code -NoExit -Command ""} so it keeps reading commands from stdin.
 *
 * @since 1.0
 */
public final class ShellExecutableResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShellExecutableResolver.class);

  static final String POWERSHELL_7_WINDOWS = "C:\\Program Files\\PowerShell\\7\\pwsh.exe";
  static final String WINDOWS_POWERSHELL = "powershell.exe";

  private static final List<String> INTERACTIVE_ARGS = List.of("-NoExit", "-Command", "");

  private final boolean windows;
  private final String pathVariable;

  /**
   * Creates a resolver for an explicit platform; used directly by tests.
   *
   * @param osName value in the style of the {@code os.name} system property
   * @param pathVariable PATH environment value (may be null)
   */
  public ShellExecutableResolver(final String osName, final String pathVariable) {
    Validate.notNull(osName, "osName must not be null");
    this.windows = osName.toLowerCase(Locale.ROOT).contains("win");
    this.pathVariable = pathVariable != null ? pathVariable : "";
  }

  public static ShellExecutableResolver forCurrentPlatform() {
    return new ShellExecutableResolver(System.getProperty("os.name", ""), System.getenv("PATH"));
  }

  /**
   * Resolves the full command line for the session.
   *
   * @param config session configuration
   * @return command and arguments
   * @throws ShellControllerException with {@code LAUNCH_FAILED} if no shell executable can be found
   */
  public List<String> resolveCommand(final ShellSessionConfig config) throws ShellControllerException {
    Validate.notNull(config, "config must not be null");

    if (!config.getShellCommand().isEmpty()) {
      return config.getShellCommand();
    }

    final String executable = resolveExecutable(config.getShellExecutable());
    LOGGER.info("Using shell executable: {}", executable);

    final List<String> command = new ArrayList<>(1 + INTERACTIVE_ARGS.size());
    command.add(executable);
    command.addAll(INTERACTIVE_ARGS);
    return command;
  }

  private String resolveExecutable(final Path override) throws ShellControllerException {
    if (override != null) {
      if (Files.isRegularFile(override)) {
        return override.toString();
      }
      throw new ShellControllerException(ShellErrorKind.LAUNCH_FAILED,
          "Configured shell executable does not exist: " + override);
    }

    if (this.windows && isRegularFile(POWERSHELL_7_WINDOWS)) {
      return POWERSHELL_7_WINDOWS;
    }

    final Path onPath = searchPath(this.windows ? "pwsh.exe" : "pwsh");
    if (onPath != null) {
      return onPath.toString();
    }

    if (this.windows) {
      return WINDOWS_POWERSHELL;
    }
    throw new ShellControllerException(ShellErrorKind.LAUNCH_FAILED,
        "No PowerShell executable (pwsh) found on PATH");
  }

  private Path searchPath(final String name) {
    for (final String entry : StringUtils.split(this.pathVariable, File.pathSeparatorChar)) {
      if (StringUtils.isBlank(entry)) {
        continue;
      }
      try {
        final Path candidate = Path.of(entry.trim()).resolve(name);
        if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
          return candidate;
        }
      } catch (final InvalidPathException e) {
        LOGGER.debug("Skipping invalid PATH entry '{}'", entry);
      }
    }
    return null;
  }

  private static boolean isRegularFile(final String path) {
    try {
      return Files.isRegularFile(Path.of(path));
    } catch (final InvalidPathException e) {
      return false;
    }
  }
}
