package com.consullo.shell.protocol;

import org.apache.commons.lang3.Validate;

/**
 * PowerShell directive lines understood by the controlled shell.
 *
 * @since 1.0
 */
public final class ShellDirectives {

  public static final String QUERY_DIRECTORY = "(Get-Location).Path";

  public static final String EXIT = "exit";

  private ShellDirectives() {
  }

  /**
   * Builds {@code Set-Location "<path>"}.
   *
   * @param path target directory
   * @return directive text without newline
   */
  public static String changeDirectory(final String path) {
    Validate.notNull(path, "path must not be null");
    return "Set-Location \"" + path + "\"";
  }

  /**
   * Builds a single line that changes directory and then runs the command.
   *
   * @param workingDirectory directory scoped to this invocation
   * @param command command text
   * @return composed line without newline
   */
  public static String inDirectory(final String workingDirectory, final String command) {
    Validate.notNull(command, "command must not be null");
    return changeDirectory(workingDirectory) + "; " + command;
  }
}
