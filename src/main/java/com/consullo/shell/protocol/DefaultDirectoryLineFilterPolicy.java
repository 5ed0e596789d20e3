package com.consullo.shell.protocol;

import com.consullo.shell.pump.OutputLine;
import java.util.List;
import java.util.Optional;

/**
 * PowerShell directory detection heuristics.
 *
 * <p>
 * A line is skipped when it is blank, a prompt echo ({@code PS C:\work>} or
 * {@code PS C:\work> (Get-Location).Path}), the default table header
 * {@code Path}, a separator made of dashes, or an echo of the query itself.
 * The first remaining stdout line that looks like a filesystem path wins:
 * either it contains a volume separator ({@code :}) and is longer than two
 * characters, or it is an absolute POSIX path (PowerShell on Unix). stderr
 * lines are never candidates since error messages routinely contain colons.
 * No regex is used.
 * </p>
 */
public final class DefaultDirectoryLineFilterPolicy implements DirectoryLineFilterPolicy {

  private static final String PROMPT_PREFIX = "PS ";
  private static final String TABLE_HEADER = "Path";

  @Override
  public Optional<String> selectDirectory(List<OutputLine> capturedLines) {
    if (capturedLines == null) {
      return Optional.empty();
    }
    for (OutputLine line : capturedLines) {
      if (line == null || line.stream() != OutputLine.Stream.STDOUT) {
        continue;
      }
      String s = line.text().trim();
      if (s.isEmpty() || isPromptEcho(s) || isTableFurniture(s) || isQueryEcho(s)) {
        continue;
      }
      if (looksLikePath(s)) {
        return Optional.of(s);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns true for a PowerShell prompt, with or without a command echoed after it.
   *
   * @param trimmed trimmed line
   * @return true if prompt echo
   */
  public static boolean isPromptEcho(String trimmed) {
    if (!trimmed.startsWith(PROMPT_PREFIX)) {
      return false;
    }
    return trimmed.endsWith(">") || trimmed.contains("> ");
  }

  /**
   * Returns true for the header and separator rows PowerShell prints around a single-column table.
   *
   * @param trimmed trimmed line
   * @return true if table furniture
   */
  public static boolean isTableFurniture(String trimmed) {
    if (trimmed.equalsIgnoreCase(TABLE_HEADER)) {
      return true;
    }
    return allDashes(trimmed);
  }

  private static boolean isQueryEcho(String trimmed) {
    return trimmed.equals(ShellDirectives.QUERY_DIRECTORY);
  }

  static boolean looksLikePath(String s) {
    if (s.indexOf(':') >= 0 && s.length() > 2) {
      return true;
    }
    return s.length() > 1 && s.charAt(0) == '/';
  }

  private static boolean allDashes(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) != '-') {
        return false;
      }
    }
    return s.length() > 0;
  }
}
