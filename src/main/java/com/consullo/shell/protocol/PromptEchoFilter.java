package com.consullo.shell.protocol;

/**
 * Removes PowerShell prompt echoes and table furniture from output destined for display.
 *
 * <p>A display surface that draws its own prompt would otherwise show the shell's prompt twice.
 */
public final class PromptEchoFilter {

  private PromptEchoFilter() {
  }

  /**
   * Filters a chunk line by line.
   *
   * @param text output chunk, possibly multi-line
   * @return the chunk without prompt echoes and {@code Path}/{@code ----} rows
   */
  public static String filterForDisplay(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length());
    int start = 0;
    boolean first = true;
    while (start <= text.length()) {
      int nl = text.indexOf('\n', start);
      int end = nl < 0 ? text.length() : nl;
      String line = text.substring(start, end);
      if (!isFurniture(line)) {
        if (!first) {
          sb.append('\n');
        }
        sb.append(line);
        first = false;
      }
      if (nl < 0) {
        break;
      }
      start = nl + 1;
    }
    return sb.toString();
  }

  /**
   * Single-line form of {@link #filterForDisplay(String)}.
   *
   * @param line one line
   * @return true if the line should not be shown
   */
  public static boolean isFurniture(String line) {
    String s = line.trim();
    if (s.isEmpty()) {
      return false;
    }
    return DefaultDirectoryLineFilterPolicy.isPromptEcho(s)
            || s.equals("Path")
            || s.equals("----");
  }
}
