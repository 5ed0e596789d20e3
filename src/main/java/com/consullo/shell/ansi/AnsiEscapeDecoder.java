package com.consullo.shell.ansi;

import com.jediterm.core.Color;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes ANSI SGR color sequences ({@code ESC [ params m}) into styled runs.
 *
 * <p>
 * Only foreground colors are interpreted: {@code 0} (or an empty parameter
 * list) resets, {@code 30-37} and {@code 90-97} pick a palette color,
 * {@code 39} restores the default foreground, anything else is ignored. Other
 * escape sequences are not SGR and stay in the text untouched.
 * </p>
 *
 * <p>
 * The decoder is a pure function of the chunk and the starting format. It does
 * not track cursor position or screen state; output is treated as a stream of
 * lines.
 * </p>
 */
public final class AnsiEscapeDecoder {

  static final char ESC = 0x1B;

  private static final int RESET = 0;
  private static final int DEFAULT_FOREGROUND = 39;

  // Longer parameters (after leading zeros) cannot be a code we know and could overflow an int.
  private static final int MAX_PARAM_DIGITS = 3;

  private AnsiEscapeDecoder() {
  }

  public static DecodedChunk decode(String chunk) {
    return decode(chunk, TextFormat.DEFAULT);
  }

  /**
   * Decodes one chunk.
   *
   * @param chunk text possibly containing SGR sequences
   * @param startFormat format active before the chunk
   * @return runs; {@code decorated()} is false if the chunk had no SGR sequence
   */
  public static DecodedChunk decode(String chunk, TextFormat startFormat) {
    if (chunk == null) {
      throw new IllegalArgumentException("chunk must not be null.");
    }
    if (startFormat == null) {
      throw new IllegalArgumentException("startFormat must not be null.");
    }
    if (chunk.indexOf(ESC) < 0) {
      return DecodedChunk.plain(chunk, startFormat);
    }

    List<StyledRun> runs = new ArrayList<>();
    TextFormat format = startFormat;
    boolean matched = false;
    int textStart = 0;
    int i = 0;
    int n = chunk.length();

    while (i < n) {
      if (chunk.charAt(i) == ESC) {
        int end = sgrEnd(chunk, i);
        if (end > 0) {
          addRun(runs, chunk, textStart, i, format);
          // parameters sit between "ESC[" and the final 'm'
          format = applyParameters(format, chunk, i + 2, end - 1);
          matched = true;
          textStart = end;
          i = end;
          continue;
        }
      }
      i++;
    }

    if (!matched) {
      return DecodedChunk.plain(chunk, startFormat);
    }
    addRun(runs, chunk, textStart, n, format);
    return new DecodedChunk(runs, true, format);
  }

  /**
   * Removes every SGR sequence from the chunk.
   *
   * @param chunk text
   * @return plain text
   */
  public static String strip(String chunk) {
    return decode(chunk).plainText();
  }

  /**
   * Returns the index just past the terminating 'm' if an SGR sequence starts at {@code escIndex}, else -1.
   */
  private static int sgrEnd(String s, int escIndex) {
    int j = escIndex + 1;
    if (j >= s.length() || s.charAt(j) != '[') {
      return -1;
    }
    j++;
    while (j < s.length()) {
      char c = s.charAt(j);
      if (c == 'm') {
        return j + 1;
      }
      if (!isDigit(c) && c != ';') {
        return -1;
      }
      j++;
    }
    return -1;
  }

  private static TextFormat applyParameters(TextFormat format, String s, int from, int to) {
    if (from == to) {
      // ESC[m
      return TextFormat.RESET;
    }
    TextFormat current = format;
    int start = from;
    for (int k = from; k <= to; k++) {
      if (k == to || s.charAt(k) == ';') {
        current = applyCode(current, s, start, k);
        start = k + 1;
      }
    }
    return current;
  }

  private static TextFormat applyCode(TextFormat format, String s, int from, int to) {
    if (to == from) {
      return format;
    }
    int digits = from;
    // keep the last digit so "000" still reads as 0
    while (digits < to - 1 && s.charAt(digits) == '0') {
      digits++;
    }
    if (to - digits > MAX_PARAM_DIGITS) {
      return format;
    }
    int code = 0;
    for (int k = digits; k < to; k++) {
      code = code * 10 + (s.charAt(k) - '0');
    }
    if (code == RESET) {
      return TextFormat.RESET;
    }
    if (code == DEFAULT_FOREGROUND) {
      return format.withForeground(null);
    }
    Color color = AnsiPalette.foreground(code);
    return color != null ? format.withForeground(color) : format;
  }

  private static void addRun(List<StyledRun> runs, String s, int from, int to, TextFormat format) {
    if (to > from) {
      runs.add(StyledRun.of(s.substring(from, to), format));
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
