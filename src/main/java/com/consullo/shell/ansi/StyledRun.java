package com.consullo.shell.ansi;

import com.jediterm.core.Color;

/**
 * A contiguous span of decoded text sharing one format.
 *
 * @param text run text, escape sequences removed
 * @param foreground palette foreground, or null for the default foreground
 * @param reset true if the run follows an SGR reset
 * @since 1.0
 */
public record StyledRun(String text, Color foreground, boolean reset) {

  static StyledRun of(String text, TextFormat format) {
    return new StyledRun(text, format.foreground(), format.reset());
  }

  /**
   * Returns the color to paint this run with, the palette's default foreground when no color is set.
   */
  public Color displayForeground() {
    return foreground != null ? foreground : AnsiPalette.DEFAULT_FOREGROUND;
  }
}
