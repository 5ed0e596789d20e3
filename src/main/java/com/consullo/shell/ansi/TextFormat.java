package com.consullo.shell.ansi;

import com.jediterm.core.Color;

/**
 * Active display format while decoding.
 *
 * @param foreground palette foreground, or null for the default foreground
 * @param reset true once an SGR reset was applied and no color has been chosen since
 * @since 1.0
 */
public record TextFormat(Color foreground, boolean reset) {

  public static final TextFormat DEFAULT = new TextFormat(null, false);

  static final TextFormat RESET = new TextFormat(null, true);

  TextFormat withForeground(Color color) {
    return new TextFormat(color, false);
  }
}
