package com.consullo.shell.ansi;

import com.jediterm.core.Color;

/**
 * Fixed 16-color foreground palette for SGR codes 30-37 and 90-97.
 */
public final class AnsiPalette {

  public static final Color DEFAULT_FOREGROUND = rgb(0xD4D4D4);

  private static final Color[] NORMAL = {
    rgb(0x000000), // black
    rgb(0xFF5555), // red
    rgb(0x50FA7B), // green
    rgb(0xF1FA8C), // yellow
    rgb(0xBD93F9), // blue
    rgb(0xFF79C6), // magenta
    rgb(0x8BE9FD), // cyan
    rgb(0xF8F8F2), // white
  };

  private static final Color[] BRIGHT = {
    rgb(0x6272A4),
    rgb(0xFF6E6E),
    rgb(0x69FF94),
    rgb(0xFFFFA5),
    rgb(0xD6ACFF),
    rgb(0xFF92DF),
    rgb(0xA4FFFF),
    rgb(0xFFFFFF),
  };

  private AnsiPalette() {
  }

  /**
   * Returns the palette color for an SGR foreground code.
   *
   * @param code SGR parameter
   * @return color, or null if the code is not a recognized foreground code
   */
  public static Color foreground(int code) {
    if (code >= 30 && code <= 37) {
      return NORMAL[code - 30];
    }
    if (code >= 90 && code <= 97) {
      return BRIGHT[code - 90];
    }
    return null;
  }

  private static Color rgb(int value) {
    return new Color((value >> 16) & 0xFF, (value >> 8) & 0xFF, value & 0xFF);
  }
}
