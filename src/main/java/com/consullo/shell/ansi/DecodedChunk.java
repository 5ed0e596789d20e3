package com.consullo.shell.ansi;

import java.util.List;

/**
 * Result of decoding one chunk.
 *
 * @param runs ordered runs; concatenated they give the chunk without escape sequences
 * @param decorated false when the chunk had no SGR sequence and can be inserted as plain text
 * @param endFormat format active after the last run, to carry into the next chunk
 * @since 1.0
 */
public record DecodedChunk(List<StyledRun> runs, boolean decorated, TextFormat endFormat) {

  public DecodedChunk {
    runs = List.copyOf(runs);
  }

  static DecodedChunk plain(String chunk, TextFormat format) {
    return new DecodedChunk(List.of(StyledRun.of(chunk, format)), false, format);
  }

  /**
   * Concatenates the run texts.
   *
   * @return plain text
   */
  public String plainText() {
    StringBuilder sb = new StringBuilder();
    for (StyledRun run : runs) {
      sb.append(run.text());
    }
    return sb.toString();
  }
}
