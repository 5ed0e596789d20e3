package com.consullo.shell.pump;

import java.time.Instant;

/**
 * One line read from the shell, tagged with the pipe it came from.
 *
 * <p>The text carries no line terminator.
 */
public final class OutputLine {

  public enum Stream {
    STDOUT,
    STDERR
  }

  private final Stream stream;
  private final String text;
  private final Instant timestamp;

  private OutputLine(Stream stream, String text, Instant timestamp) {
    this.stream = stream;
    this.text = text;
    this.timestamp = timestamp;
  }

  public static OutputLine of(Stream stream, String text) {
    return of(stream, text, Instant.now());
  }

  public static OutputLine of(Stream stream, String text, Instant ts) {
    if (stream == null || text == null || ts == null) {
      throw new IllegalArgumentException("stream/text/ts must not be null.");
    }
    return new OutputLine(stream, text, ts);
  }

  public static OutputLine stdout(String text) {
    return of(Stream.STDOUT, text);
  }

  public static OutputLine stderr(String text) {
    return of(Stream.STDERR, text);
  }

  public Stream stream() {
    return stream;
  }

  public String text() {
    return text;
  }

  public Instant timestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return stream + ": " + text;
  }
}
