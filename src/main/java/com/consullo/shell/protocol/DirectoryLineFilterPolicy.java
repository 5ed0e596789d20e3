package com.consullo.shell.protocol;

import com.consullo.shell.pump.OutputLine;
import java.util.List;
import java.util.Optional;

/**
 * Picks the working directory out of the lines captured after a directory query.
 *
 * <p>The shell answers with its own furniture around the path (prompt echoes, table headers, blank lines).
 * Implementations decide which line, if any, is the answer.
 *
 * @since 1.0
 */
public interface DirectoryLineFilterPolicy {

  /**
   * Returns the first line that is an acceptable directory, trimmed but not normalized.
   *
   * @param capturedLines lines drained after the query, in arrival order
   * @return directory candidate, or empty if the capture is inconclusive
   */
  Optional<String> selectDirectory(final List<OutputLine> capturedLines);
}
