package com.consullo.shell.core;

/**
 * Failure categories reported by the shell controller.
 *
 * <p>None of these cross the public session boundary as exceptions. Operations return {@code false} and the
 * session records the kind as its last error.
 *
 * @since 1.0
 */
public enum ShellErrorKind {

  /** The shell executable could not be resolved or spawned. */
  LAUNCH_FAILED,

  /** {@code start()} was called while a live process already exists. */
  ALREADY_RUNNING,

  /** An input operation was attempted with no live process. */
  NOT_RUNNING,

  /** The configured working directory does not exist at launch time. */
  WORKING_DIRECTORY_INVALID,

  /** A directory-change or execute target does not exist. Rejected before any write. */
  PATH_INVALID,

  /** The input pipe is closed or broken. */
  WRITE_FAILED,

  /** A directory query produced no acceptable path line. The last known directory is used instead. */
  DIRECTORY_QUERY_INCONCLUSIVE
}
