package com.consullo.shell.core;

import org.apache.commons.lang3.Validate;

/**
 * Checked failure raised inside the controller and converted to a boolean result at the session boundary.
 *
 * @since 1.0
 */
public final class ShellControllerException extends Exception {

  private static final long serialVersionUID = 1L;

  private final ShellErrorKind kind;

  public ShellControllerException(final ShellErrorKind kind, final String message) {
    this(kind, message, null);
  }

  public ShellControllerException(final ShellErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    Validate.notNull(kind, "kind must not be null");
    this.kind = kind;
  }

  public ShellErrorKind kind() {
    return this.kind;
  }
}
