package com.consullo.shell.core;

/**
 * Run state of a shell session.
 *
 * <p>{@link #STOPPED} is also the cooperative cancellation signal for the output reader loops.
 *
 * @since 1.0
 */
public enum RunState {
  STOPPED,
  RUNNING
}
