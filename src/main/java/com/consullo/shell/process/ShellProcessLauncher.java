package com.consullo.shell.process;

import com.consullo.shell.core.ShellControllerException;

/**
 * Spawns shell processes. The production launcher is {@code ShellProcessControllerJdk::new}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ShellProcessLauncher {

  /**
   * Spawns a process for the given configuration.
   *
   * @param config process configuration
   * @return a controller owning the running process
   * @throws ShellControllerException with {@code LAUNCH_FAILED} if the process cannot be spawned
   */
  ShellProcessController launch(ShellProcessConfig config) throws ShellControllerException;
}
