package com.consullo.shell.process;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration for spawning a pipe-attached shell process.
 *
 * @param command command and arguments (e.g., ["pwsh", "-NoExit", "-Command", ""])
 * @param workingDirectory working directory for the spawned process
 * @param environment environment variables to add/override (may be null)
 * @param charset charset used on the three pipes
 * @since 1.0
 */
public record ShellProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    Charset charset) {
}
