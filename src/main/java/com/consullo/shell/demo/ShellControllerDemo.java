package com.consullo.shell.demo;

import com.consullo.shell.ansi.AnsiEscapeDecoder;
import com.consullo.shell.config.ShellConfigLoader;
import com.consullo.shell.config.ShellSessionConfig;
import com.consullo.shell.driver.ShellSession;
import com.consullo.shell.driver.ShellSessionFactory;
import com.consullo.shell.protocol.PromptEchoFilter;
import com.consullo.shell.pump.OutputLine;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented console front end for a controlled shell.
 *
 * <p>Usage: {@code ShellControllerDemo [config.json]}. Lines typed on stdin are executed in the shell. Meta
 * commands: {@code :pwd} queries the shell's directory, {@code :cd <dir>} changes it, {@code :quit} (or EOF)
 * stops the shell.
 *
 * @since 1.0
 */
public final class ShellControllerDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShellControllerDemo.class);

  private ShellControllerDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional path to a JSON config file
   * @throws Exception if reading the console fails
   */
  public static void main(final String[] args) throws Exception {
    final ShellSessionConfig config = args.length > 0
        ? new ShellConfigLoader().load(Path.of(args[0]))
        : ShellSessionConfig.defaults(null);

    final PrintStream out = System.out;

    try (final ShellSession session = ShellSessionFactory.createPowerShellSession(config)) {
      session.addOutputListener((stream, text) -> {
        if (PromptEchoFilter.isFurniture(text)) {
          return;
        }
        final String plain = AnsiEscapeDecoder.strip(text);
        out.println(stream == OutputLine.Stream.STDERR ? "! " + plain : plain);
      });

      if (!session.start()) {
        out.println("Shell failed to start: " + session.lastError().map(Enum::name).orElse("unknown"));
        return;
      }
      out.println("PS " + session.getCurrentDirectory() + ">");

      final BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
      String line;
      while ((line = console.readLine()) != null) {
        final String trimmed = line.trim();
        if (":quit".equals(trimmed)) {
          break;
        }
        if (":pwd".equals(trimmed)) {
          out.println(session.getCurrentDirectory());
          continue;
        }
        if (trimmed.startsWith(":cd ")) {
          if (!session.changeDirectory(trimmed.substring(4).trim())) {
            out.println("cd failed: " + session.lastError().map(Enum::name).orElse("unknown"));
          }
          continue;
        }
        if (!session.executeCommand(line)) {
          out.println("Command not sent: " + session.lastError().map(Enum::name).orElse("unknown"));
          if (!session.isAlive()) {
            break;
          }
        }
      }
      LOGGER.info("Demo completed");
    }
  }
}
