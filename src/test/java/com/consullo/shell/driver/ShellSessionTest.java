package com.consullo.shell.driver;

import com.consullo.shell.config.ShellSessionConfig;
import com.consullo.shell.core.RunState;
import com.consullo.shell.core.ShellControllerException;
import com.consullo.shell.core.ShellErrorKind;
import com.consullo.shell.process.ScriptedShellProcess;
import com.consullo.shell.process.ShellProcessLauncher;
import com.consullo.shell.pump.OutputLine;
import com.consullo.shell.pump.OutputListener;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Session-level tests against an in-memory PowerShell stand-in.
 *
 * @since 1.0
 */
public class ShellSessionTest {

  @TempDir
  Path tempDir;

  private final List<ScriptedShellProcess> launched = new CopyOnWriteArrayList<>();
  private ShellSession session;

  @BeforeEach
  void setUp() {
    session = ShellSessionFactory.createSession(config(tempDir), launcherFor(() -> new FakePowerShell().process()));
  }

  @AfterEach
  void tearDown() {
    session.close();
  }

  @Test
  @DisplayName("Should report success when stopping a session that never started")
  void stop_NeverStarted_ReturnsTrue() {
    assertThat(session.stop()).isTrue();
    assertThat(session.runState()).isEqualTo(RunState.STOPPED);
    assertThat(session.isAlive()).isFalse();
  }

  @Test
  @DisplayName("Should refuse a second start while the shell is alive")
  void start_AlreadyRunning_Rejected() {
    assertThat(session.start()).isTrue();

    assertThat(session.start()).isFalse();

    assertThat(session.lastError()).contains(ShellErrorKind.ALREADY_RUNNING);
    assertThat(launched).hasSize(1);
    assertThat(session.isAlive()).isTrue();
  }

  @Test
  @DisplayName("Should not launch when the working directory does not exist")
  void start_MissingWorkingDirectory_Rejected() {
    ShellSession missing = ShellSessionFactory.createSession(
        config(tempDir.resolve("missing")), launcherFor(ScriptedShellProcess::silent));

    assertThat(missing.start()).isFalse();

    assertThat(missing.lastError()).contains(ShellErrorKind.WORKING_DIRECTORY_INVALID);
    assertThat(launched).isEmpty();
    assertThat(missing.runState()).isEqualTo(RunState.STOPPED);
  }

  @Test
  @DisplayName("Should report a launch failure and stay stopped")
  void start_LaunchFails_Rejected() {
    ShellSession failing = ShellSessionFactory.createSession(config(tempDir), processConfig -> {
      throw new ShellControllerException(ShellErrorKind.LAUNCH_FAILED, "no such executable");
    });

    assertThat(failing.start()).isFalse();

    assertThat(failing.lastError()).contains(ShellErrorKind.LAUNCH_FAILED);
    assertThat(failing.isAlive()).isFalse();
  }

  @Test
  @DisplayName("Should complete the asynchronous start with the launch result")
  void startAsync_Completes() throws Exception {
    assertThat(session.startAsync().get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(session.isAlive()).isTrue();
  }

  @Test
  @DisplayName("Should refuse input when the shell is not running")
  void sendInput_NotRunning_Rejected() {
    assertThat(session.sendInput("dir", true)).isFalse();
    assertThat(session.lastError()).contains(ShellErrorKind.NOT_RUNNING);
  }

  @Test
  @DisplayName("Should stage text without a newline at the shell's input line")
  void sendInput_NoNewline_StaysPending() {
    session.start();

    assertThat(session.sendInput("Get-Chi", false)).isTrue();

    ScriptedShellProcess process = launched.get(0);
    assertThat(process.pendingInput()).isEqualTo("Get-Chi");
    assertThat(process.receivedLines()).isEmpty();
  }

  @Test
  @DisplayName("Should deliver command output in order through the drain queue")
  void executeCommand_OutputDrainedInOrder() {
    session.start();

    assertThat(session.executeCommand("echo one")).isTrue();
    assertThat(session.executeCommand("echo two")).isTrue();

    List<String> texts = drainTexts(2);
    assertThat(texts).containsExactly("one", "two");
  }

  @Test
  @DisplayName("Should scope a command to a directory in a single line")
  void executeCommand_WithWorkingDirectory_SingleLine() throws Exception {
    Path sub = Files.createDirectory(tempDir.resolve("repo"));
    session.start();

    assertThat(session.executeCommand("git status", sub.toString())).isTrue();

    assertThat(launched.get(0).receivedLines()).containsExactly("Set-Location \"" + sub + "\"; git status");
    assertThat(session.getKnownDirectory()).isEqualTo(tempDir.toString());
  }

  @Test
  @DisplayName("Should reject a directory change to a path that does not exist")
  void changeDirectory_MissingPath_Unchanged() {
    session.start();

    assertThat(session.changeDirectory(tempDir.resolve("nope").toString())).isFalse();

    assertThat(session.lastError()).contains(ShellErrorKind.PATH_INVALID);
    assertThat(launched.get(0).receivedLines()).isEmpty();
    assertThat(session.getKnownDirectory()).isEqualTo(tempDir.toString());
  }

  @Test
  @DisplayName("Should send Set-Location and remember the new directory")
  void changeDirectory_ExistingPath_Updated() throws Exception {
    Path sub = Files.createDirectory(tempDir.resolve("src"));
    session.start();

    assertThat(session.changeDirectory(sub.toString())).isTrue();

    assertThat(launched.get(0).receivedLines()).containsExactly("Set-Location \"" + sub + "\"");
    assertThat(session.getKnownDirectory()).isEqualTo(sub.toString());
  }

  @Test
  @DisplayName("Should read the directory the shell reports, ignoring prompt and table lines")
  void getCurrentDirectory_FollowsShellLocation() throws Exception {
    Path sub = Files.createDirectory(tempDir.resolve("project"));
    session.start();

    assertThat(session.getCurrentDirectory()).isEqualTo(tempDir.toString());

    // Moved behind the controller's back; only a query can notice.
    session.executeCommand("Set-Location \"" + sub + "\"");
    assertThat(session.getKnownDirectory()).isEqualTo(tempDir.toString());

    assertThat(session.getCurrentDirectory()).isEqualTo(sub.toString());
    assertThat(session.getKnownDirectory()).isEqualTo(sub.toString());
  }

  @Test
  @DisplayName("Should fall back to the known directory when the shell gives no answer")
  void getCurrentDirectory_NoAnswer_FallsBack() {
    ShellSession quiet = ShellSessionFactory.createSession(config(tempDir), launcherFor(ScriptedShellProcess::silent));
    try {
      quiet.start();

      assertThat(quiet.getCurrentDirectory(Duration.ofMillis(100))).isEqualTo(tempDir.toString());
      assertThat(quiet.lastError()).contains(ShellErrorKind.DIRECTORY_QUERY_INCONCLUSIVE);
    } finally {
      quiet.close();
    }
  }

  @Test
  @DisplayName("Should answer from memory when the shell is not running")
  void getCurrentDirectory_NotRunning_KnownDirectory() {
    assertThat(session.getCurrentDirectory()).isEqualTo(tempDir.toString());
  }

  @Test
  @DisplayName("Should keep notifying healthy listeners when another listener throws")
  void listener_Throwing_DoesNotStopOthers() throws Exception {
    CountDownLatch received = new CountDownLatch(1);
    List<String> seen = new CopyOnWriteArrayList<>();
    session.addOutputListener((stream, text) -> {
      throw new IllegalStateException("listener bug");
    });
    session.addOutputListener((stream, text) -> {
      seen.add(stream + ":" + text);
      received.countDown();
    });
    session.start();

    session.executeCommand("echo hello");

    assertThat(received.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(seen).containsExactly("STDOUT:hello");
  }

  @Test
  @DisplayName("Should stop notifying a removed listener")
  void removeOutputListener_NoLongerNotified() throws Exception {
    List<String> removed = new CopyOnWriteArrayList<>();
    OutputListener listener = (stream, text) -> removed.add(text);
    session.addOutputListener(listener);
    session.removeOutputListener(listener);
    session.start();

    session.executeCommand("echo hidden");

    assertThat(drainTexts(1)).containsExactly("hidden");
    assertThat(removed).isEmpty();
  }

  @Test
  @DisplayName("Should notice a shell that exited on its own")
  void isAlive_ShellExitedByItself_False() {
    session.start();

    launched.get(0).exit(0);

    assertThat(session.isAlive()).isFalse();
    assertThat(session.sendInput("dir", true)).isFalse();
    assertThat(session.lastError()).contains(ShellErrorKind.NOT_RUNNING);
  }

  @Test
  @DisplayName("Should relaunch after a shell exited on its own")
  void start_AfterSelfExit_Relaunches() {
    session.start();
    launched.get(0).exit(0);

    assertThat(session.start()).isTrue();

    assertThat(launched).hasSize(2);
    assertThat(session.isAlive()).isTrue();
  }

  @Test
  @DisplayName("Should stop through the exit directive and allow a restart")
  void stop_ThenStart_FreshShell() throws Exception {
    Path sub = Files.createDirectory(tempDir.resolve("other"));
    session.start();
    session.changeDirectory(sub.toString());

    assertThat(session.stop()).isTrue();

    ScriptedShellProcess first = launched.get(0);
    assertThat(first.receivedLines()).endsWith("exit");
    assertThat(first.terminateRequested()).isFalse();
    assertThat(session.isAlive()).isFalse();
    assertThat(session.runState()).isEqualTo(RunState.STOPPED);

    assertThat(session.start()).isTrue();
    assertThat(launched).hasSize(2);
    assertThat(session.getKnownDirectory()).isEqualTo(tempDir.toString());
  }

  @Test
  @DisplayName("Should escalate to kill when the shell ignores exit and terminate")
  void stop_StubbornShell_Killed() {
    ShellSession stubborn = ShellSessionFactory.createSession(
        config(tempDir), launcherFor(() -> new ScriptedShellProcess(line -> List.of(), true)));
    stubborn.start();

    assertThat(stubborn.stop()).isTrue();

    ScriptedShellProcess process = launched.get(0);
    assertThat(process.terminateRequested()).isTrue();
    assertThat(process.killRequested()).isTrue();
    assertThat(stubborn.isAlive()).isFalse();
  }

  @Test
  @DisplayName("Should stop promptly when a listener stops the session from a reader thread")
  void stop_FromListener_DoesNotWaitForOwnReader() throws Exception {
    ShellSession selfStopping = ShellSessionFactory.createSession(
        config(tempDir).toBuilder().readerJoinTimeout(Duration.ofSeconds(3)).build(),
        launcherFor(() -> new FakePowerShell().process()));
    CountDownLatch stopped = new CountDownLatch(1);
    List<Duration> stopTimes = new CopyOnWriteArrayList<>();
    selfStopping.addOutputListener((stream, text) -> {
      if ("bye".equals(text)) {
        long started = System.nanoTime();
        selfStopping.stop();
        stopTimes.add(Duration.ofNanos(System.nanoTime() - started));
        stopped.countDown();
      }
    });
    selfStopping.start();

    selfStopping.executeCommand("echo bye");

    assertThat(stopped.await(10, TimeUnit.SECONDS)).isTrue();
    assertThat(stopTimes.get(0)).isLessThan(Duration.ofSeconds(2));
    assertThat(selfStopping.isAlive()).isFalse();
  }

  @Test
  @DisplayName("Should treat repeated stops as no-ops")
  void stop_Twice_Idempotent() {
    session.start();

    assertThat(session.stop()).isTrue();
    assertThat(session.stop()).isTrue();

    assertThat(launched).hasSize(1);
    assertThat(session.runState()).isEqualTo(RunState.STOPPED);
  }

  private List<String> drainTexts(int expected) {
    List<String> texts = new ArrayList<>();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (texts.size() < expected && System.nanoTime() < deadline) {
      for (OutputLine line : session.drainOutput(Duration.ofMillis(200))) {
        texts.add(line.text());
      }
    }
    return texts;
  }

  private ShellProcessLauncher launcherFor(Supplier<ScriptedShellProcess> factory) {
    return processConfig -> {
      ScriptedShellProcess process = factory.get();
      launched.add(process);
      return process;
    };
  }

  private static ShellSessionConfig config(Path workingDirectory) {
    return ShellSessionConfig.builder()
        .workingDirectory(workingDirectory)
        .shellCommand(List.of("scripted-shell"))
        .querySettleDelay(Duration.ofMillis(10))
        .queryTimeout(Duration.ofSeconds(2))
        .exitGracePeriod(Duration.ofMillis(200))
        .terminateGracePeriod(Duration.ofMillis(50))
        .killGracePeriod(Duration.ofMillis(200))
        .readerJoinTimeout(Duration.ofMillis(500))
        .build();
  }

  /**
   * Understands just enough PowerShell to track its location: {@code Set-Location}, the location query and
   * {@code echo}. The location query answers with the table and prompt lines a real shell prints.
   */
  private final class FakePowerShell {

    private volatile String location = tempDir.toString();

    ScriptedShellProcess process() {
      return new ScriptedShellProcess(this::respond);
    }

    private List<String> respond(String line) {
      List<String> out = new ArrayList<>();
      for (String part : line.split("; ")) {
        out.addAll(run(part.trim()));
      }
      return out;
    }

    private List<String> run(String command) {
      if (command.startsWith("Set-Location \"") && command.endsWith("\"")) {
        location = command.substring("Set-Location \"".length(), command.length() - 1);
        return List.of();
      }
      if (command.equals("(Get-Location).Path")) {
        return List.of("PS " + location + "> (Get-Location).Path", "", "Path", "----", location, "",
            "PS " + location + "> ");
      }
      if (command.startsWith("echo ")) {
        return List.of(command.substring("echo ".length()));
      }
      return List.of();
    }
  }
}
