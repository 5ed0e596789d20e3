package com.consullo.shell.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable shell session configuration.
 *
 * <p>
 * The values are consumed read-only by the lifecycle manager and the command
 * protocol. Existence of the working directory is not checked here; it is
 * checked at launch time so a directory created after configuration still
 * works.
 * </p>
 */
public final class ShellSessionConfig {

  public static final Duration DEFAULT_EXIT_GRACE = Duration.ofSeconds(2);
  public static final Duration DEFAULT_TERMINATE_GRACE = Duration.ofSeconds(1);
  public static final Duration DEFAULT_KILL_GRACE = Duration.ofSeconds(1);
  public static final Duration DEFAULT_READER_JOIN = Duration.ofMillis(500);
  public static final Duration DEFAULT_QUERY_SETTLE = Duration.ofMillis(300);
  public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofMillis(1500);
  public static final int DEFAULT_QUEUE_CAPACITY = 10_000;

  private final Path workingDirectory;
  private final Path shellExecutable;
  private final List<String> shellCommand;
  private final Map<String, String> environment;
  private final Charset charset;
  private final Duration exitGracePeriod;
  private final Duration terminateGracePeriod;
  private final Duration killGracePeriod;
  private final Duration readerJoinTimeout;
  private final Duration querySettleDelay;
  private final Duration queryTimeout;
  private final int queueCapacity;

  private ShellSessionConfig(Builder b) {
    this.workingDirectory = b.workingDirectory;
    this.shellExecutable = b.shellExecutable;
    this.shellCommand = b.shellCommand;
    this.environment = b.environment;
    this.charset = b.charset;
    this.exitGracePeriod = b.exitGracePeriod;
    this.terminateGracePeriod = b.terminateGracePeriod;
    this.killGracePeriod = b.killGracePeriod;
    this.readerJoinTimeout = b.readerJoinTimeout;
    this.querySettleDelay = b.querySettleDelay;
    this.queryTimeout = b.queryTimeout;
    this.queueCapacity = b.queueCapacity;
  }

  /**
   * Returns the defaults for a session rooted at the given directory.
   *
   * @param workingDirectory initial working directory (null means the JVM's current directory)
   * @return config
   */
  public static ShellSessionConfig defaults(Path workingDirectory) {
    return builder().workingDirectory(workingDirectory).build();
  }

  public Path getWorkingDirectory() {
    return workingDirectory;
  }

  /**
   * Returns the configured shell executable override, or null to auto-detect PowerShell.
   */
  public Path getShellExecutable() {
    return shellExecutable;
  }

  /**
   * Returns the explicit shell command, or an empty list when the command is derived from the executable.
   */
  public List<String> getShellCommand() {
    return shellCommand;
  }

  public Map<String, String> getEnvironment() {
    return environment;
  }

  public Charset getCharset() {
    return charset;
  }

  public Duration getExitGracePeriod() {
    return exitGracePeriod;
  }

  public Duration getTerminateGracePeriod() {
    return terminateGracePeriod;
  }

  public Duration getKillGracePeriod() {
    return killGracePeriod;
  }

  public Duration getReaderJoinTimeout() {
    return readerJoinTimeout;
  }

  public Duration getQuerySettleDelay() {
    return querySettleDelay;
  }

  public Duration getQueryTimeout() {
    return queryTimeout;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public Builder toBuilder() {
    return builder()
            .workingDirectory(workingDirectory)
            .shellExecutable(shellExecutable)
            .shellCommand(shellCommand)
            .environment(environment)
            .charset(charset)
            .exitGracePeriod(exitGracePeriod)
            .terminateGracePeriod(terminateGracePeriod)
            .killGracePeriod(killGracePeriod)
            .readerJoinTimeout(readerJoinTimeout)
            .querySettleDelay(querySettleDelay)
            .queryTimeout(queryTimeout)
            .queueCapacity(queueCapacity);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private Path workingDirectory;
    private Path shellExecutable;
    private List<String> shellCommand = List.of();
    private Map<String, String> environment = Map.of();
    private Charset charset = StandardCharsets.UTF_8;
    private Duration exitGracePeriod = DEFAULT_EXIT_GRACE;
    private Duration terminateGracePeriod = DEFAULT_TERMINATE_GRACE;
    private Duration killGracePeriod = DEFAULT_KILL_GRACE;
    private Duration readerJoinTimeout = DEFAULT_READER_JOIN;
    private Duration querySettleDelay = DEFAULT_QUERY_SETTLE;
    private Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;
    private int queueCapacity = DEFAULT_QUEUE_CAPACITY;

    private Builder() {
    }

    public Builder workingDirectory(Path workingDirectory) {
      this.workingDirectory = workingDirectory;
      return this;
    }

    public Builder shellExecutable(Path shellExecutable) {
      this.shellExecutable = shellExecutable;
      return this;
    }

    public Builder shellCommand(List<String> shellCommand) {
      this.shellCommand = shellCommand != null ? List.copyOf(shellCommand) : List.of();
      return this;
    }

    public Builder environment(Map<String, String> environment) {
      this.environment = environment != null
              ? Collections.unmodifiableMap(new LinkedHashMap<>(environment))
              : Map.of();
      return this;
    }

    public Builder charset(Charset charset) {
      this.charset = charset;
      return this;
    }

    public Builder exitGracePeriod(Duration d) {
      this.exitGracePeriod = d;
      return this;
    }

    public Builder terminateGracePeriod(Duration d) {
      this.terminateGracePeriod = d;
      return this;
    }

    public Builder killGracePeriod(Duration d) {
      this.killGracePeriod = d;
      return this;
    }

    public Builder readerJoinTimeout(Duration d) {
      this.readerJoinTimeout = d;
      return this;
    }

    public Builder querySettleDelay(Duration d) {
      this.querySettleDelay = d;
      return this;
    }

    public Builder queryTimeout(Duration d) {
      this.queryTimeout = d;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public ShellSessionConfig build() {
      if (workingDirectory == null) {
        workingDirectory = Path.of("").toAbsolutePath();
      }
      if (charset == null) {
        throw new IllegalArgumentException("charset must not be null.");
      }
      requirePositive(exitGracePeriod, "exitGracePeriod");
      requirePositive(terminateGracePeriod, "terminateGracePeriod");
      requirePositive(killGracePeriod, "killGracePeriod");
      requirePositive(readerJoinTimeout, "readerJoinTimeout");
      requireNonNegative(querySettleDelay, "querySettleDelay");
      requirePositive(queryTimeout, "queryTimeout");
      if (queueCapacity <= 0) {
        throw new IllegalArgumentException("queueCapacity must be positive.");
      }
      return new ShellSessionConfig(this);
    }

    private static void requirePositive(Duration d, String name) {
      if (d == null || d.isZero() || d.isNegative()) {
        throw new IllegalArgumentException(name + " must be positive.");
      }
    }

    private static void requireNonNegative(Duration d, String name) {
      if (d == null || d.isNegative()) {
        throw new IllegalArgumentException(name + " must not be negative.");
      }
    }
  }
}
