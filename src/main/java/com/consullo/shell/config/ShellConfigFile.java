package com.consullo.shell.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of the terminal section in a configuration file. Absent keys stay null and keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class ShellConfigFile {

  @JsonProperty("working_directory")
  String workingDirectory;

  @JsonProperty("shell_path")
  String shellPath;

  @JsonProperty("shell_command")
  List<String> shellCommand;

  @JsonProperty("environment")
  Map<String, String> environment;

  @JsonProperty("charset")
  String charset;

  @JsonProperty("exit_grace_millis")
  Long exitGraceMillis;

  @JsonProperty("terminate_grace_millis")
  Long terminateGraceMillis;

  @JsonProperty("kill_grace_millis")
  Long killGraceMillis;

  @JsonProperty("reader_join_millis")
  Long readerJoinMillis;

  @JsonProperty("query_settle_millis")
  Long querySettleMillis;

  @JsonProperty("query_timeout_millis")
  Long queryTimeoutMillis;

  @JsonProperty("queue_capacity")
  Integer queueCapacity;
}
