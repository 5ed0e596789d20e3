package com.consullo.shell.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link ShellSessionConfig} from a JSON file.
 *
 * <p>
 * The settings may sit at the top level or inside a {@code "terminal"} object,
 * so the same file can carry other application settings next to the shell
 * section. A missing or unreadable file yields the defaults; the failure is
 * logged, never thrown.
 * </p>
 *
 * @since 1.0
 */
public final class ShellConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShellConfigLoader.class);

  static final String TERMINAL_SECTION = "terminal";

  private final ObjectMapper objectMapper;

  public ShellConfigLoader() {
    this(new ObjectMapper());
  }

  public ShellConfigLoader(ObjectMapper objectMapper) {
    Validate.notNull(objectMapper, "objectMapper must not be null");
    this.objectMapper = objectMapper;
  }

  /**
   * Reads the configuration file.
   *
   * @param file JSON file
   * @return configuration; defaults if the file is missing or malformed
   */
  public ShellSessionConfig load(Path file) {
    Validate.notNull(file, "file must not be null");
    if (!Files.isRegularFile(file)) {
      LOGGER.warn("Shell config file not found: {}. Using defaults.", file);
      return ShellSessionConfig.builder().build();
    }
    try {
      JsonNode root = objectMapper.readTree(file.toFile());
      JsonNode section = root != null && root.has(TERMINAL_SECTION) ? root.get(TERMINAL_SECTION) : root;
      if (section == null || !section.isObject()) {
        LOGGER.warn("Shell config file {} has no settings object. Using defaults.", file);
        return ShellSessionConfig.builder().build();
      }
      ShellConfigFile raw = objectMapper.treeToValue(section, ShellConfigFile.class);
      ShellSessionConfig config = toConfig(raw);
      LOGGER.info("Loaded shell config from {}", file);
      return config;
    } catch (IOException | IllegalArgumentException e) {
      LOGGER.warn("Failed to read shell config {}: {}. Using defaults.", file, e.getMessage());
      return ShellSessionConfig.builder().build();
    }
  }

  private static ShellSessionConfig toConfig(ShellConfigFile raw) {
    ShellSessionConfig.Builder b = ShellSessionConfig.builder();
    if (StringUtils.isNotBlank(raw.workingDirectory)) {
      b.workingDirectory(Path.of(raw.workingDirectory));
    }
    if (StringUtils.isNotBlank(raw.shellPath)) {
      b.shellExecutable(Path.of(raw.shellPath));
    }
    if (raw.shellCommand != null) {
      b.shellCommand(raw.shellCommand);
    }
    if (raw.environment != null) {
      b.environment(raw.environment);
    }
    if (StringUtils.isNotBlank(raw.charset)) {
      try {
        b.charset(Charset.forName(raw.charset));
      } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
        LOGGER.warn("Unknown charset '{}' in shell config, keeping default", raw.charset);
      }
    }
    if (raw.exitGraceMillis != null) {
      b.exitGracePeriod(Duration.ofMillis(raw.exitGraceMillis));
    }
    if (raw.terminateGraceMillis != null) {
      b.terminateGracePeriod(Duration.ofMillis(raw.terminateGraceMillis));
    }
    if (raw.killGraceMillis != null) {
      b.killGracePeriod(Duration.ofMillis(raw.killGraceMillis));
    }
    if (raw.readerJoinMillis != null) {
      b.readerJoinTimeout(Duration.ofMillis(raw.readerJoinMillis));
    }
    if (raw.querySettleMillis != null) {
      b.querySettleDelay(Duration.ofMillis(raw.querySettleMillis));
    }
    if (raw.queryTimeoutMillis != null) {
      b.queryTimeout(Duration.ofMillis(raw.queryTimeoutMillis));
    }
    if (raw.queueCapacity != null) {
      b.queueCapacity(raw.queueCapacity);
    }
    return b.build();
  }
}
