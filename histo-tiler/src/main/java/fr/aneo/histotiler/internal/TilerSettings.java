/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.histotiler.internal;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Runtime settings of the tiling batch, read from environment variables.
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@value #ENV_WORKERS}: size of the worker pool. Defaults to 1; tasks are memory- and
 *       disk-heavy, so the batch is serialized unless explicitly told otherwise</li>
 *   <li>{@value #ENV_ENGINE_COMMAND}: command launching the tiling engine, default {@code pyhist}</li>
 *   <li>{@value #ENV_SEGMENT_BINARY}: path probed for the native graph segmentation binary</li>
 *   <li>{@value #ENV_VALIDATOR_COMMAND}: slide probe command, default {@code openslide-show-properties}</li>
 * </ul>
 * <p>
 * Invalid or blank values are logged and replaced by their default.
 * </p>
 *
 * @param workers            number of tasks processed concurrently; strictly positive
 * @param engineCommand      tiling engine command and leading arguments
 * @param segmentationBinary path of the optional native segmentation binary
 * @param validatorCommand   slide probe command and leading arguments
 */
public record TilerSettings(
  int workers,
  List<String> engineCommand,
  Path segmentationBinary,
  List<String> validatorCommand
) {
  private static final Logger logger = LoggerFactory.getLogger(TilerSettings.class);

  public static final String ENV_WORKERS = "HISTO_TILER_WORKERS";
  public static final String ENV_ENGINE_COMMAND = "HISTO_TILER_ENGINE_COMMAND";
  public static final String ENV_SEGMENT_BINARY = "HISTO_TILER_SEGMENT_BINARY";
  public static final String ENV_VALIDATOR_COMMAND = "HISTO_TILER_VALIDATOR_COMMAND";

  static final int DEFAULT_WORKERS = 1;
  static final String DEFAULT_ENGINE_COMMAND = "pyhist";
  static final Path DEFAULT_SEGMENT_BINARY = Path.of("/pyhist/src/graph_segmentation/segment");
  static final String DEFAULT_VALIDATOR_COMMAND = "openslide-show-properties";

  private static final Splitter COMMAND_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

  public TilerSettings {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be strictly positive, got: " + workers);
    }
    engineCommand = List.copyOf(requireNonNull(engineCommand, "engineCommand cannot be null"));
    requireNonNull(segmentationBinary, "segmentationBinary cannot be null");
    validatorCommand = List.copyOf(requireNonNull(validatorCommand, "validatorCommand cannot be null"));
    if (engineCommand.isEmpty() || validatorCommand.isEmpty()) {
      throw new IllegalArgumentException("engine and validator commands cannot be empty");
    }
  }

  public static TilerSettings defaults() {
    return new TilerSettings(
      DEFAULT_WORKERS,
      splitCommand(DEFAULT_ENGINE_COMMAND),
      DEFAULT_SEGMENT_BINARY,
      splitCommand(DEFAULT_VALIDATOR_COMMAND));
  }

  /**
   * Loads the settings from the process environment.
   *
   * @return settings with every unset or invalid variable replaced by its default
   */
  public static TilerSettings fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static TilerSettings fromEnvironment(UnaryOperator<String> environment) {
    var workers = loadWorkers(environment.apply(ENV_WORKERS));
    var engineCommand = loadString(environment.apply(ENV_ENGINE_COMMAND), ENV_ENGINE_COMMAND, DEFAULT_ENGINE_COMMAND);
    var segmentBinary = loadString(environment.apply(ENV_SEGMENT_BINARY), ENV_SEGMENT_BINARY, DEFAULT_SEGMENT_BINARY.toString());
    var validatorCommand = loadString(environment.apply(ENV_VALIDATOR_COMMAND), ENV_VALIDATOR_COMMAND, DEFAULT_VALIDATOR_COMMAND);

    return new TilerSettings(workers, splitCommand(engineCommand), Path.of(segmentBinary), splitCommand(validatorCommand));
  }

  /**
   * Returns a copy of these settings with another worker count.
   *
   * @param workers the new pool size; strictly positive
   * @return new settings
   */
  public TilerSettings withWorkers(int workers) {
    return new TilerSettings(workers, engineCommand, segmentationBinary, validatorCommand);
  }

  static List<String> splitCommand(String command) {
    return COMMAND_SPLITTER.splitToList(command);
  }

  private static int loadWorkers(String envValue) {
    if (envValue == null || envValue.trim().isEmpty()) {
      logger.debug("Using default worker count: {}", DEFAULT_WORKERS);
      return DEFAULT_WORKERS;
    }
    try {
      int workers = Integer.parseInt(envValue.trim());
      if (workers <= 0) {
        logger.warn("Invalid worker count in {}: {} (must be positive). Using default: {}", ENV_WORKERS, envValue, DEFAULT_WORKERS);
        return DEFAULT_WORKERS;
      }
      logger.info("Using configured worker count: {}", workers);
      return workers;
    } catch (NumberFormatException e) {
      logger.warn("Invalid number format for {}: {}. Using default: {}", ENV_WORKERS, envValue, DEFAULT_WORKERS);
      return DEFAULT_WORKERS;
    }
  }

  private static String loadString(String envValue, String name, String defaultValue) {
    if (envValue == null || envValue.trim().isEmpty()) {
      logger.debug("{} not set. Using default: {}", name, defaultValue);
      return defaultValue;
    }
    logger.info("Using configured {}: {}", name, envValue.trim());
    return envValue.trim();
  }
}
