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

import fr.aneo.histotiler.domain.ExtractionException;
import fr.aneo.histotiler.domain.TileConfig;
import fr.aneo.histotiler.domain.TilingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * {@link TilingEngine} running PyHIST as a subprocess.
 * <p>
 * The {@link TileConfig} is translated into PyHIST command-line flags. PyHIST writes its outputs
 * below {@code --output}, in a folder named after the slide, with tiles in a
 * {@code <slide>_tiles} subfolder; resolving that folder is left to the caller.
 * </p>
 * <p>
 * A non-zero exit status, including one propagated from the native segmentation binary PyHIST
 * spawns for the graph method, raises an {@link ExtractionException}.
 * </p>
 */
public final class PyHistEngine implements TilingEngine {
  private static final Logger logger = LoggerFactory.getLogger(PyHistEngine.class);

  private final List<String> engineCommand;
  private final CommandRunner commandRunner;

  public PyHistEngine(List<String> engineCommand) {
    this(engineCommand, new CommandRunner());
  }

  PyHistEngine(List<String> engineCommand, CommandRunner commandRunner) {
    this.engineCommand = List.copyOf(requireNonNull(engineCommand, "engineCommand cannot be null"));
    this.commandRunner = requireNonNull(commandRunner, "commandRunner cannot be null");
  }

  @Override
  public void execute(TileConfig config) {
    var command = commandLine(config);
    logger.info("Running PyHIST on {} (method={}, patch size={})", config.slidePath(), config.method().engineName(), config.patchSize());

    try {
      var result = commandRunner.run(command);
      if (!result.succeeded()) {
        throw new ExtractionException("Tile extraction subprocess failed with exit code " + result.exitCode() + ": " + result.diagnostic());
      }
    } catch (IOException e) {
      throw new ExtractionException("Unable to run tiling engine '" + engineCommand.get(0) + "'", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException("Interrupted while tiling " + config.slidePath(), e);
    }
  }

  List<String> commandLine(TileConfig config) {
    var command = new ArrayList<>(engineCommand);
    option(command, "--patch-size", config.patchSize());
    option(command, "--method", config.method().engineName());
    option(command, "--content-threshold", config.contentThreshold());
    option(command, "--output-downsample", config.outputDownsample());
    option(command, "--mask-downsample", config.maskDownsample());
    option(command, "--borders", config.borders());
    option(command, "--corners", config.corners());
    option(command, "--pct-bc", config.borderCornerPercentage());
    option(command, "--k-const", config.segmentationConstant());
    option(command, "--minimum_segmentsize", config.minimumSegmentSize());
    flag(command, "--save-patches", config.savePatches());
    flag(command, "--save-blank", config.saveBlank());
    flag(command, "--save-nonsquare", config.saveNonSquare());
    flag(command, "--save-tilecrossed-image", config.saveTileCrossedImage());
    flag(command, "--save-mask", config.saveMask());
    flag(command, "--save-edges", config.saveEdges());
    option(command, "--info", config.verbosity().engineName());
    option(command, "--output", config.outputRoot());
    option(command, "--format", config.format().extension());
    command.add(config.slidePath().toString());
    return command;
  }

  private static void option(List<String> command, String name, Object value) {
    command.add(name);
    command.add(String.valueOf(value));
  }

  private static void flag(List<String> command, String name, boolean enabled) {
    if (enabled) command.add(name);
  }
}
