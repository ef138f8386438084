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

import fr.aneo.histotiler.domain.InvalidImageException;
import fr.aneo.histotiler.domain.SlideValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * {@link SlideValidator} backed by the OpenSlide command-line tools.
 * <p>
 * The probe command (by default {@code openslide-show-properties}) opens the slide read-only,
 * prints its properties and exits. An exit status of 0 means OpenSlide recognised the container;
 * anything else is reported as an {@link InvalidImageException} carrying the probe's output.
 * The probe process always terminates before this validator returns, so no handle on the slide
 * outlives the call.
 * </p>
 */
public final class OpenSlideValidator implements SlideValidator {
  private static final Logger logger = LoggerFactory.getLogger(OpenSlideValidator.class);

  private final List<String> probeCommand;
  private final CommandRunner commandRunner;

  public OpenSlideValidator(List<String> probeCommand) {
    this(probeCommand, new CommandRunner());
  }

  OpenSlideValidator(List<String> probeCommand, CommandRunner commandRunner) {
    this.probeCommand = List.copyOf(requireNonNull(probeCommand, "probeCommand cannot be null"));
    this.commandRunner = requireNonNull(commandRunner, "commandRunner cannot be null");
  }

  @Override
  public void validate(Path slide) {
    var command = new ArrayList<>(probeCommand);
    command.add(slide.toString());

    try {
      var result = commandRunner.run(command);
      if (!result.succeeded()) {
        throw new InvalidImageException("Invalid input file " + slide + ": " + result.diagnostic());
      }
      logger.info("Input file validated with OpenSlide: {}", slide);

    } catch (IOException e) {
      throw new InvalidImageException("Unable to run slide probe '" + probeCommand.get(0) + "' on " + slide, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InvalidImageException("Interrupted while validating " + slide, e);
    }
  }
}
