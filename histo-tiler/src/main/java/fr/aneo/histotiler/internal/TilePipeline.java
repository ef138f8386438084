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

import fr.aneo.histotiler.domain.ImageTask;
import fr.aneo.histotiler.domain.MissingSourceException;
import fr.aneo.histotiler.domain.NoTilesProducedException;
import fr.aneo.histotiler.domain.SlideValidator;
import fr.aneo.histotiler.domain.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

import static fr.aneo.histotiler.domain.TaskStatus.*;
import static java.util.Objects.requireNonNull;

/**
 * Runs the validate &rarr; configure &rarr; extract &rarr; package sequence for one task.
 * <p>
 * The pipeline advances the task through its non-terminal states and returns a
 * {@link TaskOutcome.Done} on success. Every other ending is signalled by an exception, left to the
 * caller to convert into a terminal outcome:
 * </p>
 * <ul>
 *   <li>{@link MissingSourceException}: the slide is absent when the task starts</li>
 *   <li>{@link fr.aneo.histotiler.domain.InvalidImageException}: the decoder rejects the slide</li>
 *   <li>{@link fr.aneo.histotiler.domain.ExtractionException}: the engine fails</li>
 *   <li>{@link NoTilesProducedException}: extraction succeeded without tiles</li>
 *   <li>{@link fr.aneo.histotiler.domain.PackagingException}: the tiles cannot be archived</li>
 * </ul>
 * <p>
 * Nothing is deleted here: the task's engine output stays in the scratch space until the batch
 * ends.
 * </p>
 */
final class TilePipeline {
  private static final Logger logger = LoggerFactory.getLogger(TilePipeline.class);

  private final SlideValidator validator;
  private final TileJobConfigurator configurator;
  private final TileExtractionAdapter extractionAdapter;
  private final ArchivePackager packager;
  private final TileArchive archive;
  private final ScratchSpace scratchSpace;

  TilePipeline(SlideValidator validator,
               TileJobConfigurator configurator,
               TileExtractionAdapter extractionAdapter,
               ArchivePackager packager,
               TileArchive archive,
               ScratchSpace scratchSpace) {
    this.validator = requireNonNull(validator, "validator cannot be null");
    this.configurator = requireNonNull(configurator, "configurator cannot be null");
    this.extractionAdapter = requireNonNull(extractionAdapter, "extractionAdapter cannot be null");
    this.packager = requireNonNull(packager, "packager cannot be null");
    this.archive = requireNonNull(archive, "archive cannot be null");
    this.scratchSpace = requireNonNull(scratchSpace, "scratchSpace cannot be null");
  }

  TaskOutcome run(ImageTask task) {
    var source = task.sourcePath();
    if (!Files.exists(source)) {
      throw new MissingSourceException(source);
    }

    logger.info("Processing image: {}", source);
    logMemoryUsage();

    task.advanceTo(VALIDATING);
    validator.validate(source);

    var config = configurator.configure(source, scratchSpace.outputRootFor(task));

    task.advanceTo(EXTRACTING);
    var tileDirectory = extractionAdapter.extract(config);

    task.advanceTo(PACKAGING);
    int appended = packager.append(archive, task.archiveName(), tileDirectory, config.format());
    if (appended == 0) {
      throw new NoTilesProducedException(tileDirectory.path());
    }
    return TaskOutcome.done(appended);
  }

  private static void logMemoryUsage() {
    var runtime = Runtime.getRuntime();
    long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / 1024 / 1024;
    logger.info("Memory usage: used={} MB, committed={} MB, max={} MB", usedMb, runtime.totalMemory() / 1024 / 1024, runtime.maxMemory() / 1024 / 1024);
  }
}
