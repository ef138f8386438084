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
package fr.aneo.histotiler;

import fr.aneo.histotiler.domain.BatchJob;
import fr.aneo.histotiler.domain.BatchReport;
import fr.aneo.histotiler.domain.SlideValidator;
import fr.aneo.histotiler.domain.TilingEngine;
import fr.aneo.histotiler.internal.BatchOrchestrator;
import fr.aneo.histotiler.internal.OpenSlideValidator;
import fr.aneo.histotiler.internal.PyHistEngine;
import fr.aneo.histotiler.internal.TilerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Entry point of the tiling batch: validates, tiles and archives a list of whole-slide images.
 * <p>
 * A {@code HistoTiler} is bound to a {@link SlideValidator}, a {@link TilingEngine} and
 * {@link TilerSettings}. Use {@link #withDefaults()} for the production collaborators (OpenSlide
 * probe and PyHIST, configured from the environment), or
 * {@link #withCollaborators(SlideValidator, TilingEngine, TilerSettings)} to plug in others.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * var job = BatchJob.of(List.of(Path.of("a.svs")), List.of("slideA"), Path.of("tiles.zip"));
 * BatchReport report = HistoTiler.withDefaults().run(job);
 * }</pre>
 *
 * @see BatchJob
 * @see BatchReport
 */
public final class HistoTiler {
  private static final Logger logger = LoggerFactory.getLogger(HistoTiler.class);

  private final BatchOrchestrator orchestrator;

  private HistoTiler(BatchOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  /**
   * Processes every image of {@code job} into its output archive.
   * <p>
   * Per-image failures are reported in the returned {@link BatchReport}, never thrown.
   * </p>
   *
   * @param job the batch to run; must not be {@code null}
   * @return the batch report
   * @throws fr.aneo.histotiler.domain.ArchiveException if the archive cannot be created or finalized
   */
  public BatchReport run(BatchJob job) {
    return orchestrator.run(job);
  }

  /**
   * Creates a tiler using OpenSlide for validation and PyHIST for tiling, with settings read from
   * the environment.
   *
   * @return a new {@link HistoTiler}
   * @see TilerSettings#fromEnvironment()
   */
  public static HistoTiler withDefaults() {
    var settings = TilerSettings.fromEnvironment();
    logger.info("Using PyHIST engine '{}' and slide probe '{}'", String.join(" ", settings.engineCommand()), String.join(" ", settings.validatorCommand()));
    return withCollaborators(
      new OpenSlideValidator(settings.validatorCommand()),
      new PyHistEngine(settings.engineCommand()),
      settings);
  }

  /**
   * Creates a tiler with the given collaborators.
   *
   * @param validator the slide validator; must not be {@code null}
   * @param engine    the tiling engine; must not be {@code null}
   * @param settings  the runtime settings; must not be {@code null}
   * @return a new {@link HistoTiler}
   * @throws NullPointerException if an argument is {@code null}
   */
  public static HistoTiler withCollaborators(SlideValidator validator, TilingEngine engine, TilerSettings settings) {
    requireNonNull(validator, "validator cannot be null");
    requireNonNull(engine, "engine cannot be null");
    requireNonNull(settings, "settings cannot be null");
    return new HistoTiler(new BatchOrchestrator(validator, engine, settings));
  }
}
