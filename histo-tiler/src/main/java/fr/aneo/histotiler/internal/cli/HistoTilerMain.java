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
package fr.aneo.histotiler.internal.cli;

import fr.aneo.histotiler.HistoTiler;
import fr.aneo.histotiler.domain.BatchJob;
import fr.aneo.histotiler.domain.BatchReport;
import fr.aneo.histotiler.domain.ConfigurationException;
import fr.aneo.histotiler.domain.TilerException;
import fr.aneo.histotiler.internal.GsonBatchReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Command-line entry point of the tiling batch.
 * <p>
 * Exit status is 0 once the batch has run, whatever the per-image outcomes, and 1 when the
 * arguments are invalid or the output archive cannot be produced.
 * </p>
 */
public final class HistoTilerMain {
  private static final Logger logger = LoggerFactory.getLogger(HistoTilerMain.class);

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_FAILURE = 1;

  private HistoTilerMain() {
  }

  public static void main(String[] args) {
    System.exit(run(args, HistoTiler::withDefaults));
  }

  static int run(String[] args, Supplier<HistoTiler> tilerFactory) {
    try {
      var arguments = BatchArguments.parse(args);
      var job = BatchJob.of(arguments.inputs(), arguments.originalNames(), arguments.outputZip());

      var report = tilerFactory.get().run(job);
      arguments.summaryJson().ifPresent(target -> writeSummary(report, target));

      logger.info("Done. {} of {} images archived", report.tasks().stream().filter(task -> task.tilesArchived() > 0).count(), job.size());
      return EXIT_SUCCESS;

    } catch (ConfigurationException e) {
      logger.error("Invalid batch configuration: {}", e.getMessage());
      return EXIT_FAILURE;
    } catch (TilerException e) {
      logger.error("Batch aborted: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  private static void writeSummary(BatchReport report, Path target) {
    try {
      new GsonBatchReportWriter().write(report, target);
    } catch (TilerException e) {
      logger.error("Batch completed but its summary could not be written: {}", e.getMessage(), e);
    }
  }
}
