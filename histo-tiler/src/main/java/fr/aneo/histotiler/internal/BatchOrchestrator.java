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

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.histotiler.domain.*;
import fr.aneo.histotiler.domain.BatchReport.TaskReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Drives a {@link BatchJob} through the tiling pipeline, one {@link ImageTask} at a time by default.
 * <p>
 * For a batch, the orchestrator:
 * </p>
 * <ol>
 *   <li>Creates the shared output archive, empty</li>
 *   <li>Submits every task to a fixed-size worker pool ({@link TilerSettings#workers()}, default 1)</li>
 *   <li>Runs each task through a {@link TilePipeline} and converts its ending into a terminal
 *       {@link TaskOutcome}</li>
 *   <li>Waits until every task is terminal, then deletes the scratch space, exactly once, whatever
 *       the outcomes</li>
 *   <li>Finalizes the archive and reports its size with the per-task outcomes</li>
 * </ol>
 *
 * <h2>Fault Isolation</h2>
 * <p>
 * Per-task exceptions never reach the batch driver. They are caught at the task boundary, logged
 * with the task's source path and logical name, and recorded as the task's status:
 * </p>
 * <ul>
 *   <li>{@link TaskSkippedException} &rarr; {@link TaskOutcome.Skipped}, logged as a warning</li>
 *   <li>any other exception &rarr; {@link TaskOutcome.Failed}, logged as an error</li>
 * </ul>
 * <p>
 * Only a failure to create or finalize the archive ({@link ArchiveException}) aborts the run.
 * </p>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Tasks are independent and never retried. With more than one worker, the archive's own lock keeps
 * a single writer at a time and keeps each task's entries contiguous.
 * </p>
 */
public final class BatchOrchestrator {
  private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

  private final SlideValidator validator;
  private final TilingEngine engine;
  private final TilerSettings settings;
  private final TileJobConfigurator configurator;
  private final ArchivePackager packager;

  public BatchOrchestrator(SlideValidator validator, TilingEngine engine, TilerSettings settings) {
    this.validator = requireNonNull(validator, "validator cannot be null");
    this.engine = requireNonNull(engine, "engine cannot be null");
    this.settings = requireNonNull(settings, "settings cannot be null");
    this.configurator = new TileJobConfigurator();
    this.packager = new ArchivePackager();
  }

  /**
   * Processes every task of {@code job} and produces the output archive.
   *
   * @param job the batch; its tasks must all be pending
   * @return the batch report
   * @throws IllegalArgumentException if a task of the job has already been processed
   * @throws ArchiveException         if the archive cannot be created or finalized
   */
  public BatchReport run(BatchJob job) {
    requireNonNull(job, "job cannot be null");
    job.tasks().stream()
       .filter(task -> task.status() != TaskStatus.PENDING)
       .findFirst()
       .ifPresent(task -> {
         throw new IllegalArgumentException("Task " + task.logicalName() + " was already processed (" + task.status() + ")");
       });
    logger.info("Starting batch of {} images into {} ({} worker(s))", job.size(), job.archivePath(), settings.workers());
    long startTime = System.nanoTime();

    var scratchSpace = ScratchSpace.forArchive(job.archivePath());
    var extractionAdapter = new TileExtractionAdapter(engine, settings.segmentationBinary());
    List<TaskOutcome> outcomes;

    try (var archive = TileArchive.create(job.archivePath())) {
      var pipeline = new TilePipeline(validator, configurator, extractionAdapter, packager, archive, scratchSpace);
      try {
        outcomes = processAll(job.tasks(), pipeline);
      } finally {
        scratchSpace.deleteAll();
      }
    }

    var report = new BatchReport(job.archivePath(), archiveSize(job), reports(job.tasks(), outcomes));
    long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
    logSummary(report, duration);
    return report;
  }

  private List<TaskOutcome> processAll(List<ImageTask> tasks, TilePipeline pipeline) {
    var executor = newWorkerPool();
    try {
      var futures = new ArrayList<Future<TaskOutcome>>(tasks.size());
      for (var task : tasks) {
        futures.add(executor.submit(() -> process(task, pipeline)));
      }

      var outcomes = new ArrayList<TaskOutcome>(tasks.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(awaitOutcome(tasks.get(i), futures.get(i)));
      }
      return outcomes;

    } finally {
      MoreExecutors.shutdownAndAwaitTermination(executor, Duration.ofSeconds(30));
    }
  }

  /**
   * Runs one task and converts its ending into a terminal outcome. Never throws.
   */
  TaskOutcome process(ImageTask task, TilePipeline pipeline) {
    MDC.put("logicalName", task.logicalName());
    MDC.put("sourcePath", task.sourcePath().toString());
    long startTime = System.nanoTime();

    TaskOutcome outcome;
    try {
      outcome = pipeline.run(task);
      logger.info("Image {} done: {} tiles archived in {}ms", task.logicalName(), outcome.tilesArchived(), elapsedMillis(startTime));

    } catch (TaskSkippedException skipped) {
      logger.warn("Image {} ({}) skipped: {}", task.logicalName(), task.sourcePath(), skipped.getMessage());
      outcome = TaskOutcome.skipped(skipped.getMessage());

    } catch (Exception exception) {
      outcome = TaskOutcome.failed(exception);
      logger.error("Error processing {} ({}) after {}ms: {}", task.sourcePath(), task.logicalName(), elapsedMillis(startTime), ((TaskOutcome.Failed) outcome).message(), exception);

    } finally {
      MDC.clear();
    }

    complete(task, outcome);
    return outcome;
  }

  private TaskOutcome awaitOutcome(ImageTask task, Future<TaskOutcome> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.error("Interrupted while waiting for image {}", task.logicalName());
      var outcome = TaskOutcome.failed(e);
      complete(task, outcome);
      return outcome;
    } catch (ExecutionException e) {
      logger.error("Unexpected failure for image {}", task.logicalName(), e.getCause());
      var outcome = TaskOutcome.failed(e.getCause());
      complete(task, outcome);
      return outcome;
    }
  }

  private static void complete(ImageTask task, TaskOutcome outcome) {
    if (!task.complete(outcome)) {
      logger.debug("Image {} already ended as {}, ignoring {}", task.logicalName(), task.status(), outcome.status());
    }
  }

  private ExecutorService newWorkerPool() {
    var threadFactory = new ThreadFactoryBuilder().setNameFormat("tiler-worker-%d").build();
    return Executors.newFixedThreadPool(settings.workers(), threadFactory);
  }

  private static long archiveSize(BatchJob job) {
    try {
      return Files.size(job.archivePath());
    } catch (IOException e) {
      throw new ArchiveException("Failed to read size of archive " + job.archivePath(), e);
    }
  }

  private static List<TaskReport> reports(List<ImageTask> tasks, List<TaskOutcome> outcomes) {
    var reports = new ArrayList<TaskReport>(tasks.size());
    for (int i = 0; i < tasks.size(); i++) {
      reports.add(TaskReport.of(tasks.get(i), outcomes.get(i)));
    }
    return reports;
  }

  private static void logSummary(BatchReport report, long duration) {
    for (var task : report.tasks()) {
      if (task.detail() == null) {
        logger.info("  {} -> {} ({} tiles)", task.logicalName(), task.status(), task.tilesArchived());
      } else {
        logger.info("  {} -> {}: {}", task.logicalName(), task.status(), task.detail());
      }
    }
    logger.info("Batch finished in {}ms: {} done, {} skipped, {} failed, {} tiles archived",
      duration, report.count(TaskStatus.DONE), report.count(TaskStatus.SKIPPED), report.count(TaskStatus.FAILED), report.tilesArchived());
    logger.info("Final ZIP size: {} bytes", report.archiveSizeBytes());
  }

  private static long elapsedMillis(long startTime) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
  }
}
