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
package fr.aneo.histotiler.domain;

import java.nio.file.Path;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Summary of a finished batch: one entry per task plus the final archive size.
 *
 * @param archivePath      the output archive
 * @param archiveSizeBytes size of the finalized archive, in bytes
 * @param tasks            per-task results, in submission order
 */
public record BatchReport(Path archivePath, long archiveSizeBytes, List<TaskReport> tasks) {

  public BatchReport {
    requireNonNull(archivePath, "archivePath cannot be null");
    tasks = List.copyOf(requireNonNull(tasks, "tasks cannot be null"));
  }

  public long count(TaskStatus status) {
    return tasks.stream().filter(task -> task.status() == status).count();
  }

  public int tilesArchived() {
    return tasks.stream().mapToInt(TaskReport::tilesArchived).sum();
  }

  /**
   * Result of one task.
   *
   * @param logicalName   the task's logical name
   * @param sourcePath    the task's slide path
   * @param status        terminal status
   * @param tilesArchived entries appended to the archive
   * @param detail        skip reason or failure message; {@code null} for completed tasks
   */
  public record TaskReport(String logicalName, Path sourcePath, TaskStatus status, int tilesArchived, String detail) {

    public static TaskReport of(ImageTask task, TaskOutcome outcome) {
      String detail = null;
      if (outcome instanceof TaskOutcome.Skipped skipped) {
        detail = skipped.reason();
      } else if (outcome instanceof TaskOutcome.Failed failed) {
        detail = failed.message();
      }
      return new TaskReport(task.logicalName(), task.sourcePath(), outcome.status(), outcome.tilesArchived(), detail);
    }
  }
}
