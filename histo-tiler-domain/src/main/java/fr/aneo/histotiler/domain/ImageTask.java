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
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * One unit of per-image work within a {@link BatchJob}.
 * <p>
 * A task pairs the filesystem path of a raw slide with its logical name, the stable identifier
 * used to name the task's folder and entries in the output archive. The logical name does not
 * need to match the file name of the slide.
 * </p>
 *
 * <h2>Status</h2>
 * <p>
 * The task starts in {@link TaskStatus#PENDING} and is advanced only by the pipeline executing
 * it. Illegal transitions (for instance leaving a terminal state) are rejected with an
 * {@link IllegalStateException}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The status is held in an atomic reference, so it can be observed from other threads while the
 * task runs on a worker.
 * </p>
 */
public final class ImageTask {
  private final int ordinal;
  private final Path sourcePath;
  private final String logicalName;
  private final String archiveName;
  private final AtomicReference<TaskStatus> status = new AtomicReference<>(TaskStatus.PENDING);

  /**
   * Creates a pending task.
   *
   * @param ordinal     1-based position of the task in its batch
   * @param sourcePath  path to the raw slide; must not be {@code null}
   * @param logicalName stable output name of the slide; must not be {@code null}
   * @throws IllegalArgumentException if no archive folder name can be derived from {@code logicalName}
   */
  public ImageTask(int ordinal, Path sourcePath, String logicalName) {
    this.ordinal = ordinal;
    this.sourcePath = requireNonNull(sourcePath, "sourcePath cannot be null");
    this.logicalName = requireNonNull(logicalName, "logicalName cannot be null");
    this.archiveName = archiveNameOf(logicalName);
  }

  public int ordinal() {
    return ordinal;
  }

  public Path sourcePath() {
    return sourcePath;
  }

  public String logicalName() {
    return logicalName;
  }

  /**
   * Returns the name used for this task's archive folder and entry prefix.
   * <p>
   * This is the logical name with its last file extension removed, so {@code "slideA.svs"}
   * becomes {@code "slideA"}. A logical name without an extension is returned unchanged.
   * </p>
   *
   * @return the archive base name; never {@code null}
   */
  public String archiveName() {
    return archiveName;
  }

  public TaskStatus status() {
    return status.get();
  }

  /**
   * Moves this task to the next lifecycle state.
   *
   * @param next the state to move to; must be reachable from the current state
   * @throws IllegalStateException if the transition is not allowed
   * @see TaskStatus#canMoveTo(TaskStatus)
   */
  public void advanceTo(TaskStatus next) {
    requireNonNull(next, "next cannot be null");
    status.getAndUpdate(current -> {
      if (!current.canMoveTo(next)) {
        throw new IllegalStateException("Task " + logicalName + " cannot move from " + current + " to " + next);
      }
      return next;
    });
  }

  /**
   * Records the terminal state matching {@code outcome}, unless the task is already terminal.
   *
   * @param outcome the outcome of the task's run
   * @return {@code true} if this call ended the task, {@code false} if it had already ended
   */
  public boolean complete(TaskOutcome outcome) {
    requireNonNull(outcome, "outcome cannot be null");
    var terminal = outcome.status();
    while (true) {
      var current = status.get();
      if (current.isTerminal()) return false;
      if (!current.canMoveTo(terminal)) {
        throw new IllegalStateException("Task " + logicalName + " cannot end as " + terminal + " from " + current);
      }
      if (status.compareAndSet(current, terminal)) return true;
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (ImageTask) obj;
    return ordinal == that.ordinal &&
      Objects.equals(this.sourcePath, that.sourcePath) &&
      Objects.equals(this.logicalName, that.logicalName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ordinal, sourcePath, logicalName);
  }

  @Override
  public String toString() {
    return "ImageTask[" +
      "ordinal=" + ordinal +
      ", sourcePath=" + sourcePath +
      ", logicalName='" + logicalName + '\'' +
      ", status=" + status.get() +
      ']';
  }

  private static String archiveNameOf(String logicalName) {
    var fileName = Path.of(logicalName).getFileName();
    if (fileName == null || fileName.toString().isBlank()) {
      throw new IllegalArgumentException("Logical name '" + logicalName + "' does not name a file");
    }
    var name = fileName.toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
