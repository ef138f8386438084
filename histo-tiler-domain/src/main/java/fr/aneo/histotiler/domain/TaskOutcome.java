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

/**
 * Models the terminal outcome of one {@link ImageTask}.
 * <p>
 * Outcomes are produced at the task boundary: the pipeline returns {@link Done} on success, and
 * any per-task exception is converted into {@link Skipped} or {@link Failed} instead of being
 * propagated to the batch driver.
 * </p>
 *
 * <h2>Status Mapping</h2>
 * <ul>
 *   <li>{@link Done} &rarr; {@link TaskStatus#DONE}</li>
 *   <li>{@link Skipped} &rarr; {@link TaskStatus#SKIPPED}</li>
 *   <li>{@link Failed} &rarr; {@link TaskStatus#FAILED}</li>
 * </ul>
 */
public sealed interface TaskOutcome {

  /**
   * Returns the terminal task status this outcome maps to.
   *
   * @return a terminal {@link TaskStatus}
   */
  TaskStatus status();

  /**
   * Number of archive entries contributed by the task.
   *
   * @return the entry count; zero unless the outcome is {@link Done}
   */
  default int tilesArchived() {
    return 0;
  }

  static Done done(int tilesArchived) {
    return new Done(tilesArchived);
  }

  static Skipped skipped(String reason) {
    return new Skipped(reason);
  }

  /**
   * Convenience factory to create a {@link Failed} outcome from a {@link Throwable}. If the throwable
   * has no message, {@code throwable.toString()} is used.
   *
   * @param throwable the cause of the failure; may be {@code null}
   * @return a failed outcome wrapping a message extracted from the throwable
   */
  static Failed failed(Throwable throwable) {
    String msg = (throwable == null)
      ? "Unknown error"
      : (throwable.getMessage() != null ? throwable.getMessage() : throwable.toString());
    return new Failed(msg);
  }

  /**
   * The task archived all its tiles.
   *
   * @param tilesArchived number of entries appended to the archive; strictly positive
   */
  record Done(int tilesArchived) implements TaskOutcome {
    public Done {
      if (tilesArchived <= 0) {
        throw new IllegalArgumentException("A completed task archives at least one tile");
      }
    }

    @Override
    public TaskStatus status() {
      return TaskStatus.DONE;
    }
  }

  /**
   * The task ended without error and without archive entries.
   *
   * @param reason human-readable reason, e.g. a missing source or a slide without tissue
   */
  record Skipped(String reason) implements TaskOutcome {
    public Skipped {
      if (reason == null) {
        reason = "Skipped";
      }
    }

    @Override
    public TaskStatus status() {
      return TaskStatus.SKIPPED;
    }
  }

  /**
   * The task failed; it contributed no archive entries.
   *
   * @param message non-null error details
   */
  record Failed(String message) implements TaskOutcome {
    public Failed {
      if (message == null) {
        message = "Unknown error";
      }
    }

    @Override
    public TaskStatus status() {
      return TaskStatus.FAILED;
    }
  }
}
