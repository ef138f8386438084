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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an {@link ImageTask}.
 * <p>
 * A task moves forward through the pipeline stages and ends in exactly one terminal state:
 * </p>
 * <pre>
 * PENDING → VALIDATING → EXTRACTING → PACKAGING → DONE
 *     ↘            ↘            ↘           ↘
 *                   SKIPPED | FAILED
 * </pre>
 * <p>
 * Terminal states are final; a task is never retried.
 * </p>
 */
public enum TaskStatus {
  PENDING,
  VALIDATING,
  EXTRACTING,
  PACKAGING,
  DONE,
  SKIPPED,
  FAILED;

  private static final Set<TaskStatus> TERMINAL = EnumSet.of(DONE, SKIPPED, FAILED);

  public boolean isTerminal() {
    return TERMINAL.contains(this);
  }

  /**
   * Tells whether a task in this state may move to {@code next}.
   * <p>
   * Forward moves are allowed one stage at a time. Any non-terminal state may end in
   * {@link #SKIPPED} or {@link #FAILED}; only {@link #PACKAGING} may end in {@link #DONE}.
   * </p>
   *
   * @param next the requested state
   * @return {@code true} if the transition is legal
   */
  public boolean canMoveTo(TaskStatus next) {
    if (isTerminal()) return false;
    if (next == SKIPPED || next == FAILED) return true;
    return next.ordinal() == ordinal() + 1;
  }
}
