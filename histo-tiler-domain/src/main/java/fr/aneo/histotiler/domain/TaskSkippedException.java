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
 * Base class for per-task conditions that end a task as {@link TaskStatus#SKIPPED}.
 * <p>
 * A skipped task is an expected outcome (missing input, slide without tissue), not an error:
 * it is logged as a warning and contributes no entries to the archive.
 * </p>
 *
 * @see MissingSourceException
 * @see NoTilesProducedException
 */
public abstract class TaskSkippedException extends TilerException {

  protected TaskSkippedException(String message) {
    super(message);
  }
}
