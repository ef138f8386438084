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
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The unit of a command-line invocation: an ordered list of {@link ImageTask} sharing a single
 * output archive.
 * <p>
 * Input paths and logical names are supplied as two positionally paired lists. A length mismatch
 * is a fatal configuration error detected by {@link #of(List, List, Path)} before any processing
 * starts.
 * </p>
 *
 * @param tasks       the tasks of the batch, in submission order
 * @param archivePath the absolute path of the shared output archive
 */
public record BatchJob(List<ImageTask> tasks, Path archivePath) {

  public BatchJob {
    requireNonNull(tasks, "tasks cannot be null");
    requireNonNull(archivePath, "archivePath cannot be null");
    tasks = List.copyOf(tasks);
    archivePath = archivePath.toAbsolutePath().normalize();
  }

  /**
   * Builds a batch from positionally paired input paths and logical names.
   *
   * @param inputs       slide paths; relative paths are resolved to absolute ones
   * @param logicalNames logical names, one per input
   * @param archivePath  path of the output archive
   * @return a batch whose tasks are all {@link TaskStatus#PENDING}
   * @throws ConfigurationException if the two lists have different lengths, if a logical name is
   *                                blank or names no file, or if an argument is missing
   */
  public static BatchJob of(List<Path> inputs, List<String> logicalNames, Path archivePath) {
    if (inputs == null || logicalNames == null) {
      throw new ConfigurationException("Input paths and original names are required");
    }
    if (archivePath == null) {
      throw new ConfigurationException("Output archive path is required");
    }
    if (inputs.size() != logicalNames.size()) {
      throw new ConfigurationException("Mismatch between input paths (" + inputs.size() + ") and original names (" + logicalNames.size() + ")");
    }

    var tasks = new ArrayList<ImageTask>(inputs.size());
    for (int i = 0; i < inputs.size(); i++) {
      var name = logicalNames.get(i);
      if (name == null || name.isBlank()) {
        throw new ConfigurationException("Original name for input " + inputs.get(i) + " is blank");
      }
      try {
        tasks.add(new ImageTask(i + 1, inputs.get(i).toAbsolutePath().normalize(), name.trim()));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid original name for input " + inputs.get(i) + ": " + e.getMessage());
      }
    }
    return new BatchJob(tasks, archivePath);
  }

  public int size() {
    return tasks.size();
  }
}
