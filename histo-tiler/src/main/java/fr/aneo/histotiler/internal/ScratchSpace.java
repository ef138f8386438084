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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Objects.requireNonNull;

/**
 * The shared scratch directory receiving every task's engine output.
 * <p>
 * By convention the scratch root is {@code <archive parent>/output}. Each task is given its own
 * output root below it, so no two tasks share an engine output directory. Tasks only write here;
 * the whole root is removed by {@link #deleteAll()} once, after every task has finished.
 * </p>
 */
final class ScratchSpace {
  private static final Logger logger = LoggerFactory.getLogger(ScratchSpace.class);

  static final String DIRECTORY_NAME = "output";

  private final Path root;
  private final AtomicBoolean deleted = new AtomicBoolean(false);

  ScratchSpace(Path root) {
    this.root = requireNonNull(root, "root cannot be null").toAbsolutePath().normalize();
  }

  static ScratchSpace forArchive(Path archivePath) {
    var parent = archivePath.toAbsolutePath().getParent();
    return new ScratchSpace(parent.resolve(DIRECTORY_NAME));
  }

  Path root() {
    return root;
  }

  Path outputRootFor(ImageTask task) {
    return root.resolve("task-" + task.ordinal());
  }

  /**
   * Recursively deletes the scratch root. Only the first call deletes; failures on individual
   * files are logged and do not stop the deletion of the remaining files.
   *
   * @return {@code true} if the scratch root no longer exists
   */
  boolean deleteAll() {
    if (!deleted.compareAndSet(false, true)) {
      logger.debug("Scratch space {} already cleaned up", root);
      return !Files.exists(root);
    }
    if (!Files.exists(root)) {
      logger.debug("Scratch space {} was never created", root);
      return true;
    }

    var failures = new AtomicInteger();
    try (var walk = Files.walk(root)) {
      walk.sorted(Comparator.reverseOrder())
          .forEach(path -> {
            try {
              Files.delete(path);
            } catch (IOException e) {
              failures.incrementAndGet();
              logger.debug("Failed to delete: {}", path, e);
            }
          });
    } catch (IOException e) {
      logger.warn("Failed to walk scratch space {}", root, e);
    }

    if (failures.get() > 0 || Files.exists(root)) {
      logger.warn("Scratch space {} only partially deleted ({} failures)", root, failures.get());
      return false;
    }
    logger.info("Temporary files cleaned up: {}", root);
    return true;
  }
}
