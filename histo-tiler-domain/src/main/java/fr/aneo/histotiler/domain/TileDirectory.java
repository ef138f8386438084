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

import static java.util.Objects.requireNonNull;

/**
 * The directory the tiling engine actually wrote one task's tiles into, resolved after extraction.
 * <p>
 * The directory may not exist, or may hold no tiles: zero tiles is a valid outcome for a blank
 * slide. It is owned by the task that produced it until packaging consumes it, and is only
 * deleted by the batch-level scratch cleanup.
 * </p>
 *
 * @param path      the resolved directory
 * @param tileCount number of tile files found in it at resolution time
 */
public record TileDirectory(Path path, int tileCount) {

  public TileDirectory {
    requireNonNull(path, "path cannot be null");
    if (tileCount < 0) {
      throw new IllegalArgumentException("tileCount cannot be negative");
    }
  }

  public boolean isEmpty() {
    return tileCount == 0;
  }
}
