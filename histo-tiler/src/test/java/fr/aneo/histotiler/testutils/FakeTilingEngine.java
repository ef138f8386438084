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
package fr.aneo.histotiler.testutils;

import fr.aneo.histotiler.domain.ExtractionException;
import fr.aneo.histotiler.domain.TileConfig;
import fr.aneo.histotiler.domain.TilingEngine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Engine double that lays tiles out the way PyHIST does: {@code <outputRoot>/<stem>/<stem>_tiles/<stem>_<index>.png}.
 * Slides without configured indices produce an empty tile folder.
 */
public class FakeTilingEngine implements TilingEngine {

  public static final Path UNREADABLE_FILE = Path.of("/proc/self/mem");

  private final Map<String, List<String>> tileIndices = new HashMap<>();
  private final Map<String, String> failures = new HashMap<>();
  private final Map<String, List<String>> unreadableTiles = new HashMap<>();
  private final List<TileConfig> executions = new CopyOnWriteArrayList<>();

  public FakeTilingEngine withTiles(String slideStem, String... indices) {
    tileIndices.put(slideStem, List.of(indices));
    return this;
  }

  /**
   * Adds tiles that list as regular readable files but fail with an I/O error once read.
   * Linux only: each tile is a symbolic link to {@code /proc/self/mem}.
   */
  public FakeTilingEngine withUnreadableTiles(String slideStem, String... indices) {
    unreadableTiles.put(slideStem, List.of(indices));
    return this;
  }

  public FakeTilingEngine failingOn(String slideStem, String message) {
    failures.put(slideStem, message);
    return this;
  }

  public List<TileConfig> executions() {
    return executions;
  }

  @Override
  public void execute(TileConfig config) {
    executions.add(config);
    var stem = config.slideStem();
    if (failures.containsKey(stem)) {
      throw new ExtractionException(failures.get(stem));
    }

    var tileFolder = config.outputRoot().resolve(stem).resolve(stem + "_tiles");
    try {
      Files.createDirectories(tileFolder);
      for (var index : tileIndices.getOrDefault(stem, List.of())) {
        Files.writeString(tileFolder.resolve(stem + "_" + index + ".png"), "tile " + stem + " " + index, UTF_8);
      }
      for (var index : unreadableTiles.getOrDefault(stem, List.of())) {
        Files.createSymbolicLink(tileFolder.resolve(stem + "_" + index + ".png"), UNREADABLE_FILE);
      }
      Files.writeString(config.outputRoot().resolve(stem).resolve(stem + "_mask.ppm"), "mask", UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Path writeSlide(Path directory, String fileName) {
    try {
      return Files.writeString(directory.resolve(fileName), "slide", UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
