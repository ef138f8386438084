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

import fr.aneo.histotiler.domain.ExtractionException;
import fr.aneo.histotiler.domain.TileConfig;
import fr.aneo.histotiler.domain.TileDirectory;
import fr.aneo.histotiler.domain.TilingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Runs the {@link TilingEngine} for one task and locates the tiles it produced.
 * <p>
 * The adapter:
 * </p>
 * <ol>
 *   <li>Probes for the native segmentation binary and logs a degraded-mode warning when it is
 *       missing. The configured method is left untouched</li>
 *   <li>Creates the task's output root and invokes the engine</li>
 *   <li>Resolves the directory the engine actually wrote tiles into</li>
 *   <li>Counts the tiles found there. Zero is a valid result</li>
 * </ol>
 *
 * <h2>Directory Resolution</h2>
 * <p>
 * The engine chooses its own layout below the output root. In order of preference:
 * </p>
 * <ol>
 *   <li>{@code <outputRoot>/<slideStem>/<slideStem>_tiles}</li>
 *   <li>a directory named {@code *_tiles} at most two levels below the output root</li>
 *   <li>the output root itself, if it directly holds tiles</li>
 *   <li>the conventional path of rule 1, even if it does not exist</li>
 * </ol>
 */
final class TileExtractionAdapter {
  private static final Logger logger = LoggerFactory.getLogger(TileExtractionAdapter.class);

  static final String TILES_SUFFIX = "_tiles";

  private final TilingEngine engine;
  private final Path segmentationBinary;

  TileExtractionAdapter(TilingEngine engine, Path segmentationBinary) {
    this.engine = requireNonNull(engine, "engine cannot be null");
    this.segmentationBinary = requireNonNull(segmentationBinary, "segmentationBinary cannot be null");
  }

  /**
   * Tiles one slide and returns the directory holding its tiles.
   *
   * @param config the task configuration
   * @return the resolved tile directory with its tile count
   * @throws ExtractionException if the output root cannot be prepared, the engine fails, or the
   *                             output root cannot be scanned
   */
  TileDirectory extract(TileConfig config) {
    probeSegmentationBinary();

    try {
      Files.createDirectories(config.outputRoot());
    } catch (IOException e) {
      throw new ExtractionException("Failed to create output directory: " + config.outputRoot(), e);
    }

    engine.execute(config);

    try {
      var directory = resolveTileDirectory(config);
      var tileCount = TileFiles.count(directory, config.format());
      logger.info("Found {} tiles in {}", tileCount, directory);
      return new TileDirectory(directory, tileCount);

    } catch (UncheckedIOException e) {
      throw new ExtractionException("Failed to scan engine output under " + config.outputRoot(), e.getCause());
    }
  }

  /**
   * Checks whether the native segmentation binary is installed and executable.
   *
   * @return {@code true} if the binary is usable
   */
  boolean probeSegmentationBinary() {
    if (Files.isRegularFile(segmentationBinary) && Files.isExecutable(segmentationBinary)) {
      logger.info("Segmentation executable found: {}", segmentationBinary);
      return true;
    }
    logger.warn("Segmentation executable missing at {}, graph segmentation unavailable (Otsu thresholding only)", segmentationBinary);
    return false;
  }

  Path resolveTileDirectory(TileConfig config) {
    var root = config.outputRoot();
    var stem = config.slideStem();
    var conventional = root.resolve(stem).resolve(stem + TILES_SUFFIX);
    if (Files.isDirectory(conventional)) {
      return conventional;
    }

    var candidates = findTileFolders(root);
    if (!candidates.isEmpty()) {
      if (candidates.size() > 1) {
        logger.warn("Several tile folders under {}: {}. Using {}", root, candidates, candidates.get(0));
      }
      return candidates.get(0);
    }

    if (TileFiles.count(root, config.format()) > 0) {
      return root;
    }

    logger.debug("No tile folder found under {}, expected {}", root, conventional);
    return conventional;
  }

  private static List<Path> findTileFolders(Path root) {
    if (!Files.isDirectory(root)) return List.of();

    try (var walk = Files.walk(root, 2)) {
      return walk.filter(path -> !path.equals(root))
                 .filter(Files::isDirectory)
                 .filter(path -> path.getFileName().toString().endsWith(TILES_SUFFIX))
                 .sorted(Comparator.naturalOrder())
                 .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan " + root, e);
    }
  }
}
