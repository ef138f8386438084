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

import fr.aneo.histotiler.domain.PackagingException;
import fr.aneo.histotiler.domain.TileDirectory;
import fr.aneo.histotiler.domain.TileFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * Appends the tiles of one task to the shared {@link TileArchive}.
 * <p>
 * Each tile file directly inside the tile directory is stored as
 * {@code <name>/<name>_<tileIndex>.<ext>}, where {@code name} is the task's archive name and
 * {@code tileIndex} the trailing token of the tile's own file name (see {@link TileFiles}).
 * </p>
 * <p>
 * Packaging is not idempotent: packaging the same directory twice appends every tile twice.
 * Callers package each task at most once. When the directory is missing or holds no tiles,
 * nothing is written and 0 is returned.
 * </p>
 */
final class ArchivePackager {
  private static final Logger logger = LoggerFactory.getLogger(ArchivePackager.class);

  /**
   * Appends all tiles of {@code tiles} to {@code archive}.
   *
   * @param archive     the shared archive
   * @param archiveName the task's archive folder name and entry prefix
   * @param tiles       the resolved tile directory
   * @param format      the tile format to collect
   * @return number of entries appended
   * @throws PackagingException if the tiles cannot be listed, read or written
   */
  int append(TileArchive archive, String archiveName, TileDirectory tiles, TileFormat format) {
    try {
      var files = TileFiles.list(tiles.path(), format);
      if (files.isEmpty()) {
        logger.debug("No {} tiles in {}", format.extension(), tiles.path());
        return 0;
      }

      var unreadable = files.stream().filter(file -> !Files.isReadable(file)).toList();
      if (!unreadable.isEmpty()) {
        throw new PackagingException("Unreadable tile files in " + tiles.path() + ": " + unreadable);
      }

      var items = files.stream()
                       .map(file -> new TileArchive.Item(entryName(archiveName, TileFiles.tileIndex(file), TileFiles.extension(file)), file))
                       .toList();

      int appended = archive.append(items);
      logger.info("Appended {} tiles to {}", appended, archive.path());
      return appended;

    } catch (UncheckedIOException e) {
      throw new PackagingException("Failed to list tiles in " + tiles.path(), e.getCause());
    }
  }

  static String entryName(String archiveName, String tileIndex, String extension) {
    return archiveName + "/" + archiveName + "_" + tileIndex + "." + extension;
  }
}
