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

import fr.aneo.histotiler.domain.TileFormat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Helpers for the tile files written by the tiling engine.
 * <p>
 * Tile discovery is non-recursive and filtered by extension, so side outputs the engine writes in
 * subfolders or in other formats are never mistaken for tiles.
 * </p>
 *
 * <h2>Tile Index</h2>
 * <p>
 * The engine names tiles {@code <prefix>_<index>.<ext>}. The index is the substring after the
 * last {@code _} of the file name without extension, kept verbatim: no parsing, no renumbering,
 * gaps and leading zeros preserved. A name without {@code _} yields the whole stem.
 * </p>
 */
final class TileFiles {

  private TileFiles() {
  }

  /**
   * Lists the tile files directly inside {@code directory}, sorted by file name.
   *
   * @param directory the directory to scan; may not exist
   * @param format    the tile format whose extension is matched, case-insensitively
   * @return the tile files; empty if the directory does not exist
   * @throws UncheckedIOException if the directory cannot be listed
   */
  static List<Path> list(Path directory, TileFormat format) {
    if (!Files.isDirectory(directory)) return List.of();

    var suffix = "." + format.extension();
    try (var files = Files.list(directory)) {
      return files.filter(Files::isRegularFile)
                  .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                  .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                  .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list tiles in " + directory, e);
    }
  }

  static int count(Path directory, TileFormat format) {
    return list(directory, format).size();
  }

  static String tileIndex(Path tile) {
    var stem = stem(tile);
    return stem.substring(stem.lastIndexOf('_') + 1);
  }

  static String extension(Path tile) {
    var name = tile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot >= 0 ? name.substring(dot + 1) : "";
  }

  private static String stem(Path tile) {
    var name = tile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
