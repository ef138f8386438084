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
import fr.aneo.histotiler.testutils.ArchiveContents;
import fr.aneo.histotiler.testutils.FakeTilingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchivePackagerTest {

  @TempDir
  Path tempDir;

  private final ArchivePackager packager = new ArchivePackager();
  private Path tileFolder;

  @BeforeEach
  void setUp() throws IOException {
    tileFolder = Files.createDirectories(tempDir.resolve("engine").resolve("x_tiles"));
  }

  @Test
  @DisplayName("names entries after the archive name and the tile index")
  void names_entries_after_archive_name_and_index() throws IOException {
    // Given
    tile("x_0.png");
    tile("x_2.png");
    tile("x_5.png");
    var zip = tempDir.resolve("tiles.zip");

    // When
    int appended;
    try (var archive = TileArchive.create(zip)) {
      appended = packager.append(archive, "slideA", new TileDirectory(tileFolder, 3), TileFormat.PNG);
    }

    // Then
    assertThat(appended).isEqualTo(3);
    assertThat(ArchiveContents.entryNames(zip))
      .containsExactlyInAnyOrder("slideA/slideA_0.png", "slideA/slideA_2.png", "slideA/slideA_5.png");
  }

  @Test
  @DisplayName("ignores other files and nested folders")
  void ignores_other_files_and_nested_folders() throws IOException {
    // Given
    tile("x_1.png");
    tile("x_mask.ppm");
    Files.createDirectories(tileFolder.resolve("sub"));
    Files.writeString(tileFolder.resolve("sub").resolve("x_9.png"), "nested");
    var zip = tempDir.resolve("tiles.zip");

    // When
    try (var archive = TileArchive.create(zip)) {
      packager.append(archive, "slideA", new TileDirectory(tileFolder, 1), TileFormat.PNG);
    }

    // Then
    assertThat(ArchiveContents.entryNames(zip)).containsExactly("slideA/slideA_1.png");
  }

  @Test
  @DisplayName("packaging the same folder twice doubles the entries")
  void packaging_twice_doubles_entries() throws IOException {
    // Given
    tile("x_0.png");
    tile("x_1.png");
    var zip = tempDir.resolve("tiles.zip");

    // When
    try (var archive = TileArchive.create(zip)) {
      packager.append(archive, "slideA", new TileDirectory(tileFolder, 2), TileFormat.PNG);
      packager.append(archive, "slideA", new TileDirectory(tileFolder, 2), TileFormat.PNG);
    }

    // Then
    assertThat(ArchiveContents.entryNames(zip)).hasSize(4);
  }

  @Test
  @DisplayName("empty or missing folders contribute nothing")
  void empty_or_missing_folders_contribute_nothing() {
    // Given
    var zip = tempDir.resolve("tiles.zip");

    // When
    try (var archive = TileArchive.create(zip)) {
      assertThat(packager.append(archive, "slideA", new TileDirectory(tileFolder, 0), TileFormat.PNG)).isZero();
      assertThat(packager.append(archive, "slideA", new TileDirectory(tempDir.resolve("absent"), 0), TileFormat.PNG)).isZero();
    }

    // Then
    assertThat(ArchiveContents.entryNames(zip)).isEmpty();
  }

  @Test
  @EnabledOnOs(OS.LINUX)
  @DisplayName("a tile failing to read leaves the archive without the folder's entries")
  void tile_failing_to_read_leaves_archive_without_folder_entries() throws IOException {
    // Given
    tile("x_0.png");
    tile("x_1.png");
    Files.createSymbolicLink(tileFolder.resolve("x_2.png"), FakeTilingEngine.UNREADABLE_FILE);
    var zip = tempDir.resolve("tiles.zip");

    // When
    try (var archive = TileArchive.create(zip)) {
      assertThatThrownBy(() -> packager.append(archive, "slideA", new TileDirectory(tileFolder, 3), TileFormat.PNG))
        .isInstanceOf(PackagingException.class);
    }

    // Then
    assertThat(ArchiveContents.entryNames(zip)).isEmpty();
  }

  @Test
  @DisplayName("builds entry names as folder and file")
  void builds_entry_names() {
    assertThat(ArchivePackager.entryName("case.01", "007", "png")).isEqualTo("case.01/case.01_007.png");
  }

  private void tile(String name) throws IOException {
    Files.writeString(tileFolder.resolve(name), name);
  }
}
