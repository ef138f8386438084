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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TileFilesTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("lists only top-level files with the tile extension")
  void lists_only_top_level_tiles() throws IOException {
    // Given
    Files.createFile(tempDir.resolve("s_2.png"));
    Files.createFile(tempDir.resolve("s_0.PNG"));
    Files.createFile(tempDir.resolve("s_mask.ppm"));
    Files.createDirectories(tempDir.resolve("nested"));
    Files.createFile(tempDir.resolve("nested").resolve("s_9.png"));

    // When
    var tiles = TileFiles.list(tempDir, TileFormat.PNG);

    // Then
    assertThat(tiles).extracting(path -> path.getFileName().toString()).containsExactly("s_0.PNG", "s_2.png");
    assertThat(TileFiles.count(tempDir, TileFormat.PNG)).isEqualTo(2);
  }

  @Test
  @DisplayName("missing directory holds no tiles")
  void missing_directory_holds_no_tiles() {
    assertThat(TileFiles.list(tempDir.resolve("absent"), TileFormat.PNG)).isEmpty();
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "slideA_0.png, 0",
    "slideA_017.png, 017",
    "my_slide_name_42.png, 42",
    "notile.png, notile",
    "trailing_.png, ''"
  })
  @DisplayName("tile index is the text after the last underscore of the stem")
  void tile_index_is_text_after_last_underscore(String fileName, String expected) {
    assertThat(TileFiles.tileIndex(Path.of(fileName))).isEqualTo(expected);
  }

  @Test
  @DisplayName("extension keeps the file's own case")
  void extension_keeps_file_case() {
    assertThat(TileFiles.extension(Path.of("s_1.PNG"))).isEqualTo("PNG");
    assertThat(TileFiles.extension(Path.of("s_1"))).isEmpty();
  }
}
