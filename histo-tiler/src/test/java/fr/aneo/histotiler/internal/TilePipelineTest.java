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

import fr.aneo.histotiler.domain.*;
import fr.aneo.histotiler.testutils.ArchiveContents;
import fr.aneo.histotiler.testutils.FakeTilingEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static fr.aneo.histotiler.testutils.FakeTilingEngine.writeSlide;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TilePipelineTest {

  @TempDir
  Path tempDir;

  private SlideValidator validator;
  private FakeTilingEngine engine;
  private TileArchive archive;
  private TilePipeline pipeline;

  @BeforeEach
  void setUp() {
    validator = mock(SlideValidator.class);
    engine = new FakeTilingEngine().withTiles("slideA", "0", "2", "5");
    archive = TileArchive.create(tempDir.resolve("tiles.zip"));
    pipeline = new TilePipeline(
      validator,
      new TileJobConfigurator(),
      new TileExtractionAdapter(engine, tempDir.resolve("segment")),
      new ArchivePackager(),
      archive,
      ScratchSpace.forArchive(tempDir.resolve("tiles.zip")));
  }

  @AfterEach
  void tearDown() {
    archive.close();
  }

  @Test
  @DisplayName("runs validation, extraction and packaging for a slide")
  void runs_all_stages_for_a_slide() {
    // Given
    var task = new ImageTask(1, writeSlide(tempDir, "upload-123.svs"), "slideA.svs");
    engine.withTiles("upload-123", "0", "1");

    // When
    var outcome = pipeline.run(task);

    // Then
    assertThat(outcome).isEqualTo(TaskOutcome.done(2));
    assertThat(task.status()).isEqualTo(TaskStatus.PACKAGING);
    verify(validator).validate(task.sourcePath());
    assertThat(engine.executions()).singleElement()
                                   .satisfies(config -> assertThat(config.outputRoot()).isEqualTo(tempDir.resolve("output").resolve("task-1")));
    archive.close();
    assertThat(ArchiveContents.entryNames(tempDir.resolve("tiles.zip"))).containsExactly("slideA/slideA_0.png", "slideA/slideA_1.png");
  }

  @Test
  @DisplayName("missing source is skipped before any validation")
  void missing_source_skipped_before_validation() {
    // Given
    var task = new ImageTask(1, tempDir.resolve("absent.svs"), "slideB");

    // When/Then
    assertThatThrownBy(() -> pipeline.run(task))
      .isInstanceOf(MissingSourceException.class)
      .isInstanceOf(TaskSkippedException.class)
      .hasMessageContaining("absent.svs");
    verifyNoInteractions(validator);
    assertThat(engine.executions()).isEmpty();
    assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
  }

  @Test
  @DisplayName("invalid image stops the task before extraction")
  void invalid_image_stops_before_extraction() {
    // Given
    var task = new ImageTask(1, writeSlide(tempDir, "slideA.svs"), "slideA");
    doThrow(new InvalidImageException("Invalid input file")).when(validator).validate(any());

    // When/Then
    assertThatThrownBy(() -> pipeline.run(task)).isInstanceOf(InvalidImageException.class);
    assertThat(engine.executions()).isEmpty();
    assertThat(task.status()).isEqualTo(TaskStatus.VALIDATING);
  }

  @Test
  @DisplayName("slide without tissue tiles is reported as skipped")
  void slide_without_tiles_is_skipped() {
    // Given
    var task = new ImageTask(1, writeSlide(tempDir, "blank.svs"), "blank");

    // When/Then
    assertThatThrownBy(() -> pipeline.run(task))
      .isInstanceOf(NoTilesProducedException.class)
      .isInstanceOf(TaskSkippedException.class);
    assertThat(task.status()).isEqualTo(TaskStatus.PACKAGING);
    archive.close();
    assertThat(ArchiveContents.entryNames(tempDir.resolve("tiles.zip"))).isEmpty();
  }
}
