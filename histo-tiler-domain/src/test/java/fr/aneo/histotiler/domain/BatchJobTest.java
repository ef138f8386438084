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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchJobTest {

  @Test
  @DisplayName("pairs inputs and names positionally")
  void pairs_inputs_and_names_positionally() {
    // When
    var job = BatchJob.of(
      List.of(Path.of("/data/a.svs"), Path.of("/data/b.svs")),
      List.of("slideA", "slideB"),
      Path.of("/out/tiles.zip"));

    // Then
    assertThat(job.size()).isEqualTo(2);
    assertThat(job.tasks()).extracting(ImageTask::ordinal).containsExactly(1, 2);
    assertThat(job.tasks()).extracting(ImageTask::logicalName).containsExactly("slideA", "slideB");
    assertThat(job.tasks()).extracting(ImageTask::sourcePath).containsExactly(Path.of("/data/a.svs"), Path.of("/data/b.svs"));
    assertThat(job.tasks()).allMatch(task -> task.status() == TaskStatus.PENDING);
    assertThat(job.archivePath()).isEqualTo(Path.of("/out/tiles.zip"));
  }

  @Test
  @DisplayName("rejects more inputs than names")
  void rejects_more_inputs_than_names() {
    // When/Then
    assertThatThrownBy(() -> BatchJob.of(
      List.of(Path.of("/data/a.svs"), Path.of("/data/b.svs")),
      List.of("slideA"),
      Path.of("/out/tiles.zip")))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("Mismatch")
      .hasMessageContaining("(2)")
      .hasMessageContaining("(1)");
  }

  @Test
  @DisplayName("rejects more names than inputs")
  void rejects_more_names_than_inputs() {
    // When/Then
    assertThatThrownBy(() -> BatchJob.of(List.of(), List.of("slideA"), Path.of("/out/tiles.zip")))
      .isInstanceOf(ConfigurationException.class);
  }

  @Test
  @DisplayName("rejects blank logical names")
  void rejects_blank_logical_names() {
    // When/Then
    assertThatThrownBy(() -> BatchJob.of(List.of(Path.of("/data/a.svs")), List.of("  "), Path.of("/out/tiles.zip")))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("blank");
  }

  @Test
  @DisplayName("rejects logical names that name no file")
  void rejects_logical_names_that_name_no_file() {
    // When/Then
    assertThatThrownBy(() -> BatchJob.of(List.of(Path.of("/data/a.svs")), List.of("/"), Path.of("/out/tiles.zip")))
      .isInstanceOf(ConfigurationException.class)
      .hasMessageContaining("/data/a.svs")
      .hasMessageContaining("does not name a file");
  }

  @Test
  @DisplayName("accepts an empty batch")
  void accepts_an_empty_batch() {
    // When
    var job = BatchJob.of(List.of(), List.of(), Path.of("/out/tiles.zip"));

    // Then
    assertThat(job.tasks()).isEmpty();
  }

  @Test
  @DisplayName("resolves relative paths to absolute ones")
  void resolves_relative_paths_to_absolute_ones() {
    // When
    var job = BatchJob.of(List.of(Path.of("slides/a.svs")), List.of("slideA"), Path.of("tiles.zip"));

    // Then
    assertThat(job.archivePath()).isAbsolute();
    assertThat(job.tasks().get(0).sourcePath()).isAbsolute().endsWith(Path.of("slides/a.svs"));
  }
}
