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

class TaskOutcomeTest {

  @Test
  @DisplayName("maps each outcome to its terminal status")
  void maps_each_outcome_to_its_terminal_status() {
    assertThat(TaskOutcome.done(3).status()).isEqualTo(TaskStatus.DONE);
    assertThat(TaskOutcome.skipped("blank slide").status()).isEqualTo(TaskStatus.SKIPPED);
    assertThat(TaskOutcome.failed(new ExtractionException("boom")).status()).isEqualTo(TaskStatus.FAILED);
  }

  @Test
  @DisplayName("failed outcome falls back to toString when the exception has no message")
  void failed_outcome_uses_to_string_without_message() {
    // When
    var outcome = TaskOutcome.failed(new IllegalStateException());

    // Then
    assertThat(outcome.message()).isEqualTo("java.lang.IllegalStateException");
    assertThat(TaskOutcome.failed(null).message()).isEqualTo("Unknown error");
  }

  @Test
  @DisplayName("only done outcomes carry archived tiles")
  void only_done_outcomes_carry_archived_tiles() {
    assertThat(TaskOutcome.done(5).tilesArchived()).isEqualTo(5);
    assertThat(TaskOutcome.skipped("missing").tilesArchived()).isZero();
    assertThat(TaskOutcome.failed(new RuntimeException("x")).tilesArchived()).isZero();
    assertThatThrownBy(() -> TaskOutcome.done(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("batch report counts outcomes and archived tiles")
  void batch_report_counts_outcomes_and_tiles() {
    // Given
    var a = new ImageTask(1, Path.of("/data/a.svs"), "slideA");
    var b = new ImageTask(2, Path.of("/data/b.svs"), "slideB");
    var c = new ImageTask(3, Path.of("/data/c.svs"), "slideC");

    // When
    var report = new BatchReport(Path.of("/out/tiles.zip"), 1024, List.of(
      BatchReport.TaskReport.of(a, TaskOutcome.done(3)),
      BatchReport.TaskReport.of(b, TaskOutcome.skipped("Input file missing")),
      BatchReport.TaskReport.of(c, TaskOutcome.done(2))));

    // Then
    assertThat(report.count(TaskStatus.DONE)).isEqualTo(2);
    assertThat(report.count(TaskStatus.SKIPPED)).isEqualTo(1);
    assertThat(report.count(TaskStatus.FAILED)).isZero();
    assertThat(report.tilesArchived()).isEqualTo(5);
    assertThat(report.tasks().get(1).detail()).isEqualTo("Input file missing");
    assertThat(report.tasks().get(0).detail()).isNull();
  }
}
