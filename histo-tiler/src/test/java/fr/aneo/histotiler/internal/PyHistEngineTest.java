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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class PyHistEngineTest {

  private CommandRunner commandRunner;
  private PyHistEngine engine;
  private TileConfig config;

  @BeforeEach
  void setUp() {
    commandRunner = mock(CommandRunner.class);
    engine = new PyHistEngine(List.of("python", "pyhist.py"), commandRunner);
    config = new TileJobConfigurator().configure(Path.of("/data/slideA.svs"), Path.of("/out/output/task-1"));
  }

  @Test
  @DisplayName("translates the configuration into engine arguments")
  void translates_configuration_into_arguments() {
    // When
    var command = engine.commandLine(config);

    // Then
    assertThat(command).containsExactly(
      "python", "pyhist.py",
      "--patch-size", "256",
      "--method", "otsu",
      "--content-threshold", "0.1",
      "--output-downsample", "8",
      "--mask-downsample", "8",
      "--borders", "0000",
      "--corners", "1010",
      "--pct-bc", "1",
      "--k-const", "1000",
      "--minimum_segmentsize", "1000",
      "--save-patches",
      "--save-mask",
      "--info", "verbose",
      "--output", "/out/output/task-1",
      "--format", "png",
      "/data/slideA.svs");
  }

  @Test
  @DisplayName("runs the engine once per configuration")
  void runs_engine_once() throws Exception {
    // Given
    when(commandRunner.run(anyList())).thenReturn(new CommandRunner.CommandResult(0, List.of("done")));

    // When
    engine.execute(config);

    // Then
    verify(commandRunner).run(engine.commandLine(config));
  }

  @Test
  @DisplayName("non zero exit code is an extraction failure with the output tail")
  void non_zero_exit_is_extraction_failure() throws Exception {
    // Given
    when(commandRunner.run(anyList())).thenReturn(new CommandRunner.CommandResult(2, List.of("Traceback", "ValueError: bad slide")));

    // When/Then
    assertThatThrownBy(() -> engine.execute(config))
      .isInstanceOf(ExtractionException.class)
      .hasMessageContaining("exit code 2")
      .hasMessageContaining("ValueError: bad slide");
  }

  @Test
  @DisplayName("engine that cannot start is an extraction failure")
  void engine_that_cannot_start_is_extraction_failure() throws Exception {
    // Given
    when(commandRunner.run(anyList())).thenThrow(new IOException("No such file"));

    // When/Then
    assertThatThrownBy(() -> engine.execute(config))
      .isInstanceOf(ExtractionException.class)
      .hasMessageContaining("python")
      .hasCauseInstanceOf(IOException.class);
  }
}
