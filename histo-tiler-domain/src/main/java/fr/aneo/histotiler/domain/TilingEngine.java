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

/**
 * The external tissue-tiling engine, treated as a black box.
 * <p>
 * The engine segments tissue from background, cuts fixed-size tiles and writes them as image
 * files somewhere below {@link TileConfig#outputRoot()}. The filesystem is its only return
 * channel: the exact directory is chosen by the engine and resolved by the caller afterwards.
 * </p>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li>Run to completion; there is no cancellation or timeout</li>
 *   <li>Throw {@link ExtractionException} when the run terminates abnormally</li>
 *   <li>Write only below the configured output root</li>
 * </ul>
 */
@FunctionalInterface
public interface TilingEngine {

  /**
   * Tiles one slide according to {@code config}.
   *
   * @param config the declarative configuration of this run; never {@code null}
   * @throws ExtractionException if the engine, or one of its subprocesses, fails
   */
  void execute(TileConfig config);
}
