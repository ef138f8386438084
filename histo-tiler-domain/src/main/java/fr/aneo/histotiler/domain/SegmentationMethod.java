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
 * Tissue/background separation methods understood by the tiling engine.
 */
public enum SegmentationMethod {
  /** Otsu thresholding on the downsampled slide. Needs no native binary. */
  OTSU("otsu");

  private final String engineName;

  SegmentationMethod(String engineName) {
    this.engineName = engineName;
  }

  /**
   * Returns the name the tiling engine expects for this method.
   *
   * @return the engine-side name, e.g. {@code "otsu"}
   */
  public String engineName() {
    return engineName;
  }
}
