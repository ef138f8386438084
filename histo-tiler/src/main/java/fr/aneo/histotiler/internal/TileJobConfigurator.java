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

import fr.aneo.histotiler.domain.SegmentationMethod;
import fr.aneo.histotiler.domain.TileConfig;
import fr.aneo.histotiler.domain.TileFormat;
import fr.aneo.histotiler.domain.Verbosity;

import java.nio.file.Path;

/**
 * Builds the {@link TileConfig} of one task from the fixed batch-wide defaults.
 * <p>
 * This is a pure mapping: no I/O and no failure modes. It is kept apart from the extraction step
 * so that the defaults can be audited and tested on their own. In particular, the segmentation
 * method is fixed here and is not changed by the availability of the native segmentation binary.
 * </p>
 */
final class TileJobConfigurator {
  static final int PATCH_SIZE = 256;
  static final SegmentationMethod METHOD = SegmentationMethod.OTSU;
  static final double CONTENT_THRESHOLD = 0.1;
  static final int OUTPUT_DOWNSAMPLE = 8;
  static final int MASK_DOWNSAMPLE = 8;
  static final String BORDERS = "0000";
  static final String CORNERS = "1010";
  static final int BORDER_CORNER_PERCENTAGE = 1;
  static final int SEGMENTATION_CONSTANT = 1000;
  static final int MINIMUM_SEGMENT_SIZE = 1000;
  static final Verbosity VERBOSITY = Verbosity.VERBOSE;
  static final TileFormat FORMAT = TileFormat.PNG;

  TileConfig configure(Path sourcePath, Path outputRoot) {
    return new TileConfig(
      sourcePath,
      PATCH_SIZE,
      METHOD,
      CONTENT_THRESHOLD,
      OUTPUT_DOWNSAMPLE,
      MASK_DOWNSAMPLE,
      BORDERS,
      CORNERS,
      BORDER_CORNER_PERCENTAGE,
      SEGMENTATION_CONSTANT,
      MINIMUM_SEGMENT_SIZE,
      true,
      false,
      false,
      false,
      true,
      false,
      VERBOSITY,
      outputRoot,
      FORMAT);
  }
}
