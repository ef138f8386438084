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

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Immutable, declarative parameter set for one tiling engine run.
 * <p>
 * A {@code TileConfig} is built once per {@link ImageTask} from batch-wide defaults and the
 * task's output root, then handed to the {@link TilingEngine}. It is never mutated after creation.
 * </p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><strong>Patch geometry:</strong> {@code patchSize} in pixels at full resolution</li>
 *   <li><strong>Segmentation:</strong> {@code method}, {@code contentThreshold} (fraction of tissue
 *       a tile must contain), {@code segmentationConstant} and {@code minimumSegmentSize} for the
 *       graph-based method</li>
 *   <li><strong>Downsampling:</strong> {@code outputDownsample} for tiles and {@code maskDownsample}
 *       for the segmentation mask</li>
 *   <li><strong>Background sampling:</strong> {@code borders} and {@code corners} are 4-character
 *       masks of {@code 0}/{@code 1} (top, right, bottom, left) selecting where background is
 *       estimated, {@code borderCornerPercentage} the share of the slide sampled there</li>
 *   <li><strong>Outputs:</strong> which tile categories and side images to keep, the tile
 *       {@code format}, the engine {@code verbosity} and the {@code outputRoot} directory</li>
 * </ul>
 *
 * @param slidePath              the slide to tile
 * @param patchSize              tile edge length, in pixels; strictly positive
 * @param method                 segmentation method
 * @param contentThreshold       minimum tissue fraction of a kept tile, in {@code [0, 1]}
 * @param outputDownsample       downsample factor of saved tiles; strictly positive
 * @param maskDownsample         downsample factor of the segmentation mask; strictly positive
 * @param borders                border sampling mask, e.g. {@code "0000"}
 * @param corners                corner sampling mask, e.g. {@code "1010"}
 * @param borderCornerPercentage percentage of the slide used for border/corner sampling
 * @param segmentationConstant   scale constant of the graph segmentation
 * @param minimumSegmentSize     smallest segment kept by the graph segmentation
 * @param savePatches            whether tiles are written at all
 * @param saveBlank              whether background tiles are kept
 * @param saveNonSquare          whether truncated edge tiles are kept
 * @param saveTileCrossedImage   whether an overview image with tile grid is written
 * @param saveMask               whether the segmentation mask is written
 * @param saveEdges              whether the edge image is written
 * @param verbosity              engine logging level
 * @param outputRoot             directory under which the engine writes its outputs
 * @param format                 tile image format
 */
public record TileConfig(
  Path slidePath,
  int patchSize,
  SegmentationMethod method,
  double contentThreshold,
  int outputDownsample,
  int maskDownsample,
  String borders,
  String corners,
  int borderCornerPercentage,
  int segmentationConstant,
  int minimumSegmentSize,
  boolean savePatches,
  boolean saveBlank,
  boolean saveNonSquare,
  boolean saveTileCrossedImage,
  boolean saveMask,
  boolean saveEdges,
  Verbosity verbosity,
  Path outputRoot,
  TileFormat format
) {

  public TileConfig {
    requireNonNull(slidePath, "slidePath cannot be null");
    requireNonNull(method, "method cannot be null");
    requireNonNull(verbosity, "verbosity cannot be null");
    requireNonNull(outputRoot, "outputRoot cannot be null");
    requireNonNull(format, "format cannot be null");
    requirePositive(patchSize, "patchSize");
    requirePositive(outputDownsample, "outputDownsample");
    requirePositive(maskDownsample, "maskDownsample");
    if (contentThreshold < 0.0 || contentThreshold > 1.0) {
      throw new IllegalArgumentException("contentThreshold must be in [0, 1], got: " + contentThreshold);
    }
    requireSideMask(borders, "borders");
    requireSideMask(corners, "corners");
  }

  /**
   * Returns the slide file name without its extension, the name the engine derives its own
   * output folders from.
   *
   * @return the slide stem
   */
  public String slideStem() {
    var name = slidePath.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static void requirePositive(int value, String name) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be strictly positive, got: " + value);
    }
  }

  private static void requireSideMask(String mask, String name) {
    if (mask == null || !mask.matches("[01]{4}")) {
      throw new IllegalArgumentException(name + " must be 4 characters of '0' or '1', got: " + mask);
    }
  }
}
