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

/**
 * Confirms that a slide file can be opened by the whole-slide image decoder.
 * <p>
 * Validation runs strictly before the tiling engine is invoked, since the engine's own error
 * reporting for malformed files is unreliable. Implementations open the file read-only and must
 * release any handle on both the success and the failure path.
 * </p>
 */
@FunctionalInterface
public interface SlideValidator {

  /**
   * Opens and immediately closes the slide.
   *
   * @param slide the slide file; must exist
   * @throws InvalidImageException if the decoder rejects the file; the message carries the
   *                               decoder's diagnostic
   */
  void validate(Path slide);
}
