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
 * Extraction completed but produced no tile files, e.g. for a blank or fully-background slide.
 */
public class NoTilesProducedException extends TaskSkippedException {

  public NoTilesProducedException(Path tileDirectory) {
    super("No tiles to archive in " + tileDirectory);
  }
}
