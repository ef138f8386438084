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
 * Fatal, batch-level configuration error.
 * <p>
 * Raised before any processing starts, typically when the number of input paths does not match
 * the number of logical names. No archive is created when this exception is thrown.
 * </p>
 */
public class ConfigurationException extends TilerException {

  public ConfigurationException(String message) {
    super(message);
  }
}
