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
package fr.aneo.histotiler.internal.cli;

import fr.aneo.histotiler.domain.ConfigurationException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Command-line arguments of a tiling batch.
 * <p>
 * Accepted options, in either {@code --name value} or {@code --name=value} form:
 * </p>
 * <ul>
 *   <li>{@code --input <path>}: a slide to process; repeatable</li>
 *   <li>{@code --original_name <name>}: the logical name of the input at the same position; repeatable</li>
 *   <li>{@code --output_zip <path>}: the output archive; required</li>
 *   <li>{@code --summary_json <path>}: where to write the batch report as JSON; optional</li>
 * </ul>
 * <p>
 * Pairing inputs with names is checked later, by {@link fr.aneo.histotiler.domain.BatchJob#of}.
 * </p>
 *
 * @param inputs        input slide paths, absolute
 * @param originalNames logical names
 * @param outputZip     output archive path, absolute
 * @param summaryJson   optional JSON report path, absolute
 */
record BatchArguments(List<Path> inputs, List<String> originalNames, Path outputZip, Optional<Path> summaryJson) {

  static final String INPUT = "--input";
  static final String ORIGINAL_NAME = "--original_name";
  static final String OUTPUT_ZIP = "--output_zip";
  static final String SUMMARY_JSON = "--summary_json";

  /**
   * Parses {@code args}.
   *
   * @param args the raw command-line arguments
   * @return the parsed arguments
   * @throws ConfigurationException on unknown options, options without value, or a missing
   *                                {@code --output_zip}
   */
  static BatchArguments parse(String... args) {
    var inputs = new ArrayList<Path>();
    var names = new ArrayList<String>();
    Path outputZip = null;
    Path summaryJson = null;

    for (int i = 0; i < args.length; i++) {
      var arg = args[i];
      String name;
      String value;

      int equals = arg.indexOf('=');
      if (arg.startsWith("--") && equals > 0) {
        name = arg.substring(0, equals);
        value = arg.substring(equals + 1);
      } else {
        name = arg;
        if (i + 1 >= args.length) {
          throw new ConfigurationException("Missing value for option " + name);
        }
        value = args[++i];
      }

      switch (name) {
        case INPUT -> inputs.add(toPath(value, name));
        case ORIGINAL_NAME -> names.add(value);
        case OUTPUT_ZIP -> outputZip = toPath(value, name);
        case SUMMARY_JSON -> summaryJson = toPath(value, name);
        default -> throw new ConfigurationException("Unknown option: " + name);
      }
    }

    if (outputZip == null) {
      throw new ConfigurationException("Option " + OUTPUT_ZIP + " is required");
    }
    return new BatchArguments(List.copyOf(inputs), List.copyOf(names), outputZip, Optional.ofNullable(summaryJson));
  }

  private static Path toPath(String value, String option) {
    if (value.isBlank()) {
      throw new ConfigurationException("Empty path for option " + option);
    }
    return Path.of(value).toAbsolutePath().normalize();
  }
}
