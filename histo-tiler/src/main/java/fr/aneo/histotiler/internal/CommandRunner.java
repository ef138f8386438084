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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayDeque;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Runs an external command to completion and captures the tail of its output.
 * <p>
 * Standard error is merged into standard output. Every line is forwarded to the log at DEBUG
 * level; the last {@value #DIAGNOSTIC_LINES} lines are kept as a diagnostic for error messages.
 * There is no timeout: the command runs until it exits.
 * </p>
 */
class CommandRunner {
  private static final Logger logger = LoggerFactory.getLogger(CommandRunner.class);

  static final int DIAGNOSTIC_LINES = 20;

  /**
   * Starts {@code command} and waits for it to exit.
   *
   * @param command the program and its arguments
   * @return the exit code with the captured output tail
   * @throws IOException          if the command cannot be started or its output cannot be read
   * @throws InterruptedException if the calling thread is interrupted while waiting; the process
   *                              is destroyed before this is thrown
   */
  CommandResult run(List<String> command) throws IOException, InterruptedException {
    logger.debug("Executing command: {}", String.join(" ", command));

    var process = new ProcessBuilder(command).redirectErrorStream(true).start();
    var tail = new ArrayDeque<String>(DIAGNOSTIC_LINES);

    try {
      try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          logger.debug("[{}] {}", command.get(0), line);
          if (tail.size() == DIAGNOSTIC_LINES) tail.removeFirst();
          tail.addLast(line);
        }
      }
      int exitCode = process.waitFor();
      logger.debug("Process completed with exit code: {}", exitCode);
      return new CommandResult(exitCode, List.copyOf(tail));

    } catch (IOException | InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }
  }

  /**
   * Exit status and output tail of a finished command.
   *
   * @param exitCode the process exit code
   * @param output   last lines of the merged standard output and error
   */
  record CommandResult(int exitCode, List<String> output) {

    boolean succeeded() {
      return exitCode == 0;
    }

    String diagnostic() {
      return output.isEmpty() ? "no output" : String.join(System.lineSeparator(), output);
    }
  }
}
