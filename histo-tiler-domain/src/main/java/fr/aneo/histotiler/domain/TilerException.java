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
 * Base runtime exception for all tiling batch errors.
 * <p>
 * {@code TilerException} is thrown when a step of the tiling pipeline cannot complete:
 * </p>
 * <ul>
 *   <li>Invalid batch configuration (mismatched inputs and names)</li>
 *   <li>Unreadable or malformed slide files</li>
 *   <li>Abnormal termination of the tiling engine</li>
 *   <li>I/O failures while writing the shared archive</li>
 * </ul>
 *
 * <h2>Exception Hierarchy</h2>
 * <p>
 * This exception extends {@link RuntimeException}, making it an unchecked exception. Per-task
 * subclasses are caught at the task boundary and converted into a {@link TaskOutcome}; only
 * {@link ConfigurationException} and {@link ArchiveException} abort a batch.
 * </p>
 *
 * @see TaskOutcome
 * @see TaskSkippedException
 */
public class TilerException extends RuntimeException {

  /**
   * Creates a new exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public TilerException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified error message and cause.
   * <p>
   * This constructor is typically used to wrap lower-level exceptions (e.g., {@link java.io.IOException})
   * with additional context about the tiling step that failed.
   * </p>
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public TilerException(String message, Throwable cause) {
    super(message, cause);
  }
}
