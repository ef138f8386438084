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

import com.google.gson.*;
import fr.aneo.histotiler.domain.BatchReport;
import fr.aneo.histotiler.domain.TaskStatus;
import fr.aneo.histotiler.domain.TilerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Writes a {@link BatchReport} as JSON using Gson.
 * <pre>{@code
 * {
 *   "archivePath": "/data/tiles.zip",
 *   "archiveSizeBytes": 52311,
 *   "done": 1,
 *   "skipped": 1,
 *   "failed": 0,
 *   "tilesArchived": 3,
 *   "tasks": [
 *     {"logicalName": "slideA", "sourcePath": "/data/a.svs", "status": "DONE", "tilesArchived": 3},
 *     {"logicalName": "slideB", "sourcePath": "/data/b.svs", "status": "SKIPPED", "tilesArchived": 0,
 *      "detail": "Input file missing: /data/b.svs"}
 *   ]
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is thread-safe. The internal Gson instance is immutable.
 * </p>
 */
public final class GsonBatchReportWriter {
  private static final Logger logger = LoggerFactory.getLogger(GsonBatchReportWriter.class);

  private final Gson gson;

  public GsonBatchReportWriter() {
    this.gson = new GsonBuilder()
      .registerTypeHierarchyAdapter(Path.class, new PathAdapter())
      .setPrettyPrinting()
      .create();
  }

  /**
   * Serializes {@code report} to a JSON string.
   *
   * @param report the report; must not be {@code null}
   * @return the JSON document
   */
  public String toJson(BatchReport report) {
    requireNonNull(report, "report cannot be null");

    var root = new JsonObject();
    root.add("archivePath", gson.toJsonTree(report.archivePath(), Path.class));
    root.addProperty("archiveSizeBytes", report.archiveSizeBytes());
    root.addProperty("done", report.count(TaskStatus.DONE));
    root.addProperty("skipped", report.count(TaskStatus.SKIPPED));
    root.addProperty("failed", report.count(TaskStatus.FAILED));
    root.addProperty("tilesArchived", report.tilesArchived());
    root.add("tasks", gson.toJsonTree(report.tasks()));
    return gson.toJson(root);
  }

  /**
   * Writes {@code report} to {@code target}, replacing any existing file.
   *
   * @param report the report
   * @param target the JSON file; parent directories are created if needed
   * @throws TilerException if the file cannot be written
   */
  public void write(BatchReport report, Path target) {
    try {
      var parent = target.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(target, toJson(report), UTF_8);
      logger.info("Batch summary written to {}", target);
    } catch (IOException e) {
      throw new TilerException("Failed to write batch summary to " + target, e);
    }
  }

  /**
   * Gson adapter writing paths as plain strings.
   */
  private static final class PathAdapter implements JsonSerializer<Path>, JsonDeserializer<Path> {

    @Override
    public JsonElement serialize(Path src, Type typeOfSrc, JsonSerializationContext context) {
      return new JsonPrimitive(src.toString());
    }

    @Override
    public Path deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
      if (!json.isJsonPrimitive() || !json.getAsJsonPrimitive().isString()) {
        throw new JsonParseException("Path must be a string");
      }
      return Path.of(json.getAsString());
    }
  }
}
