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

import fr.aneo.histotiler.domain.ArchiveException;
import fr.aneo.histotiler.domain.PackagingException;
import org.apache.commons.compress.archivers.zip.ScatterZipOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntryRequest;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * The single shared output archive of a batch.
 * <p>
 * The archive is created empty (truncating any existing file) when the batch starts, receives the
 * tiles of every successful task, and is finalized by {@link #close()} once all tasks are done.
 * It is never read back during the batch.
 * </p>
 *
 * <h2>Single Writer</h2>
 * <p>
 * Writes go through {@link #append(List)}. The entries of one call are first compressed into a
 * private staging file, outside the lock. They are then copied into the archive under an
 * exclusive lock, so the entries of one task are written together and never interleaved with
 * another task's entries.
 * </p>
 * <p>
 * A call that fails while staging leaves the archive untouched: a task contributes all its
 * entries or none.
 * </p>
 *
 * <h2>Entries</h2>
 * <ul>
 *   <li>Entries are DEFLATE-compressed</li>
 *   <li>Entry names are not deduplicated: appending the same item twice yields two entries</li>
 *   <li>An archive closed without any entry is a valid, empty ZIP file</li>
 * </ul>
 */
final class TileArchive implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(TileArchive.class);

  private final Path path;
  private final ZipArchiveOutputStream output;
  private final ReentrantLock writeLock = new ReentrantLock();
  private int entryCount;
  private boolean closed;

  private TileArchive(Path path, ZipArchiveOutputStream output) {
    this.path = path;
    this.output = output;
  }

  /**
   * Creates a fresh, empty archive at {@code path}, replacing any existing file.
   *
   * @param path the archive file; parent directories are created if needed
   * @return the open archive
   * @throws ArchiveException if the file cannot be created
   */
  static TileArchive create(Path path) {
    requireNonNull(path, "path cannot be null");
    try {
      var parent = path.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.deleteIfExists(path);

      var output = new ZipArchiveOutputStream(path.toFile());
      output.setMethod(ZipArchiveOutputStream.DEFLATED);
      logger.info("Created ZIP: {}", path);
      return new TileArchive(path, output);

    } catch (IOException e) {
      throw new ArchiveException("Failed to create archive: " + path, e);
    }
  }

  /**
   * Appends the given files as one contiguous group of entries.
   *
   * @param items entry names with the files holding their content
   * @return number of entries written
   * @throws PackagingException if a file cannot be read; no entry of {@code items} reaches the archive
   * @throws ArchiveException if the staged entries cannot be copied into the archive
   * @throws IllegalStateException if the archive is already closed
   */
  int append(List<Item> items) {
    requireNonNull(items, "items cannot be null");
    checkOpen();
    if (items.isEmpty()) return 0;

    var staging = createStagingFile();
    ScatterZipOutputStream scatter = null;
    try {
      scatter = ScatterZipOutputStream.fileBased(staging.toFile());
      for (var item : items) {
        stage(scatter, item);
      }
      commit(scatter, items.size());
      return items.size();

    } catch (IOException e) {
      throw new PackagingException("Failed to stage " + items.size() + " entries for " + path, e);
    } finally {
      discard(scatter, staging);
    }
  }

  Path path() {
    return path;
  }

  int entryCount() {
    writeLock.lock();
    try {
      return entryCount;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Writes the central directory and closes the file. Subsequent calls have no effect.
   *
   * @throws ArchiveException if the archive cannot be finalized
   */
  @Override
  public void close() {
    writeLock.lock();
    try {
      if (closed) return;
      closed = true;
      output.close();
      logger.debug("Archive {} closed with {} entries", path, entryCount);
    } catch (IOException e) {
      throw new ArchiveException("Failed to finalize archive: " + path, e);
    } finally {
      writeLock.unlock();
    }
  }

  private void stage(ScatterZipOutputStream scatter, Item item) {
    try {
      var input = Files.newInputStream(item.source());
      var entry = new ZipArchiveEntry(item.entryName());
      entry.setMethod(ZipArchiveEntry.DEFLATED);
      scatter.addArchiveEntry(ZipArchiveEntryRequest.createZipArchiveEntryRequest(entry, () -> input));
      logger.trace("Staged ZIP entry: {} <- {}", item.entryName(), item.source());
    } catch (IOException e) {
      throw new PackagingException("Failed to add " + item.source() + " to archive as " + item.entryName(), e);
    }
  }

  private void commit(ScatterZipOutputStream scatter, int entries) {
    writeLock.lock();
    try {
      checkOpen();
      scatter.writeTo(output);
      entryCount += entries;
    } catch (IOException e) {
      throw new ArchiveException("Failed to write " + entries + " entries into archive: " + path, e);
    } finally {
      writeLock.unlock();
    }
  }

  private void checkOpen() {
    writeLock.lock();
    try {
      if (closed) {
        throw new IllegalStateException("Archive " + path + " is already closed");
      }
    } finally {
      writeLock.unlock();
    }
  }

  private Path createStagingFile() {
    try {
      return Files.createTempFile(path.toAbsolutePath().getParent(), ".staging-", ".zip.part");
    } catch (IOException e) {
      throw new PackagingException("Failed to create staging file next to " + path, e);
    }
  }

  private static void discard(ScatterZipOutputStream scatter, Path staging) {
    if (scatter != null) {
      try {
        scatter.close();
      } catch (IOException e) {
        logger.debug("Failed to close staging stream {}", staging, e);
      }
    }
    try {
      Files.deleteIfExists(staging);
    } catch (IOException e) {
      logger.warn("Failed to delete staging file {}", staging, e);
    }
  }

  record Item(String entryName, Path source) {
    Item {
      requireNonNull(entryName, "entryName cannot be null");
      requireNonNull(source, "source cannot be null");
    }
  }
}
