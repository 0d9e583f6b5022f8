package com.flamingo.ai.docpipeline.service.storage;

import com.flamingo.ai.docpipeline.config.PipelineConfig;
import com.flamingo.ai.docpipeline.exception.InsufficientStorageException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Scratch space on the work volume. Every job or tool run gets its own directory, which the owner
 * releases on every exit path.
 */
@Service
@Slf4j
public class WorkspaceStorage {

  private final Path root;

  @Autowired
  public WorkspaceStorage(PipelineConfig pipelineConfig) {
    this(Path.of(pipelineConfig.getStorage().getWorkDir()));
  }

  public WorkspaceStorage(Path root) {
    this.root = root;
  }

  /** Creates a fresh directory for one job or tool run. */
  public Path createWorkDirectory(String owner) {
    try {
      Files.createDirectories(root);
      return Files.createTempDirectory(root, sanitize(owner) + "-");
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create work directory under " + root, e);
    }
  }

  /** Usable bytes on the volume holding {@code dir}. */
  public long usableSpace(Path dir) {
    try {
      return Files.getFileStore(dir).getUsableSpace();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot query free space for " + dir, e);
    }
  }

  /**
   * Fails fast when writing {@code bytes} into {@code dir} would leave less than {@code reserve}
   * free.
   */
  public void ensureSpace(Path dir, long bytes, long reserve) {
    long available = usableSpace(dir);
    if (available < bytes + reserve) {
      throw new InsufficientStorageException(bytes + reserve, available);
    }
  }

  /** Deletes a work directory. Best-effort: failures are logged, never thrown. */
  public void release(Path dir) {
    if (dir == null) {
      return;
    }
    try {
      FileUtils.deleteDirectory(dir.toFile());
      log.debug("Released work directory {}", dir);
    } catch (IOException e) {
      log.warn("Failed to delete work directory {}: {}", dir, e.getMessage());
    }
  }

  /** Deletes a single file. Best-effort. */
  public void delete(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete {}: {}", file, e.getMessage());
    }
  }

  public Path getRoot() {
    return root;
  }

  private static String sanitize(String owner) {
    String cleaned = owner.replaceAll("[^A-Za-z0-9._-]", "_");
    return cleaned.length() > 40 ? cleaned.substring(0, 40) : cleaned;
  }
}
