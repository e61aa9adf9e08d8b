package nl.adgroot.pdftojpeg;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scratch directory for one invocation. Each task writes only below {@link #taskDir(String)};
 * {@link #close()} removes the whole tree.
 */
public final class Workspace implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(Workspace.class);
  private static final String PREFIX = "pdf2jpeg-";

  private final Path root;

  private Workspace(Path root) {
    this.root = root;
  }

  /**
   * @param parentDir where to create the workspace; null for the system temp directory
   */
  public static Workspace create(String parentDir) throws IOException {
    Path root;
    if (parentDir == null || parentDir.isBlank()) {
      root = Files.createTempDirectory(PREFIX);
    } else {
      Path parent = Path.of(parentDir);
      Files.createDirectories(parent);
      root = Files.createTempDirectory(parent, PREFIX);
    }
    LOG.debug("Workspace at {}", root.toAbsolutePath());
    return new Workspace(root);
  }

  public Path root() {
    return root;
  }

  /** Work directory of one task, derived from its (unique) id. */
  public Path taskDir(String taskId) {
    Path dir = root.resolve(taskId).normalize();
    if (!dir.startsWith(root) || dir.equals(root)) {
      throw new IllegalArgumentException("Task id escapes the workspace: " + taskId);
    }
    return dir;
  }

  @Override
  public void close() {
    if (!Files.exists(root)) return;
    try (Stream<Path> walk = Files.walk(root)) {
      walk.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
    } catch (IOException e) {
      LOG.warn("Could not clean up workspace {}: {}", root, e.getMessage());
    }
    if (Files.exists(root)) {
      LOG.warn("Workspace {} was not fully removed", root);
    }
  }
}
