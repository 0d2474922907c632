package logictools.report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Output-directory handling shared by the report writers.
 *
 * <p>Every file is written to a temporary sibling first and moved into place, so a failed write
 * never leaves a truncated report behind.
 */
public final class ReportFiles {
  private static final String[] DEFAULT_SUBDIRECTORIES = {"Documents", "Logic Tools"};

  private ReportFiles() {}

  /** {@code ~/Documents/Logic Tools}. */
  public static Path defaultOutputDirectory() {
    Path dir = Path.of(System.getProperty("user.home"));
    for (String sub : DEFAULT_SUBDIRECTORIES) {
      dir = dir.resolve(sub);
    }
    return dir;
  }

  public static Path prepareDirectory(Path directory) throws IOException {
    Path target = directory.toAbsolutePath().normalize();
    Files.createDirectories(target);
    return target;
  }

  /** Callback that fills a file through a writer. */
  @FunctionalInterface
  public interface Content {
    void writeTo(BufferedWriter writer) throws IOException;
  }

  public static Path write(Path target, Content content) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, target.getFileName().toString() + "-", ".tmp");
    boolean success = false;
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        content.writeTo(writer);
      }
      moveIntoPlace(temp, target);
      success = true;
    } finally {
      if (!success) {
        Files.deleteIfExists(temp);
      }
    }
    return target;
  }

  public static Path writeString(Path target, String text) throws IOException {
    return write(target, writer -> writer.write(text));
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
