package logictools.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import logictools.core.EnumerationResult;

/** Renders a finished run into files under an output directory. */
public interface ReportWriter {

  /** Writes the report and returns the files it produced. */
  List<Path> write(EnumerationResult result, Path directory) throws IOException;
}
