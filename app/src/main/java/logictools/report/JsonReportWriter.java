package logictools.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import logictools.core.EnumerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes {@code catalog.json}: run metadata, per-size-class counts and the minimal formulas. */
public final class JsonReportWriter implements ReportWriter {
  private static final Logger LOG = LoggerFactory.getLogger(JsonReportWriter.class);

  public static final String FILE_NAME = "catalog.json";

  private final JsonReportBuilder builder;

  public JsonReportWriter() {
    this(false);
  }

  /** @param includeAllFormulas also list every formula per table, not just the minimal ones */
  public JsonReportWriter(boolean includeAllFormulas) {
    this.builder = new JsonReportBuilder(includeAllFormulas);
  }

  public String render(EnumerationResult result) {
    return builder.build(result);
  }

  @Override
  public List<Path> write(EnumerationResult result, Path directory) throws IOException {
    Path target = ReportFiles.prepareDirectory(directory).resolve(FILE_NAME);
    ReportFiles.writeString(target, render(result));
    LOG.info("JSON report written to file {}", target);
    return List.of(target);
  }
}
