package logictools.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import logictools.catalog.CatalogView;
import logictools.core.EnumerationResult;
import logictools.core.model.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Plain listing of every generated formula, one per line, in generation order. */
public final class TextReportWriter implements ReportWriter {
  private static final Logger LOG = LoggerFactory.getLogger(TextReportWriter.class);

  public static final String FILE_NAME = "formulalist.txt";

  @Override
  public List<Path> write(EnumerationResult result, Path directory) throws IOException {
    CatalogView catalog = result.catalog();
    FormulaFormatter formatter = FormulaFormatter.forVariables(catalog.variableCount());
    Path target = ReportFiles.prepareDirectory(directory).resolve(FILE_NAME);
    ReportFiles.write(
        target,
        writer -> {
          for (Formula formula : catalog.listAllFormulas()) {
            writer.write(formatter.format(formula));
            writer.newLine();
          }
        });
    LOG.info("Formula list written to file {}", target);
    return List.of(target);
  }
}
