package logictools.report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import logictools.catalog.CatalogView;
import logictools.catalog.TableGroup;
import logictools.core.EnumerationResult;
import logictools.core.model.Formula;
import logictools.core.model.TruthTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the catalog as a series of HTML pages, {@value #TABLES_PER_PAGE} truth tables per page.
 *
 * <p>Each table shows the full T/F grid, the minimal formula(s) and every formula that produced
 * it. Pages are named {@code truthtables1.htm}, {@code truthtables2.htm} and so on.
 */
public final class HtmlReportWriter implements ReportWriter {
  private static final Logger LOG = LoggerFactory.getLogger(HtmlReportWriter.class);

  public static final int TABLES_PER_PAGE = 256;
  public static final String FILE_PREFIX = "truthtables";
  public static final String FILE_SUFFIX = ".htm";

  private final int tablesPerPage;

  public HtmlReportWriter() {
    this(TABLES_PER_PAGE);
  }

  public HtmlReportWriter(int tablesPerPage) {
    if (tablesPerPage < 1) {
      throw new IllegalArgumentException("tablesPerPage must be positive");
    }
    this.tablesPerPage = tablesPerPage;
  }

  public static String pageFileName(int page) {
    return FILE_PREFIX + page + FILE_SUFFIX;
  }

  /** Number of pages needed for {@code tableCount} tables; never less than one. */
  public int pageCount(int tableCount) {
    return Math.max(1, (tableCount + tablesPerPage - 1) / tablesPerPage);
  }

  @Override
  public List<Path> write(EnumerationResult result, Path directory) throws IOException {
    CatalogView catalog = result.catalog();
    FormulaFormatter formatter = FormulaFormatter.forVariables(catalog.variableCount());
    List<TableGroup> groups = catalog.listTruthTables();
    Path target = ReportFiles.prepareDirectory(directory);

    int pages = pageCount(groups.size());
    List<Path> written = new ArrayList<>(pages);
    for (int page = 1; page <= pages; page++) {
      int from = (page - 1) * tablesPerPage;
      int to = Math.min(groups.size(), from + tablesPerPage);
      String html = renderPage(result, formatter, groups.subList(from, to), page, pages);
      written.add(ReportFiles.writeString(target.resolve(pageFileName(page)), html));
    }
    LOG.info("{} HTML page(s) written to {}", pages, target);
    return written;
  }

  String renderPage(
      EnumerationResult result,
      FormulaFormatter formatter,
      List<TableGroup> groups,
      int page,
      int pages) {
    CatalogView catalog = result.catalog();
    HtmlPage html = new HtmlPage("Truth tables, page " + page + " of " + pages);
    html.heading(1, "Truth tables for " + catalog.variableCount() + " variable(s)");
    html.paragraph(
        catalog.tableCount()
            + " of "
            + catalog.possibleTableCount()
            + " truth tables found from "
            + catalog.formulaCount()
            + " formulas; run ended: "
            + result.terminationReason().description()
            + ".");
    navigation(html, page, pages);

    for (TableGroup group : groups) {
      html.rule();
      appendGroup(html, formatter, group);
    }
    navigation(html, page, pages);
    return html.render();
  }

  private static void appendGroup(HtmlPage html, FormulaFormatter formatter, TableGroup group) {
    TruthTable table = group.table();
    html.heading(2, "Table " + table.index() + " (" + table.rows() + ")");

    List<String> names = formatter.variableNames();
    List<String> header = new ArrayList<>(names);
    header.add("Result");
    html.startTable().headerRow(header);
    for (int assignment = 0; assignment < table.length(); assignment++) {
      List<String> cells = new ArrayList<>(names.size() + 1);
      for (int v = 0; v < names.size(); v++) {
        cells.add(symbol(((assignment >>> v) & 1) == 1));
      }
      cells.add(symbol(table.valueAt(assignment)));
      html.dataRow(cells);
    }
    html.endTable();

    html.paragraph(
        "Minimum Formula(s) ("
            + group.minimalCount()
            + " binary operator(s)): "
            + formatter.formatAll(group.minimalFormulas(), "; "));
    html.paragraph("All formulas (" + group.allFormulas().size() + "):");
    List<String> all = new ArrayList<>(group.allFormulas().size());
    for (Formula formula : group.allFormulas()) {
      all.add(formatter.format(formula));
    }
    html.list(all);
  }

  private static void navigation(HtmlPage html, int page, int pages) {
    if (page > 1) {
      html.link(pageFileName(page - 1), "Previous page");
    }
    if (page < pages) {
      html.link(pageFileName(page + 1), "Next page");
    }
  }

  private static String symbol(boolean value) {
    return value ? "T" : "F";
  }
}
