package logictools.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import logictools.catalog.CatalogStats;
import logictools.catalog.CatalogView;
import logictools.catalog.TableGroup;
import logictools.core.EnumerationOptions;
import logictools.core.EnumerationResult;
import logictools.core.SizeClassSummary;
import logictools.core.model.Formula;
import logictools.core.model.Operator;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
  private final boolean includeAllFormulas;

  JsonReportBuilder(boolean includeAllFormulas) {
    this.includeAllFormulas = includeAllFormulas;
  }

  String build(EnumerationResult result) {
    FormulaFormatter formatter = FormulaFormatter.forVariables(result.catalog().variableCount());
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result));
    root.put("termination_reason", result.terminationReason().label());
    root.put("size_classes", sizeClasses(result.sizeClasses()));
    root.put("verdicts", verdicts(result.catalogStats()));
    root.put("tables", tables(result.catalog(), formatter));
    return gson.toJson(root);
  }

  private Map<String, Object> meta(EnumerationResult result) {
    EnumerationOptions options = result.options();
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", result.elapsedMillis());
    meta.put("variable_count", options.variableCount());
    meta.put("operators", operatorSymbols(options));
    meta.put("max_operator_count", options.maxOperatorCount());
    meta.put("strategy", options.strategy().name().toLowerCase(Locale.ROOT));
    meta.put("formulas", result.formulasGenerated());
    meta.put("tables_found", result.tablesFound());
    meta.put("possible_tables", result.possibleTables());
    meta.put("complete", result.isComplete());
    return meta;
  }

  private static List<String> operatorSymbols(EnumerationOptions options) {
    List<String> symbols = new ArrayList<>();
    for (Operator operator : options.operators()) {
      symbols.add(operator.symbol());
    }
    return symbols;
  }

  private List<Map<String, Object>> sizeClasses(List<SizeClassSummary> summaries) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (SizeClassSummary summary : summaries) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("operator_count", summary.operatorCount());
      map.put("formulas", summary.formulas());
      map.put("new_tables", summary.newTables());
      map.put("tables_after", summary.tablesAfter());
      map.put("generation_ms", summary.generationMs());
      map.put("evaluation_ms", summary.evaluationMs());
      map.put("ingestion_ms", summary.ingestionMs());
      if (summary.partial()) {
        map.put("partial", true);
      }
      list.add(map);
    }
    return list;
  }

  private Map<String, Object> verdicts(CatalogStats stats) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("first", stats.firstSightings());
    map.put("dethroned", stats.dethronements());
    map.put("ties", stats.ties());
    map.put("losses", stats.losses());
    return map;
  }

  private List<Map<String, Object>> tables(CatalogView catalog, FormulaFormatter formatter) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (TableGroup group : catalog.listTruthTables()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("index", group.table().index());
      map.put("rows", group.table().rows());
      map.put("minimal_count", group.minimalCount());
      map.put("minimal", render(group.minimalFormulas(), formatter));
      map.put("formula_count", group.allFormulas().size());
      if (includeAllFormulas) {
        map.put("formulas", render(group.allFormulas(), formatter));
      }
      list.add(map);
    }
    return list;
  }

  private static List<String> render(List<Formula> formulas, FormulaFormatter formatter) {
    List<String> rendered = new ArrayList<>(formulas.size());
    for (Formula formula : formulas) {
      rendered.add(formatter.format(formula));
    }
    return rendered;
  }
}
