package logictools.report;

import java.util.Locale;

/** Output formats selectable with {@code --output}. */
public enum ReportFormat {
  TEXT {
    @Override
    public ReportWriter writer() {
      return new TextReportWriter();
    }
  },
  HTML {
    @Override
    public ReportWriter writer() {
      return new HtmlReportWriter();
    }
  },
  JSON {
    @Override
    public ReportWriter writer() {
      return new JsonReportWriter();
    }
  };

  public abstract ReportWriter writer();

  public static ReportFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return TEXT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text", "txt" -> TEXT;
      case "html", "htm" -> HTML;
      case "json" -> JSON;
      default -> throw new IllegalArgumentException("Invalid output: " + raw);
    };
  }
}
