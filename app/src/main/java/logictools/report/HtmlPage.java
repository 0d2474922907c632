package logictools.report;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;

/** Minimal HTML document builder. All text passed in is escaped. */
final class HtmlPage {
  private static final Escaper ESCAPER = HtmlEscapers.htmlEscaper();

  private final StringBuilder body = new StringBuilder();
  private final String title;

  HtmlPage(String title) {
    this.title = title;
  }

  HtmlPage heading(int level, String text) {
    body.append("<h").append(level).append('>');
    body.append(ESCAPER.escape(text));
    body.append("</h").append(level).append(">\n");
    return this;
  }

  HtmlPage paragraph(String text) {
    body.append("<p>").append(ESCAPER.escape(text)).append("</p>\n");
    return this;
  }

  HtmlPage link(String href, String text) {
    body.append("<a href=\"").append(ESCAPER.escape(href)).append("\">");
    body.append(ESCAPER.escape(text)).append("</a>\n");
    return this;
  }

  HtmlPage startTable() {
    body.append("<table border=\"1\">\n");
    return this;
  }

  HtmlPage headerRow(Iterable<String> cells) {
    return row("th", cells);
  }

  HtmlPage dataRow(Iterable<String> cells) {
    return row("td", cells);
  }

  HtmlPage endTable() {
    body.append("</table>\n");
    return this;
  }

  HtmlPage list(Iterable<String> items) {
    body.append("<ul>\n");
    for (String item : items) {
      body.append("<li>").append(ESCAPER.escape(item)).append("</li>\n");
    }
    body.append("</ul>\n");
    return this;
  }

  HtmlPage rule() {
    body.append("<hr>\n");
    return this;
  }

  String render() {
    return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<title>"
        + ESCAPER.escape(title)
        + "</title>\n</head>\n<body>\n"
        + body
        + "</body>\n</html>\n";
  }

  private HtmlPage row(String tag, Iterable<String> cells) {
    body.append("<tr>");
    for (String cell : cells) {
      body.append('<').append(tag).append('>');
      body.append(ESCAPER.escape(cell));
      body.append("</").append(tag).append('>');
    }
    body.append("</tr>\n");
    return this;
  }
}
